package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Project-scoped lexical scopes rooted at a permanent global scope.
 *
 * Types live on the {@link Symbol}, so a name redefined in an inner scope does
 * not change the type seen from the outer scope. Owned by the caller; reset
 * with {@link #clear()}.
 */
public class SymbolTable {
    public static final int GLOBAL_SCOPE_ID = 0;

    private final Map<Integer, Scope> scopes = new HashMap<>();
    private int currentScopeId;
    private int nextScopeId;

    public SymbolTable() {
        reset();
    }

    // ============================================
    // 1. SCOPES
    // ============================================

    public int enterScope(ScopeType type) {
        return enterScope(type, null);
    }

    /**
     * @param type scope kind
     * @param name function or class name, may be null
     * @return id of the new current scope
     */
    public int enterScope(ScopeType type, String name) {
        int id = nextScopeId++;
        scopes.put(id, new Scope(id, currentScopeId, type, name));
        currentScopeId = id;
        return id;
    }

    /**
     * @throws IllegalStateException when the current scope is the global scope
     */
    public void exitScope() {
        Integer parent = current().getParentId();
        if (parent == null) {
            throw new IllegalStateException("Cannot exit global scope");
        }
        currentScopeId = parent;
    }

    public int currentScopeId() {
        return currentScopeId;
    }

    public ScopeType currentScopeType() {
        return current().getType();
    }

    public List<Symbol> currentScopeSymbols() {
        return current().getSymbols();
    }

    public Scope getScope(int scopeId) {
        return scopes.get(scopeId);
    }

    // ============================================
    // 2. SYMBOLS
    // ============================================

    /**
     * Define a name in the current scope, shadowing outer definitions.
     */
    public Symbol defineSymbol(String name, int nodeId, TypeInfo type) {
        Symbol symbol = new Symbol(name, currentScopeId, nodeId, type);
        current().addSymbol(symbol);
        return symbol;
    }

    /**
     * @return nearest definition walking outward from the current scope, or null
     */
    public Symbol resolveSymbol(String name) {
        Integer scopeId = currentScopeId;
        while (scopeId != null) {
            Scope scope = scopes.get(scopeId);
            Symbol symbol = scope.getSymbol(name);
            if (symbol != null) {
                return symbol;
            }
            scopeId = scope.getParentId();
        }
        return null;
    }

    /**
     * @return type of the visible definition, or null when the name is not visible
     */
    public TypeInfo getSymbolType(String name) {
        Symbol symbol = resolveSymbol(name);
        return symbol != null ? symbol.getType() : null;
    }

    /**
     * Update the type of the visible definition.
     *
     * @return false when the name is not visible
     */
    public boolean updateSymbolType(String name, TypeInfo type) {
        Symbol symbol = resolveSymbol(name);
        if (symbol == null) {
            return false;
        }
        symbol.setType(type);
        return true;
    }

    /**
     * Record a read of a name against the scope that defines it.
     *
     * @return false when the name is not visible
     */
    public boolean recordUse(String name, int nodeId) {
        Symbol symbol = resolveSymbol(name);
        if (symbol == null) {
            return false;
        }
        scopes.get(symbol.getScopeId()).addUse(name, nodeId);
        return true;
    }

    /**
     * @return node ids recorded as uses of the visible definition
     */
    public List<Integer> getUses(String name) {
        Symbol symbol = resolveSymbol(name);
        if (symbol == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(scopes.get(symbol.getScopeId()).getUses(name));
    }

    public void clear() {
        reset();
    }

    private void reset() {
        scopes.clear();
        scopes.put(GLOBAL_SCOPE_ID, new Scope(GLOBAL_SCOPE_ID, null, ScopeType.GLOBAL, null));
        currentScopeId = GLOBAL_SCOPE_ID;
        nextScopeId = GLOBAL_SCOPE_ID + 1;
    }

    private Scope current() {
        return scopes.get(currentScopeId);
    }
}
