package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// Scope: one lexical scope and its symbols
// ============================================
public class Scope {
    private final int id;
    private final Integer parentId;
    private final ScopeType type;
    private final String name;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, List<Integer>> uses = new LinkedHashMap<>();

    public Scope(int id, Integer parentId, ScopeType type, String name) {
        this.id = id;
        this.parentId = parentId;
        this.type = type;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    /**
     * @return enclosing scope id, or null for the global scope
     */
    public Integer getParentId() {
        return parentId;
    }

    public ScopeType getType() {
        return type;
    }

    /**
     * @return function or class name for named scopes, otherwise null
     */
    public String getName() {
        return name;
    }

    void addSymbol(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    public Symbol getSymbol(String symbolName) {
        return symbols.get(symbolName);
    }

    public boolean hasSymbol(String symbolName) {
        return symbols.containsKey(symbolName);
    }

    public List<Symbol> getSymbols() {
        return new ArrayList<>(symbols.values());
    }

    void addUse(String symbolName, int nodeId) {
        uses.computeIfAbsent(symbolName, ignored -> new ArrayList<>()).add(nodeId);
    }

    List<Integer> getUses(String symbolName) {
        return uses.getOrDefault(symbolName, Collections.<Integer>emptyList());
    }
}
