package com.taintgrep.engine.bytecode;

import com.taintgrep.engine.dataflow.CallGraph;
import com.taintgrep.engine.dataflow.FunctionId;
import com.taintgrep.engine.dataflow.FunctionSignature;
import com.taintgrep.engine.tree.TreeNode;
import com.taintgrep.engine.tree.UniversalNode;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registers the methods and invocations of bytecode trees in a {@link CallGraph}.
 *
 * Functions are named {@code dotted.Owner.method}; the parameter count comes
 * from the descriptor. Every method of every class is registered before any
 * call, so calls between the given classes get parameter mappings. Node ids are
 * -1 because these registrations are not tied to a data-flow graph.
 */
public class BytecodeCallGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BytecodeCallGraphBuilder.class);

    public static final int NO_NODE = -1;

    /**
     * @param classes trees produced by {@link BytecodeTreeBuilder}
     * @return ids of the registered methods, in tree order
     */
    public List<FunctionId> register(List<UniversalNode> classes, CallGraph callGraph) {
        // 1. Methods
        Map<UniversalNode, FunctionId> methods = new LinkedHashMap<>();
        for (UniversalNode clazz : classes) {
            for (UniversalNode member : clazz.getChildren()) {
                if (BytecodeTreeBuilder.METHOD.equals(member.getKind())) {
                    methods.put(member, registerMethod(member, callGraph));
                }
            }
        }

        // 2. Calls
        int calls = 0;
        for (Map.Entry<UniversalNode, FunctionId> method : methods.entrySet()) {
            List<UniversalNode> sites = new ArrayList<>();
            collectCalls(method.getKey(), sites);
            for (UniversalNode site : sites) {
                if ("true".equals(site.getAttribute("dynamic"))) {
                    continue;
                }
                String descriptor = site.getAttribute("descriptor");
                int argumentCount = Type.getArgumentTypes(descriptor).length;
                FunctionSignature callee = signature(site.getAttribute("owner"), site.getAttribute("name"),
                    argumentCount);
                callGraph.addCall(method.getValue(), callee, argumentTexts(site, argumentCount), NO_NODE);
                calls++;
            }
        }

        logger.debug("Registered {} method(s) and {} call(s) from {} class(es)", methods.size(), calls,
            classes.size());
        return new ArrayList<>(methods.values());
    }

    public CallGraph build(List<UniversalNode> classes) {
        CallGraph callGraph = new CallGraph();
        register(classes, callGraph);
        return callGraph;
    }

    public static FunctionSignature signature(String owner, String name, int parameterCount) {
        return new FunctionSignature(owner + "." + name, parameterCount, BytecodeTreeBuilder.LANGUAGE);
    }

    private FunctionId registerMethod(UniversalNode method, CallGraph callGraph) {
        String descriptor = method.getAttribute("descriptor");
        String params = method.getAttribute("params");
        List<String> parameters = params == null || params.isEmpty()
            ? Collections.<String>emptyList()
            : Arrays.asList(params.split(","));
        String returnType = Type.getReturnType(descriptor).getClassName();
        return callGraph.addFunction(signature(method.getAttribute("owner"), method.getText(), parameters.size()),
            parameters, returnType, NO_NODE);
    }

    private static void collectCalls(TreeNode node, List<UniversalNode> sites) {
        for (TreeNode child : node.getChildren()) {
            collectCalls(child, sites);
        }
        if (BytecodeTreeBuilder.CALL.equals(node.getKind()) && node instanceof UniversalNode) {
            sites.add((UniversalNode) node);
        }
    }

    /**
     * Arguments are the last children of a call node, after the callee and receiver.
     */
    private static List<String> argumentTexts(UniversalNode site, int argumentCount) {
        List<UniversalNode> children = site.getChildren();
        List<String> texts = new ArrayList<>(argumentCount);
        for (int i = Math.max(1, children.size() - argumentCount); i < children.size(); i++) {
            texts.add(children.get(i).getText());
        }
        return texts;
    }
}
