package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowNode;

/**
 * Name extraction and dotted-segment matching shared by the detectors.
 */
final class CallNames {

    private CallNames() {
    }

    /**
     * @return callee text before the final argument list for calls
     *         ({@code a.b().exec} for {@code a.b().exec(x)}), the node text
     *         otherwise; null for textless nodes
     */
    static String nameOf(DataFlowNode node) {
        String text = node.getText();
        if (text == null) {
            return null;
        }
        text = text.trim();
        if (text.endsWith(")")) {
            int depth = 0;
            for (int i = text.length() - 1; i >= 0; i--) {
                char ch = text.charAt(i);
                if (ch == ')') {
                    depth++;
                } else if (ch == '(' && --depth == 0) {
                    return text.substring(0, i).trim();
                }
            }
        }
        int paren = text.indexOf('(');
        return (paren >= 0 ? text.substring(0, paren) : text).trim();
    }

    /**
     * True when the pattern's dotted segments occur as a contiguous run of the
     * name's segments: {@code getParameter} and {@code request.getParameter}
     * both match {@code request.getParameter}, {@code query} does not match
     * {@code stmt.executeQuery}.
     */
    static boolean matches(String name, String pattern) {
        if (name == null || pattern == null || pattern.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int index = name.indexOf(pattern, from);
            if (index < 0) {
                return false;
            }
            int end = index + pattern.length();
            boolean startsSegment = index == 0 || name.charAt(index - 1) == '.';
            boolean endsSegment = end == name.length() || name.charAt(end) == '.';
            if (startsSegment && endsSegment) {
                return true;
            }
            from = index + 1;
        }
    }
}
