package com.taintgrep.engine.bytecode;

import com.taintgrep.engine.tree.SourceSpan;
import com.taintgrep.engine.tree.UniversalNode;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LineNumberNode;
import org.objectweb.asm.tree.LocalVariableNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JVM class files to universal syntax trees.
 *
 * Shape:
 * <pre>
 *   class_declaration            text = dotted class name
 *     variable_declarator        static String constants
 *     method_declaration         text = method name; attributes owner, descriptor, params, static
 *       call_expression          text = Owner.method(args); children callee, receiver, arguments
 *       assignment_expression    local or field store
 *       return_statement
 * </pre>
 * Operands are recovered by a best-effort walk of the operand stack inside
 * straight-line code; anything the walk cannot follow becomes an
 * {@code unknown} node with text "?".
 */
public class BytecodeTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BytecodeTreeBuilder.class);

    private static final int ASM_API_VERSION = Opcodes.ASM9;

    public static final String LANGUAGE = "java";

    public static final String CLASS = "class_declaration";
    public static final String METHOD = "method_declaration";
    public static final String CALL = "call_expression";
    public static final String MEMBER = "member_expression";
    public static final String ASSIGNMENT = "assignment_expression";
    public static final String DECLARATOR = "variable_declarator";
    public static final String RETURN = "return_statement";
    public static final String IDENTIFIER = "identifier";
    public static final String STRING = "string_literal";
    public static final String NUMBER = "number_literal";
    public static final String NULL = "null";
    public static final String UNKNOWN = "unknown";

    // ============================================
    // 1. CLASS FILE PARSING
    // ============================================

    /**
     * Parse a .class file into an ASM ClassNode.
     *
     * @param classFile path to the .class file
     * @throws IOException if the file cannot be read
     */
    public ClassNode parseClassFile(Path classFile) throws IOException {
        try (InputStream input = Files.newInputStream(classFile)) {
            ClassReader reader = new ClassReader(input);
            ClassNode classNode = new ClassNode(ASM_API_VERSION);
            reader.accept(classNode, ClassReader.EXPAND_FRAMES);
            return classNode;
        }
    }

    public ClassNode parseClassBytes(byte[] classBytes) {
        ClassReader reader = new ClassReader(classBytes);
        ClassNode classNode = new ClassNode(ASM_API_VERSION);
        reader.accept(classNode, ClassReader.EXPAND_FRAMES);
        return classNode;
    }

    public UniversalNode build(Path classFile) throws IOException {
        return build(parseClassFile(classFile));
    }

    public UniversalNode build(byte[] classBytes) {
        return build(parseClassBytes(classBytes));
    }

    // ============================================
    // 2. TREE CONSTRUCTION
    // ============================================

    public UniversalNode build(ClassNode classNode) {
        String className = classNode.name.replace('/', '.');
        UniversalNode.Builder clazz = UniversalNode.builder(CLASS).text(className)
            .attribute("super", classNode.superName != null ? classNode.superName.replace('/', '.') : null);

        for (FieldNode field : classNode.fields) {
            if (field.value instanceof String) {
                UniversalNode target = UniversalNode.leaf(IDENTIFIER, field.name);
                UniversalNode value = UniversalNode.leaf(STRING, quote((String) field.value));
                clazz.child(UniversalNode.builder(DECLARATOR)
                    .text(field.name + " = " + value.getText())
                    .child(target)
                    .child(value)
                    .build());
            }
        }

        for (MethodNode method : classNode.methods) {
            clazz.child(buildMethod(className, method));
        }

        logger.debug("Built tree for {} ({} member(s))", className, clazz.childCount());
        return clazz.build();
    }

    private UniversalNode buildMethod(String className, MethodNode method) {
        boolean isStatic = (method.access & Opcodes.ACC_STATIC) != 0;
        UniversalNode.Builder builder = UniversalNode.builder(METHOD).text(method.name)
            .attribute("owner", className)
            .attribute("descriptor", method.desc)
            .attribute("params", String.join(",", parameterNames(method)))
            .attribute("static", String.valueOf(isStatic));

        if (method.instructions != null && method.instructions.size() > 0) {
            MethodWalker walker = new MethodWalker(method);
            for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
                walker.accept(insn);
            }
            walker.flush();
            if (walker.firstLine > 0) {
                builder.span(new SourceSpan(walker.firstLine, 1, walker.lastLine, 1));
            }
            for (UniversalNode statement : walker.body) {
                builder.child(statement);
            }
        }
        return builder.build();
    }

    /**
     * Parameter names in declaration order, from the local variable table when
     * the class was compiled with debug information.
     */
    public static List<String> parameterNames(MethodNode method) {
        Map<Integer, String> locals = localNames(method);
        List<String> names = new ArrayList<>();
        int slot = (method.access & Opcodes.ACC_STATIC) != 0 ? 0 : 1;
        for (Type argument : Type.getArgumentTypes(method.desc)) {
            names.add(localName(locals, slot));
            slot += argument.getSize();
        }
        return names;
    }

    private static Map<Integer, String> localNames(MethodNode method) {
        Map<Integer, String> names = new HashMap<>();
        if (method.localVariables != null) {
            for (LocalVariableNode local : method.localVariables) {
                names.putIfAbsent(local.index, local.name);
            }
        }
        return names;
    }

    private static String localName(Map<Integer, String> locals, int slot) {
        String name = locals.get(slot);
        return name != null ? name : "local" + slot;
    }

    static String simpleName(String internalName) {
        int slash = internalName.lastIndexOf('/');
        return slash >= 0 ? internalName.substring(slash + 1) : internalName;
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    // ============================================
    // 3. OPERAND STACK WALK
    // ============================================

    private static final class MethodWalker {
        private final Map<Integer, String> locals;
        private final List<UniversalNode> stack = new ArrayList<>();
        private final List<UniversalNode> body = new ArrayList<>();
        private final Set<UniversalNode> attached = Collections.newSetFromMap(new IdentityHashMap<>());
        private int line;
        private int firstLine;
        private int lastLine;

        MethodWalker(MethodNode method) {
            this.locals = localNames(method);
        }

        void accept(AbstractInsnNode insn) {
            if (insn instanceof LineNumberNode) {
                line = ((LineNumberNode) insn).line;
                if (firstLine == 0) {
                    firstLine = line;
                }
                lastLine = Math.max(lastLine, line);
                return;
            }
            int opcode = insn.getOpcode();
            if (opcode < 0) {
                return;
            }

            if (insn instanceof VarInsnNode && opcode >= Opcodes.ILOAD && opcode <= Opcodes.ALOAD) {
                push(leaf(IDENTIFIER, localName(locals, ((VarInsnNode) insn).var)));
            } else if (insn instanceof VarInsnNode && opcode >= Opcodes.ISTORE && opcode <= Opcodes.ASTORE) {
                store(localName(locals, ((VarInsnNode) insn).var), pop());
            } else if (insn instanceof LdcInsnNode) {
                Object constant = ((LdcInsnNode) insn).cst;
                push(constant instanceof String
                    ? leaf(STRING, quote((String) constant))
                    : leaf(NUMBER, String.valueOf(constant)));
            } else if (opcode >= Opcodes.ICONST_M1 && opcode <= Opcodes.ICONST_5) {
                push(leaf(NUMBER, String.valueOf(opcode - Opcodes.ICONST_0)));
            } else if (insn instanceof IntInsnNode && opcode != Opcodes.NEWARRAY) {
                push(leaf(NUMBER, String.valueOf(((IntInsnNode) insn).operand)));
            } else if (opcode == Opcodes.ACONST_NULL) {
                push(leaf(NULL, "null"));
            } else if (opcode == Opcodes.GETSTATIC) {
                FieldInsnNode field = (FieldInsnNode) insn;
                push(leaf(MEMBER, simpleName(field.owner) + "." + field.name));
            } else if (opcode == Opcodes.GETFIELD) {
                pop();
                push(leaf(IDENTIFIER, ((FieldInsnNode) insn).name));
            } else if (opcode == Opcodes.PUTSTATIC || opcode == Opcodes.PUTFIELD) {
                UniversalNode value = pop();
                if (opcode == Opcodes.PUTFIELD) {
                    pop();
                }
                store(((FieldInsnNode) insn).name, value);
            } else if (opcode == Opcodes.NEW) {
                push(leaf(UNKNOWN, "new " + simpleName(((TypeInsnNode) insn).desc)));
            } else if (opcode == Opcodes.DUP && !stack.isEmpty()) {
                push(stack.get(stack.size() - 1));
            } else if (opcode == Opcodes.POP) {
                attach(pop());
            } else if (insn instanceof MethodInsnNode) {
                call((MethodInsnNode) insn);
            } else if (insn instanceof InvokeDynamicInsnNode) {
                dynamicCall((InvokeDynamicInsnNode) insn);
            } else if (opcode >= Opcodes.IRETURN && opcode <= Opcodes.ARETURN) {
                UniversalNode value = pop();
                attach(UniversalNode.builder(RETURN).text("return " + value.getText()).span(span())
                    .child(value).build());
            } else {
                flush();
            }
        }

        private void call(MethodInsnNode insn) {
            int argumentCount = Type.getArgumentTypes(insn.desc).length;
            List<UniversalNode> arguments = new ArrayList<>(argumentCount);
            for (int i = 0; i < argumentCount; i++) {
                arguments.add(0, pop());
            }
            boolean isStatic = insn.getOpcode() == Opcodes.INVOKESTATIC;
            boolean isConstructor = "<init>".equals(insn.name);
            UniversalNode receiver = isStatic ? null : pop();

            String callee = simpleName(insn.owner) + "." + insn.name;
            String head = isConstructor ? "new " + simpleName(insn.owner) : callee;
            List<String> argumentTexts = new ArrayList<>(argumentCount);
            for (UniversalNode argument : arguments) {
                argumentTexts.add(argument.getText());
            }

            UniversalNode.Builder builder = UniversalNode.builder(CALL)
                .text(head + "(" + String.join(", ", argumentTexts) + ")")
                .span(span())
                .attribute("owner", insn.owner.replace('/', '.'))
                .attribute("name", insn.name)
                .attribute("descriptor", insn.desc)
                .attribute("static", String.valueOf(isStatic))
                .child(UniversalNode.leaf(MEMBER, callee, span()));
            if (receiver != null && !isConstructor) {
                builder.child(receiver);
            }
            for (UniversalNode argument : arguments) {
                builder.child(argument);
            }
            UniversalNode call = builder.build();

            if (isConstructor && receiver != null) {
                // NEW/DUP left the uninitialized reference below; the call now stands for it
                replaceTop(receiver, call);
            } else if (Type.getReturnType(insn.desc).getSort() == Type.VOID) {
                attach(call);
            } else {
                push(call);
            }
        }

        /**
         * String concatenation and lambda creation; the bootstrap owner stands in for the callee.
         */
        private void dynamicCall(InvokeDynamicInsnNode insn) {
            int argumentCount = Type.getArgumentTypes(insn.desc).length;
            List<UniversalNode> arguments = new ArrayList<>(argumentCount);
            List<String> argumentTexts = new ArrayList<>(argumentCount);
            for (int i = 0; i < argumentCount; i++) {
                arguments.add(0, pop());
            }
            for (UniversalNode argument : arguments) {
                argumentTexts.add(argument.getText());
            }

            String callee = simpleName(insn.bsm.getOwner()) + "." + insn.name;
            UniversalNode.Builder builder = UniversalNode.builder(CALL)
                .text(callee + "(" + String.join(", ", argumentTexts) + ")")
                .span(span())
                .attribute("owner", insn.bsm.getOwner().replace('/', '.'))
                .attribute("name", insn.name)
                .attribute("descriptor", insn.desc)
                .attribute("dynamic", "true")
                .child(UniversalNode.leaf(MEMBER, callee, span()));
            for (UniversalNode argument : arguments) {
                builder.child(argument);
            }
            UniversalNode call = builder.build();

            if (Type.getReturnType(insn.desc).getSort() == Type.VOID) {
                attach(call);
            } else {
                push(call);
            }
        }

        private void store(String name, UniversalNode value) {
            attach(UniversalNode.builder(ASSIGNMENT)
                .text(name + " = " + value.getText())
                .span(span())
                .child(UniversalNode.leaf(IDENTIFIER, name, span()))
                .child(value)
                .build());
        }

        private void replaceTop(UniversalNode placeholder, UniversalNode replacement) {
            if (!stack.isEmpty() && stack.get(stack.size() - 1) == placeholder) {
                stack.set(stack.size() - 1, replacement);
            } else {
                attach(replacement);
            }
        }

        /**
         * Attach call results still on the stack as statements, then forget the stack.
         */
        void flush() {
            for (UniversalNode node : stack) {
                if (CALL.equals(node.getKind())) {
                    attach(node);
                }
            }
            stack.clear();
        }

        private void attach(UniversalNode node) {
            if (CALL.equals(node.getKind()) || ASSIGNMENT.equals(node.getKind()) || RETURN.equals(node.getKind())) {
                if (attached.add(node)) {
                    body.add(node);
                }
            }
        }

        private void push(UniversalNode node) {
            stack.add(node);
        }

        private UniversalNode pop() {
            if (stack.isEmpty()) {
                return UniversalNode.leaf(UNKNOWN, "?");
            }
            return stack.remove(stack.size() - 1);
        }

        private UniversalNode leaf(String kind, String text) {
            return UniversalNode.leaf(kind, text, span());
        }

        private SourceSpan span() {
            return line > 0 ? SourceSpan.ofLine(line) : null;
        }
    }
}
