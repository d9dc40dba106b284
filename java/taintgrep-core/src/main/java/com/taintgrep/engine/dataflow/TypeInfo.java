package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inferred type of a symbol. Unknown is compatible with everything; a union is
 * compatible when any member is.
 */
public abstract class TypeInfo {

    public static final TypeInfo UNKNOWN = new Unknown();

    public static TypeInfo primitive(String name) {
        return new Primitive(name);
    }

    public static TypeInfo object(String className) {
        return new ObjectType(className);
    }

    public static TypeInfo array(TypeInfo element) {
        return new ArrayType(element);
    }

    public static TypeInfo function(List<TypeInfo> parameters, TypeInfo returnType) {
        return new FunctionType(parameters, returnType);
    }

    public static TypeInfo union(TypeInfo... members) {
        return new UnionType(Arrays.asList(members));
    }

    public boolean isCompatibleWith(TypeInfo other) {
        if (this instanceof Unknown || other instanceof Unknown) {
            return true;
        }
        if (this instanceof UnionType) {
            for (TypeInfo member : ((UnionType) this).members) {
                if (member.isCompatibleWith(other)) {
                    return true;
                }
            }
            return false;
        }
        if (other instanceof UnionType) {
            for (TypeInfo member : ((UnionType) other).members) {
                if (isCompatibleWith(member)) {
                    return true;
                }
            }
            return false;
        }
        if (this instanceof Primitive && other instanceof Primitive) {
            return ((Primitive) this).name.equals(((Primitive) other).name);
        }
        if (this instanceof ObjectType && other instanceof ObjectType) {
            return ((ObjectType) this).className.equals(((ObjectType) other).className);
        }
        if (this instanceof ArrayType && other instanceof ArrayType) {
            return ((ArrayType) this).element.isCompatibleWith(((ArrayType) other).element);
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o != null && getClass() == o.getClass() && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), toString());
    }

    public static final class Primitive extends TypeInfo {
        private final String name;

        Primitive(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class ObjectType extends TypeInfo {
        private final String className;

        ObjectType(String className) {
            this.className = className;
        }

        public String getClassName() {
            return className;
        }

        @Override
        public String toString() {
            return className;
        }
    }

    public static final class ArrayType extends TypeInfo {
        private final TypeInfo element;

        ArrayType(TypeInfo element) {
            this.element = element;
        }

        public TypeInfo getElement() {
            return element;
        }

        @Override
        public String toString() {
            return element + "[]";
        }
    }

    public static final class FunctionType extends TypeInfo {
        private final List<TypeInfo> parameters;
        private final TypeInfo returnType;

        FunctionType(List<TypeInfo> parameters, TypeInfo returnType) {
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
            this.returnType = returnType;
        }

        public List<TypeInfo> getParameters() {
            return parameters;
        }

        public TypeInfo getReturnType() {
            return returnType;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(parameters.get(i));
            }
            return sb.append(") -> ").append(returnType).toString();
        }
    }

    public static final class UnionType extends TypeInfo {
        private final List<TypeInfo> members;

        UnionType(List<TypeInfo> members) {
            this.members = Collections.unmodifiableList(new ArrayList<>(members));
        }

        public List<TypeInfo> getMembers() {
            return members;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < members.size(); i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                sb.append(members.get(i));
            }
            return sb.toString();
        }
    }

    static final class Unknown extends TypeInfo {
        @Override
        public String toString() {
            return "unknown";
        }
    }
}
