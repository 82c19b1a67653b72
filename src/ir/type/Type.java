package ir.type;

import exception.CompileException;

public abstract class Type {
    private BrilKind kind;

    protected Type(BrilKind kind) {
        this.kind = kind;
    }

    public BrilKind getKind() {
        return this.kind;
    }

    public abstract String toBril();

    /* classification helpers */
    public boolean is(BrilKind k) { return kind == k; }
    public boolean isInt() { return is(BrilKind.INT); }
    public boolean isBool() { return is(BrilKind.BOOL); }
    public boolean isPointer() { return is(BrilKind.POINTER); }

    /**
     * Resolve a type written as {@code name} or {@code name<inner>}.
     */
    public static Type get(String name, Type inner) {
        return switch (name) {
            case "int" -> IntegerType.getInt();
            case "bool" -> BoolType.getBool();
            case "ptr" -> {
                if (inner == null) {
                    throw CompileException.unSupported("ptr type without pointee");
                }
                yield PointerType.get(inner);
            }
            default -> throw CompileException.unSupported("type " + name);
        };
    }

    @Override public String toString() { return toBril(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

}
