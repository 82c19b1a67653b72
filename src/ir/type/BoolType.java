package ir.type;

public final class BoolType extends Type {
    private static final BoolType BOOL = new BoolType();

    private BoolType() {
        super(BrilKind.BOOL);
    }

    public static BoolType getBool() {
        return BOOL;
    }

    @Override
    public String toBril() {
        return "bool";
    }
}
