package ir.type;

/**
 * Bril {@code int}: 64-bit two's complement.
 */
public final class IntegerType extends Type {
    private static final IntegerType INT = new IntegerType();

    private IntegerType() {
        super(BrilKind.INT);
    }

    public static IntegerType getInt() {
        return INT;
    }

    @Override
    public String toBril() {
        return "int";
    }
}
