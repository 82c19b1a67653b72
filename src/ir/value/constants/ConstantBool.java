package ir.value.constants;

import ir.type.BoolType;

public class ConstantBool extends Constant {
    private static final ConstantBool TRUE = new ConstantBool(true);
    private static final ConstantBool FALSE = new ConstantBool(false);

    private final boolean value;

    private ConstantBool(boolean value) {
        super(BoolType.getBool());
        this.value = value;
    }

    public static ConstantBool get(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() { return value; }

    public ConstantBool not() {
        return get(!value);
    }

    public ConstantBool and(ConstantBool rhs) {
        return get(value && rhs.value);
    }

    public ConstantBool or(ConstantBool rhs) {
        return get(value || rhs.value);
    }

    @Override
    public String toBril() {
        return Boolean.toString(value);
    }
}
