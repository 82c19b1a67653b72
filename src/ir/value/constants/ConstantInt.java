package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(long value) {
        super(IntegerType.getInt());
        this.value = value;
    }

    public long getValue() { return value; }

    @Override
    public String toBril() {
        return Long.toString(value);
    }

    public ConstantInt add(ConstantInt rhs) {
        return new ConstantInt(this.value + rhs.value);
    }

    public ConstantInt sub(ConstantInt rhs) {
        return new ConstantInt(this.value - rhs.value);
    }

    public ConstantInt mul(ConstantInt rhs) {
        return new ConstantInt(this.value * rhs.value);
    }

    // null: the interpreter faults on zero, leave it for runtime
    public ConstantInt div(ConstantInt rhs) {
        if (rhs.value == 0) {
            return null;
        }
        return new ConstantInt(this.value / rhs.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantInt other)) return false;
        return value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
