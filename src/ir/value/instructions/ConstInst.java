package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;
import ir.value.constants.Constant;

public class ConstInst extends Instruction {
    private final Constant value;

    public ConstInst(String dest, Constant value) {
        super(dest, value.getType(), List.of(), List.of());
        this.value = value;
    }

    public Constant getValue() {
        return value;
    }

    @Override
    public Opcode opCode() {
        return Opcode.CONST;
    }

    @Override
    protected String operandsToBril() {
        return " " + value.toBril();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new ConstInst(getDest(), value));
    }
}
