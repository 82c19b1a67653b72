package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.BoolType;
import ir.value.Opcode;

public class UnaryOperator extends Instruction {

    public UnaryOperator(String dest, String operand) {
        super(dest, BoolType.getBool(), List.of(operand), List.of());
    }

    public String getOperand() {
        return getArg(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.NOT;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new UnaryOperator(getDest(), getOperand()));
    }
}
