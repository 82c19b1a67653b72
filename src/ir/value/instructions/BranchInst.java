package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

/**
 * Conditional branch {@code br c .then .else}.
 */
public class BranchInst extends Instruction {

    public BranchInst(String cond, String thenLabel, String elseLabel) {
        super(null, null, List.of(cond), List.of(thenLabel, elseLabel));
    }

    public String getCondition() {
        return getArg(0);
    }

    public String getThenLabel() {
        return labels.get(0);
    }

    public String getElseLabel() {
        return labels.get(1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new BranchInst(getCondition(), getThenLabel(), getElseLabel()));
    }
}
