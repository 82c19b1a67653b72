package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

public class ReturnInst extends Instruction {

    public ReturnInst() {
        super(null, null, List.of(), List.of());
    }

    public ReturnInst(String value) {
        super(null, null, List.of(value), List.of());
    }

    public boolean hasReturnValue() {
        return !args.isEmpty();
    }

    public String getReturnValue() {
        return hasReturnValue() ? getArg(0) : null;
    }

    @Override
    public Opcode opCode() {
        return Opcode.RET;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(hasReturnValue() ? new ReturnInst(getReturnValue()) : new ReturnInst());
    }
}
