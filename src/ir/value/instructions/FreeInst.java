package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

public class FreeInst extends Instruction {

    public FreeInst(String pointer) {
        super(null, null, List.of(pointer), List.of());
    }

    public String getPointer() {
        return getArg(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.FREE;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new FreeInst(getPointer()));
    }
}
