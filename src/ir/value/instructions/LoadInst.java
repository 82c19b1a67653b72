package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;

public class LoadInst extends Instruction {

    public LoadInst(String dest, Type type, String pointer) {
        super(dest, type, List.of(pointer), List.of());
    }

    public String getPointer() {
        return getArg(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new LoadInst(getDest(), getType(), getPointer()));
    }
}
