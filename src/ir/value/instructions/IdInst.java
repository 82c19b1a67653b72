package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;

/**
 * Copy: {@code x: T = id y}.
 */
public class IdInst extends Instruction {

    public IdInst(String dest, Type type, String source) {
        super(dest, type, List.of(source), List.of());
    }

    public String getSource() {
        return getArg(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.ID;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new IdInst(getDest(), getType(), getSource()));
    }
}
