package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.PointerType;
import ir.value.Opcode;

/**
 * {@code p: ptr<T> = alloc n}: reserves {@code n} cells on the heap.
 */
public class AllocInst extends Instruction {

    public AllocInst(String dest, PointerType type, String size) {
        super(dest, type, List.of(size), List.of());
    }

    public String getSize() {
        return getArg(0);
    }

    @Override
    public PointerType getType() {
        return (PointerType) super.getType();
    }

    @Override
    public Opcode opCode() {
        return Opcode.ALLOC;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new AllocInst(getDest(), getType(), getSize()));
    }
}
