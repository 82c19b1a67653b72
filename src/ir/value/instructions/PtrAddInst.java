package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.PointerType;
import ir.value.Opcode;

/**
 * {@code q: ptr<T> = ptradd p off}: pointer arithmetic within one allocation.
 */
public class PtrAddInst extends Instruction {

    public PtrAddInst(String dest, PointerType type, String pointer, String offset) {
        super(dest, type, List.of(pointer, offset), List.of());
    }

    public String getPointer() {
        return getArg(0);
    }

    public String getOffset() {
        return getArg(1);
    }

    @Override
    public PointerType getType() {
        return (PointerType) super.getType();
    }

    @Override
    public Opcode opCode() {
        return Opcode.PTRADD;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new PtrAddInst(getDest(), getType(), getPointer(), getOffset()));
    }
}
