package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

/**
 * {@code store p v}: writes {@code v} to the cell {@code p} points at.
 */
public class StoreInst extends Instruction {

    public StoreInst(String pointer, String value) {
        super(null, null, List.of(pointer, value), List.of());
    }

    public String getPointer() {
        return getArg(0);
    }

    public String getValue() {
        return getArg(1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.STORE;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new StoreInst(getPointer(), getValue()));
    }
}
