package ir.value.instructions;

import java.util.List;

import exception.CompileException;
import ir.InstructionVisitor;
import ir.type.BoolType;
import ir.value.Opcode;

/**
 * Integer comparison producing a bool.
 */
public class ICmpInst extends Instruction {
    private final Opcode opcode;

    public ICmpInst(String dest, Opcode opcode, String lhs, String rhs) {
        super(dest, BoolType.getBool(), List.of(lhs, rhs), List.of());
        if (!opcode.isCompare()) {
            throw CompileException.illegalInstruction(opcode.getMnemonic() + " is not a comparison");
        }
        this.opcode = opcode;
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public String getLhs() {
        return getArg(0);
    }

    public String getRhs() {
        return getArg(1);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new ICmpInst(getDest(), opcode, getLhs(), getRhs()));
    }
}
