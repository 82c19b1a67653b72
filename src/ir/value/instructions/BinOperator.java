package ir.value.instructions;

import java.util.List;

import exception.CompileException;
import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;

/**
 * {@code add sub mul div} over int and {@code and or} over bool.
 */
public class BinOperator extends Instruction {
    private final Opcode opcode;

    public BinOperator(String dest, Opcode opcode, Type type, String lhs, String rhs) {
        super(dest, type, List.of(lhs, rhs), List.of());
        if (!opcode.isBinary()) {
            throw CompileException.illegalInstruction(opcode.getMnemonic() + " is not a binary operator");
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

    public boolean isCommutative() {
        return opcode.isCommutative();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new BinOperator(getDest(), opcode, getType(), getLhs(), getRhs()));
    }
}
