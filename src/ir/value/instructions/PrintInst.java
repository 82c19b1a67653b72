package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

public class PrintInst extends Instruction {

    public PrintInst(List<String> values) {
        super(null, null, values, List.of());
    }

    @Override
    public Opcode opCode() {
        return Opcode.PRINT;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new PrintInst(args));
    }
}
