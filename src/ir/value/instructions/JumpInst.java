package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.value.Opcode;

public class JumpInst extends Instruction {

    public JumpInst(String target) {
        super(null, null, List.of(), List.of(target));
    }

    public String getTarget() {
        return labels.get(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.JMP;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Instruction copy() {
        return copyFlags(new JumpInst(getTarget()));
    }
}
