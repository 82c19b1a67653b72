package ir.value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ir.value.instructions.Instruction;

public class BasicBlock {
    private final String label;
    private final List<Instruction> instructions = new ArrayList<>();
    private final Set<BasicBlock> predecessors = new LinkedHashSet<>();
    private final Set<BasicBlock> successors = new LinkedHashSet<>();
    // created by critical-edge splitting
    private boolean synthetic = false;

    public BasicBlock(String label) {
        this.label = label;
    }

    /* getter setter */
    public String getLabel() {
        return label;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Set<BasicBlock> getPredecessors() {
        return predecessors;
    }

    public Set<BasicBlock> getSuccessors() {
        return successors;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public void setSynthetic(boolean synthetic) {
        this.synthetic = synthetic;
    }

    public void addInstruction(Instruction inst) {
        instructions.add(inst);
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction getTerminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public void setTerminator(Instruction terminator) {
        if (getTerminator() != null) {
            instructions.set(instructions.size() - 1, terminator);
        } else {
            instructions.add(terminator);
        }
    }

    /**
     * Insert before the terminator, or at the end when there is none yet.
     */
    public void addBeforeTerminator(Instruction inst) {
        if (getTerminator() != null) {
            instructions.add(instructions.size() - 1, inst);
        } else {
            instructions.add(inst);
        }
    }

    /**
     * A synthetic block still holding nothing but its jump.
     */
    public boolean isBareEdgeBlock() {
        return synthetic && instructions.size() == 1 && instructions.get(0).opCode() == Opcode.JMP;
    }

    public BasicBlock copy() {
        BasicBlock copy = new BasicBlock(label);
        copy.synthetic = synthetic;
        for (Instruction inst : instructions) {
            copy.instructions.add(inst.copy());
        }
        return copy;
    }

    public List<String> toBril() {
        List<String> lines = new ArrayList<>();
        lines.add("." + label + ":");
        for (Instruction inst : instructions) {
            lines.add("  " + inst.toBril());
        }
        return lines;
    }

    @Override
    public String toString() {
        return "." + label;
    }
}
