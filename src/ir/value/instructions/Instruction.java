package ir.value.instructions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;

/**
 * A single Bril instruction over named variables.
 *
 * Def-form instructions carry a destination and its type; effect-form
 * instructions ({@code store}, {@code free}, {@code print} and the
 * terminators) carry neither. Operands are variable names, jump targets are
 * label names without the leading dot.
 */
public abstract class Instruction {
    private final String dest;
    private final Type type;
    protected final List<String> args;
    protected final List<String> labels;
    // inserted by the CFG builder, not present in the source program
    private boolean implicit = false;

    protected Instruction(String dest, Type type, List<String> args, List<String> labels) {
        this.dest = dest;
        this.type = type;
        this.args = new ArrayList<>(args);
        this.labels = new ArrayList<>(labels);
    }

    public abstract Opcode opCode();

    public abstract <T> T accept(InstructionVisitor<T> visitor);

    /**
     * @return a detached copy, equal in every field
     */
    public abstract Instruction copy();

    public String getDest() {
        return dest;
    }

    public boolean hasDest() {
        return dest != null;
    }

    public Type getType() {
        return type;
    }

    public List<String> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public String getArg(int i) {
        return args.get(i);
    }

    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public boolean isImplicit() {
        return implicit;
    }

    public Instruction markImplicit() {
        this.implicit = true;
        return this;
    }

    /**
     * Instructions whose execution is observable: memory writes, output,
     * control transfer and allocation.
     */
    public boolean isSideEffect() {
        return switch (opCode()) {
            case STORE, FREE, PRINT, ALLOC, BR, JMP, RET -> true;
            default -> false;
        };
    }

    /**
     * Instructions that may fault at runtime: a load from freed or
     * out-of-bounds memory, a division by zero.
     */
    public boolean mayTrap() {
        return opCode() == Opcode.LOAD || opCode() == Opcode.DIV;
    }

    /**
     * @return true when deleting this instruction is safe once its
     *         destination is dead
     */
    public boolean isRemovable() {
        return hasDest() && !isSideEffect() && !mayTrap();
    }

    /**
     * Rename operands through {@code mapping}; names absent from the map are
     * kept.
     */
    public void replaceArgs(Map<String, String> mapping) {
        args.replaceAll(a -> mapping.getOrDefault(a, a));
    }

    public void replaceLabel(String from, String to) {
        labels.replaceAll(l -> l.equals(from) ? to : l);
    }

    protected <I extends Instruction> I copyFlags(I copy) {
        if (implicit) {
            copy.markImplicit();
        }
        return copy;
    }

    protected String operandsToBril() {
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            sb.append(' ').append(arg);
        }
        for (String label : labels) {
            sb.append(" .").append(label);
        }
        return sb.toString();
    }

    public String toBril() {
        StringBuilder sb = new StringBuilder();
        if (dest != null) {
            sb.append(dest).append(": ").append(type.toBril()).append(" = ");
        }
        sb.append(opCode().getMnemonic()).append(operandsToBril()).append(';');
        return sb.toString();
    }

    @Override
    public String toString() {
        return toBril();
    }
}
