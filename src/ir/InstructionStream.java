package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ir.value.instructions.Instruction;

/**
 * The flat form of a function body: labels and instructions in program
 * order. This is what the reader produces and what linearization emits.
 */
public class InstructionStream {

    public record Entry(String label, Instruction instruction) {
        public boolean isLabel() {
            return label != null;
        }

        public String toBril() {
            return isLabel() ? "." + label + ":" : "  " + instruction.toBril();
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public InstructionStream addLabel(String label) {
        entries.add(new Entry(label, null));
        return this;
    }

    public InstructionStream add(Instruction instruction) {
        entries.add(new Entry(null, instruction));
        return this;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Instruction> getInstructions() {
        return entries.stream().filter(e -> !e.isLabel()).map(Entry::instruction).toList();
    }

    public int size() {
        return entries.size();
    }

    public List<String> toBril() {
        return entries.stream().map(Entry::toBril).toList();
    }
}
