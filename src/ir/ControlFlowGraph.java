package ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exception.CompileException;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.Instruction;
import ir.value.instructions.JumpInst;
import pass.IRPass.analysis.dataflow.FlowGraph;

/**
 * The body of one function as labeled basic blocks in layout order.
 *
 * Edges are derived from terminators; call {@link #rebuildEdges()} after
 * changing any jump target.
 */
public class ControlFlowGraph implements FlowGraph<BasicBlock> {
    private final Function function;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<String, BasicBlock> blockMap = new HashMap<>();
    private BasicBlock entry;

    public ControlFlowGraph(Function function) {
        this.function = function;
    }

    public Function getFunction() {
        return function;
    }

    public String getName() {
        return function.getName();
    }

    /* block list */

    public List<BasicBlock> getBlocks() {
        return new ArrayList<>(blocks);
    }

    public BasicBlock getBlock(String label) {
        return blockMap.get(label);
    }

    public boolean containsBlock(String label) {
        return blockMap.containsKey(label);
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public BasicBlock getEntry() {
        return entry;
    }

    public void setEntry(BasicBlock entry) {
        this.entry = entry;
    }

    public void addBlock(BasicBlock block) {
        checkNewLabel(block.getLabel());
        blocks.add(block);
        blockMap.put(block.getLabel(), block);
        if (entry == null) {
            entry = block;
        }
    }

    public void addBlockAfter(BasicBlock anchor, BasicBlock block) {
        checkNewLabel(block.getLabel());
        blocks.add(blocks.indexOf(anchor) + 1, block);
        blockMap.put(block.getLabel(), block);
    }

    public void addBlockFirst(BasicBlock block) {
        checkNewLabel(block.getLabel());
        blocks.add(0, block);
        blockMap.put(block.getLabel(), block);
        entry = block;
    }

    public void removeBlock(BasicBlock block) {
        blocks.remove(block);
        blockMap.remove(block.getLabel());
        for (BasicBlock pred : block.getPredecessors()) {
            pred.getSuccessors().remove(block);
        }
        for (BasicBlock succ : block.getSuccessors()) {
            succ.getPredecessors().remove(block);
        }
    }

    private void checkNewLabel(String label) {
        if (blockMap.containsKey(label)) {
            throw CompileException.duplicateLabel(getName(), label);
        }
    }

    /* FlowGraph */

    @Override
    public List<BasicBlock> getNodes() {
        return getBlocks();
    }

    @Override
    public Collection<BasicBlock> predecessorsOf(BasicBlock node) {
        return node.getPredecessors();
    }

    @Override
    public Collection<BasicBlock> successorsOf(BasicBlock node) {
        return node.getSuccessors();
    }

    /* edges */

    /**
     * Recompute predecessor and successor sets from the terminators.
     */
    public void rebuildEdges() {
        for (BasicBlock block : blocks) {
            block.getPredecessors().clear();
            block.getSuccessors().clear();
        }
        for (BasicBlock block : blocks) {
            Instruction term = block.getTerminator();
            if (term == null) {
                continue;
            }
            for (String label : term.getLabels()) {
                BasicBlock target = blockMap.get(label);
                if (target == null) {
                    throw CompileException.undefinedLabel(getName(), label);
                }
                block.getSuccessors().add(target);
                target.getPredecessors().add(block);
            }
        }
    }

    public Set<BasicBlock> reachableBlocks() {
        Set<BasicBlock> reachable = new LinkedHashSet<>();
        if (entry == null) {
            return reachable;
        }
        Deque<BasicBlock> worklist = new ArrayDeque<>();
        worklist.add(entry);
        reachable.add(entry);
        while (!worklist.isEmpty()) {
            BasicBlock current = worklist.poll();
            for (BasicBlock succ : current.getSuccessors()) {
                if (reachable.add(succ)) {
                    worklist.add(succ);
                }
            }
        }
        return reachable;
    }

    /**
     * Unreachable Code Elimination
     *
     * @return true if any block was removed
     */
    public boolean removeUnreachableBlocks() {
        Set<BasicBlock> reachable = reachableBlocks();
        List<BasicBlock> dead = blocks.stream().filter(b -> !reachable.contains(b)).toList();
        for (BasicBlock block : dead) {
            removeBlock(block);
        }
        return !dead.isEmpty();
    }

    public boolean isCriticalEdge(BasicBlock from, BasicBlock to) {
        return from.getSuccessors().size() > 1 && to.getPredecessors().size() > 1;
    }

    public List<BasicBlock[]> findCriticalEdges() {
        List<BasicBlock[]> edges = new ArrayList<>();
        for (BasicBlock block : blocks) {
            for (BasicBlock succ : block.getSuccessors()) {
                if (isCriticalEdge(block, succ)) {
                    edges.add(new BasicBlock[] { block, succ });
                }
            }
        }
        return edges;
    }

    public boolean hasCriticalEdges() {
        return !findCriticalEdges().isEmpty();
    }

    /**
     * Put a synthetic block holding only {@code jmp target} on every critical
     * edge. The new block is laid out right after the source.
     *
     * @return number of edges split
     */
    public int splitCriticalEdges() {
        List<BasicBlock[]> edges = findCriticalEdges();
        for (BasicBlock[] edge : edges) {
            BasicBlock from = edge[0];
            BasicBlock to = edge[1];
            BasicBlock split = new BasicBlock(freshLabel(from.getLabel() + ".to." + to.getLabel()));
            split.setSynthetic(true);
            split.addInstruction(new JumpInst(to.getLabel()));
            addBlockAfter(from, split);
            from.getTerminator().replaceLabel(to.getLabel(), split.getLabel());
        }
        if (!edges.isEmpty()) {
            rebuildEdges();
        }
        return edges.size();
    }

    /* names */

    public Set<String> collectLabels() {
        return new HashSet<>(blockMap.keySet());
    }

    /**
     * Every variable mentioned in the function: parameters, destinations and
     * operands.
     */
    public Set<String> collectVariables() {
        Set<String> vars = new LinkedHashSet<>();
        for (Argument arg : function.getArguments()) {
            vars.add(arg.name());
        }
        for (BasicBlock block : blocks) {
            for (Instruction inst : block.getInstructions()) {
                if (inst.hasDest()) {
                    vars.add(inst.getDest());
                }
                vars.addAll(inst.getArgs());
            }
        }
        return vars;
    }

    public String freshLabel(String base) {
        Set<String> taken = collectLabels();
        if (!taken.contains(base)) {
            return base;
        }
        int i = 1;
        while (taken.contains(base + "." + i)) {
            i++;
        }
        return base + "." + i;
    }

    public String freshVariable(String prefix) {
        Set<String> taken = collectVariables();
        int i = 0;
        while (taken.contains(prefix + i)) {
            i++;
        }
        return prefix + i;
    }

    /* copy & output */

    /**
     * Deep copy: fresh blocks and instructions, same function.
     */
    public ControlFlowGraph copy() {
        ControlFlowGraph copy = new ControlFlowGraph(function);
        for (BasicBlock block : blocks) {
            copy.addBlock(block.copy());
        }
        if (entry != null) {
            copy.entry = copy.blockMap.get(entry.getLabel());
        }
        copy.rebuildEdges();
        return copy;
    }

    /**
     * Flatten back to labels and instructions.
     *
     * A synthetic block that still holds only its jump is dropped and its
     * predecessors jump straight to the target. Terminators inserted by the
     * builder are omitted where control would fall through anyway.
     */
    public InstructionStream linearize() {
        Map<String, String> collapsed = new HashMap<>();
        for (BasicBlock block : blocks) {
            if (block.isBareEdgeBlock() && block != entry) {
                collapsed.put(block.getLabel(), block.getTerminator().getLabels().get(0));
            }
        }
        List<BasicBlock> emitted = blocks.stream()
                .filter(b -> !collapsed.containsKey(b.getLabel())).toList();

        InstructionStream stream = new InstructionStream();
        for (int i = 0; i < emitted.size(); i++) {
            BasicBlock block = emitted.get(i);
            String next = i + 1 < emitted.size() ? emitted.get(i + 1).getLabel() : null;
            List<Instruction> body = new ArrayList<>();
            for (Instruction inst : block.getInstructions()) {
                Instruction out = inst;
                if (inst.isTerminator() && inst.getLabels().stream().anyMatch(collapsed::containsKey)) {
                    out = inst.copy();
                    for (String label : inst.getLabels()) {
                        out.replaceLabel(label, resolve(collapsed, label));
                    }
                }
                if (out.isImplicit() && fallsThrough(out, next)) {
                    continue;
                }
                body.add(out);
            }
            // an entry that only fell into its successor is rebuilt on the next parse
            if (block == entry && body.isEmpty() && next != null) {
                continue;
            }
            stream.addLabel(block.getLabel());
            body.forEach(stream::add);
        }
        return stream;
    }

    private static String resolve(Map<String, String> collapsed, String label) {
        Set<String> seen = new HashSet<>();
        while (collapsed.containsKey(label) && seen.add(label)) {
            label = collapsed.get(label);
        }
        return label;
    }

    private static boolean fallsThrough(Instruction term, String next) {
        return switch (term.opCode()) {
            case JMP -> term.getLabels().get(0).equals(next);
            case RET -> next == null && term.getArgs().isEmpty();
            default -> false;
        };
    }

    public String toBril() {
        return String.join("\n", linearize().toBril());
    }

    @Override
    public String toString() {
        return toBril();
    }
}
