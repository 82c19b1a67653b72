package pass.IRPass;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.FaintnessAnalysis;
import pass.IRPass.analysis.InstructionGraph;
import pass.IRPass.analysis.InstructionGraph.Node;
import pass.IRPass.analysis.LivenessAnalysis;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Partial dead code elimination: assignment sinking followed by faint code
 * elimination, repeated until a round leaves the function unchanged.
 *
 * <p>
 * Sinking follows the delayability analysis of Knoop, Rüthing and Steffen.
 * Every occurrence of an assignment pattern {@code x = e} is delayed forward
 * until a node blocks it (reads {@code x}, writes {@code x} or an operand of
 * {@code e}) or until the paths it travels on join with paths that do not
 * carry it. There the assignment is re-materialized and every original
 * occurrence is removed. Copies that land on a path where {@code x} is never
 * read are then faint and go away.
 *
 * <p>
 * A branch into a split edge block where {@code x} is live blocks the
 * pattern, so sinking never puts code on an edge.
 */
public class PartialDeadCodeEliminationPass implements Pass.IRPass {
    private static final int MAX_ROUNDS = 32;

    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.PartialDeadCodeElimination;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: PartialDeadCodeElimination on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        if (cfg.hasCriticalEdges()) {
            cfg.splitCriticalEdges();
        }

        int round = 0;
        boolean changed;
        do {
            String before = cfg.toBril();
            sink(cfg);
            int removed = eliminateFaint(cfg);
            changed = !before.equals(cfg.toBril());
            round++;
            log.debug("@{}: round {} removed {} faint assignment(s)", cfg.getName(), round, removed);
            if (changed && round >= MAX_ROUNDS) {
                log.warn("@{}: partial dead code elimination stopped after {} rounds", cfg.getName(), round);
                break;
            }
        } while (changed);
        log.info("@{}: converged after {} round(s)", cfg.getName(), round);
        return cfg;
    }

    private static boolean isSinkable(Instruction inst) {
        Opcode op = inst.opCode();
        return op == Opcode.CONST || op == Opcode.ID || op == Opcode.PTRADD
                || (op.isValueOp() && op != Opcode.DIV);
    }

    /* sinking */

    private void sink(ControlFlowGraph cfg) {
        InstructionGraph graph = new InstructionGraph(cfg);
        LivenessAnalysis liveness = new LivenessAnalysis(cfg).analyze();

        // 赋值模式: 以文本区分, 保留一个样本用于重新插入
        Universe<String> patterns = new Universe<>();
        List<Instruction> samples = new ArrayList<>();
        Set<Instruction> occurrences = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node node : graph.getNodes()) {
            Instruction inst = node.instruction();
            if (isSinkable(inst)) {
                if (!patterns.contains(inst.toBril())) {
                    samples.add(inst);
                }
                patterns.add(inst.toBril());
                occurrences.add(inst);
            }
        }
        int n = patterns.size();
        if (n == 0) {
            return;
        }

        Map<Node, BitSet> delayedHere = new HashMap<>();
        Map<Node, BitSet> blocked = new HashMap<>();
        for (Node node : graph.getNodes()) {
            BitSet local = new BitSet(n);
            if (occurrences.contains(node.instruction())) {
                local.set(patterns.indexOf(node.instruction().toBril()));
            }
            delayedHere.put(node, local);
            blocked.put(node, blockedPatterns(node, samples, liveness));
        }

        DataflowResult<Node> delayed = new DataflowAnalysis<Node>(graph, n, Direction.FORWARD,
                MeetOperator.INTERSECTION, (node, in) -> {
                    BitSet out = (BitSet) in.clone();
                    out.andNot(blocked.get(node));
                    out.or(delayedHere.get(node));
                    return out;
                }).solve();

        Map<Instruction, List<Instruction>> before = new IdentityHashMap<>();
        Map<Instruction, List<Instruction>> after = new IdentityHashMap<>();
        int inserted = 0;
        for (Node node : graph.getNodes()) {
            BitSet here = (BitSet) delayed.getIn(node).clone();
            here.and(blocked.get(node));
            inserted += place(before, node.instruction(), here, samples);

            if (graph.successorsOf(node).isEmpty()) {
                continue;
            }
            BitSet leaving = (BitSet) delayed.getOut(node).clone();
            BitSet onward = null;
            for (Node succ : graph.successorsOf(node)) {
                if (onward == null) {
                    onward = (BitSet) delayed.getIn(succ).clone();
                } else {
                    onward.and(delayed.getIn(succ));
                }
            }
            leaving.andNot(onward);
            inserted += place(node.instruction().isTerminator() ? before : after, node.instruction(), leaving,
                    samples);
        }

        for (BasicBlock block : cfg.getBlocks()) {
            List<Instruction> rebuilt = new ArrayList<>();
            for (Instruction inst : block.getInstructions()) {
                rebuilt.addAll(before.getOrDefault(inst, List.of()));
                if (!occurrences.contains(inst)) {
                    rebuilt.add(inst);
                }
                rebuilt.addAll(after.getOrDefault(inst, List.of()));
            }
            block.getInstructions().clear();
            block.getInstructions().addAll(rebuilt);
        }
        log.debug("@{}: sank {} assignment(s) into {} position(s)", cfg.getName(), occurrences.size(), inserted);
    }

    private static int place(Map<Instruction, List<Instruction>> at, Instruction anchor, BitSet which,
            List<Instruction> samples) {
        if (which.isEmpty()) {
            return 0;
        }
        List<Instruction> list = at.computeIfAbsent(anchor, k -> new ArrayList<>());
        for (int i = which.nextSetBit(0); i >= 0; i = which.nextSetBit(i + 1)) {
            list.add(samples.get(i).copy());
        }
        return which.cardinality();
    }

    /**
     * Patterns {@code node} stops: it reads or writes their destination,
     * writes one of their operands, or branches into an edge block that
     * needs their destination.
     */
    private static BitSet blockedPatterns(Node node, List<Instruction> samples, LivenessAnalysis liveness) {
        Instruction inst = node.instruction();
        BitSet result = new BitSet(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            Instruction pattern = samples.get(i);
            String x = pattern.getDest();
            boolean stop = inst.getArgs().contains(x);
            if (inst.hasDest()) {
                stop |= inst.getDest().equals(x) || pattern.getArgs().contains(inst.getDest());
            }
            if (inst.isTerminator()) {
                for (BasicBlock succ : node.block().getSuccessors()) {
                    stop |= succ.isSynthetic() && liveness.getLiveIn(succ).contains(x);
                }
            }
            if (stop) {
                result.set(i);
            }
        }
        return result;
    }

    /* faint code */

    private int eliminateFaint(ControlFlowGraph cfg) {
        FaintnessAnalysis faintness = new FaintnessAnalysis(cfg).analyze();
        int removed = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            int size = block.getInstructions().size();
            block.getInstructions().removeIf(inst -> {
                boolean faint = faintness.isFaint(inst);
                if (faint) {
                    log.debug("@{}: remove faint {}", cfg.getName(), inst.toBril());
                }
                return faint;
            });
            removed += size - block.getInstructions().size();
        }
        return removed;
    }
}
