package pass.IRPass;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import driver.Config;
import exception.CompileException;
import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.IdInst;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.Expression;
import pass.IRPass.analysis.InstructionGraph;
import pass.IRPass.analysis.InstructionGraph.Node;
import pass.IRPass.analysis.LivenessAnalysis;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.GenKillTransfer;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Lazy code motion over the instruction graph.
 *
 * <pre>
 * anticipated  backward, ∩   in  = use ∪ (out - kill)
 * available    forward,  ∩   out = (ant.in ∪ in) - kill
 * earliest                   ant.in - avail.in
 * postponable  forward,  ∩   out = (earliest ∪ in) - use
 * latest                     (earliest ∪ post.in) ∩ (use ∪ ¬ ∩succ(earliest ∪ post.in))
 * used         backward, ∪   in  = (use ∪ out) - latest
 * </pre>
 *
 * {@code t = e} goes before every node in latest ∩ used.out, and every use
 * of {@code e} in ¬latest ∪ used.out reads {@code t} instead. The copies
 * introduced this way are then propagated into their uses and dropped when
 * dead. A copy that stays live, such as one carried around a loop, would
 * cost an instruction of its own; such an expression is left untouched and
 * the motion is redone without it.
 *
 * Instructions of split edge blocks kill every expression, so nothing is
 * placed on an edge, unless {@code lcm.edgePlacement} is set.
 */
public class LazyCodeMotionPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.LazyCodeMotion;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: LazyCodeMotion on @{}", input.getName());
        ControlFlowGraph base = input.copy();
        if (base.hasCriticalEdges()) {
            int split = base.splitCriticalEdges();
            log.debug("@{}: split {} critical edge(s) before code motion", base.getName(), split);
        }

        // expressions whose copies outlive copy propagation stay where they are
        Set<Expression> pinned = new HashSet<>();
        while (true) {
            ControlFlowGraph cfg = base.copy();
            InstructionGraph graph = new InstructionGraph(cfg);
            Universe<Expression> expressions = new Universe<>();
            for (Node node : graph.getNodes()) {
                Expression e = Expression.of(node.instruction());
                if (e != null && !pinned.contains(e)) {
                    expressions.add(e);
                }
            }
            if (expressions.size() == 0) {
                log.info("@{}: no movable expression", cfg.getName());
                return cfg;
            }

            Placement placement = solve(graph, expressions);
            Map<Instruction, Expression> introduced = transform(cfg, graph, expressions, placement);
            if (introduced.isEmpty()) {
                return cfg;
            }
            propagateCopies(cfg, introduced.keySet());
            removeDeadCopies(cfg, introduced.keySet());

            Set<Expression> surviving = new HashSet<>();
            for (BasicBlock block : cfg.getBlocks()) {
                for (Instruction inst : block.getInstructions()) {
                    if (introduced.containsKey(inst)) {
                        surviving.add(introduced.get(inst));
                    }
                }
            }
            if (surviving.isEmpty()) {
                return cfg;
            }
            log.debug("@{}: copies of {} stay live, leaving them in place", cfg.getName(), surviving);
            pinned.addAll(surviving);
        }
    }

    /**
     * Per-node latest and used-out sets.
     */
    private record Placement(Map<Node, BitSet> latest, DataflowResult<Node> used) {
    }

    private Placement solve(InstructionGraph graph, Universe<Expression> expressions) {
        int n = expressions.size();
        boolean edgePlacement = Config.getInstance().lcmEdgePlacement;

        Map<Node, BitSet> use = new HashMap<>();
        Map<Node, BitSet> kill = new HashMap<>();
        for (Node node : graph.getNodes()) {
            BitSet u = new BitSet(n);
            Expression e = Expression.of(node.instruction());
            if (e != null && expressions.contains(e)) {
                u.set(expressions.indexOf(e));
            }
            BitSet k = new BitSet(n);
            if (node.block().isSynthetic() && !edgePlacement) {
                k.set(0, n);
            } else if (node.instruction().hasDest()) {
                String dest = node.instruction().getDest();
                for (int i = 0; i < n; i++) {
                    if (expressions.get(i).usesVariable(dest)) {
                        k.set(i);
                    }
                }
            }
            use.put(node, u);
            kill.put(node, k);
        }

        GenKillTransfer<Node> antTransfer = new GenKillTransfer<>();
        graph.getNodes().forEach(node -> antTransfer.put(node, use.get(node), kill.get(node)));
        DataflowResult<Node> anticipated = new DataflowAnalysis<>(graph, n, Direction.BACKWARD,
                MeetOperator.INTERSECTION, antTransfer).solve();

        DataflowResult<Node> available = new DataflowAnalysis<Node>(graph, n, Direction.FORWARD,
                MeetOperator.INTERSECTION, (node, in) -> {
                    BitSet out = (BitSet) in.clone();
                    out.or(anticipated.getIn(node));
                    out.andNot(kill.get(node));
                    return out;
                }).solve();

        Map<Node, BitSet> earliest = new HashMap<>();
        for (Node node : graph.getNodes()) {
            BitSet e = (BitSet) anticipated.getIn(node).clone();
            e.andNot(available.getIn(node));
            earliest.put(node, e);
        }

        DataflowResult<Node> postponable = new DataflowAnalysis<Node>(graph, n, Direction.FORWARD,
                MeetOperator.INTERSECTION, (node, in) -> {
                    BitSet out = (BitSet) in.clone();
                    out.or(earliest.get(node));
                    out.andNot(use.get(node));
                    return out;
                }).solve();

        Map<Node, BitSet> latest = new HashMap<>();
        for (Node node : graph.getNodes()) {
            BitSet here = (BitSet) earliest.get(node).clone();
            here.or(postponable.getIn(node));

            BitSet succAll = null;
            for (Node succ : graph.successorsOf(node)) {
                BitSet s = (BitSet) earliest.get(succ).clone();
                s.or(postponable.getIn(succ));
                if (succAll == null) {
                    succAll = s;
                } else {
                    succAll.and(s);
                }
            }
            BitSet right = new BitSet(n);
            right.set(0, n);
            if (succAll != null) {
                right.andNot(succAll);
            }
            right.or(use.get(node));
            here.and(right);
            latest.put(node, here);
        }

        DataflowResult<Node> used = new DataflowAnalysis<Node>(graph, n, Direction.BACKWARD,
                MeetOperator.UNION, (node, out) -> {
                    BitSet in = (BitSet) out.clone();
                    in.or(use.get(node));
                    in.andNot(latest.get(node));
                    return in;
                }).solve();

        return new Placement(latest, used);
    }

    private Map<Instruction, Expression> transform(ControlFlowGraph cfg, InstructionGraph graph,
            Universe<Expression> expressions, Placement placement) {
        Map<Expression, String> temps = new HashMap<>();
        Map<Instruction, Expression> introduced = new IdentityHashMap<>();
        int inserted = 0;
        int rewritten = 0;

        // 先为每个需要插入的表达式分配临时变量
        Set<String> taken = cfg.collectVariables();
        int counter = 0;
        for (Node node : graph.getNodes()) {
            BitSet insert = (BitSet) placement.latest().get(node).clone();
            insert.and(placement.used().getOut(node));
            for (int i = insert.nextSetBit(0); i >= 0; i = insert.nextSetBit(i + 1)) {
                if (!temps.containsKey(expressions.get(i))) {
                    while (taken.contains("lcm.t" + counter)) {
                        counter++;
                    }
                    String t = "lcm.t" + counter;
                    taken.add(t);
                    temps.put(expressions.get(i), t);
                }
            }
        }

        for (Node node : graph.getNodes()) {
            BitSet latest = placement.latest().get(node);
            BitSet usedOut = placement.used().getOut(node);

            BitSet insert = (BitSet) latest.clone();
            insert.and(usedOut);
            for (int i = insert.nextSetBit(0); i >= 0; i = insert.nextSetBit(i + 1)) {
                Expression e = expressions.get(i);
                String t = temps.get(e);
                List<Instruction> insts = node.block().getInstructions();
                insts.add(indexOf(insts, node.instruction()), e.toInstruction(t));
                log.debug("@{}: insert {} = {} before {}", cfg.getName(), t, e, node);
                inserted++;
            }

            Expression e = Expression.of(node.instruction());
            if (e == null || !expressions.contains(e)) {
                continue;
            }
            int id = expressions.indexOf(e);
            if (!latest.get(id) || usedOut.get(id)) {
                Instruction old = node.instruction();
                String t = temps.get(e);
                if (t == null) {
                    throw new CompileException("lazy code motion: no computation of " + e + " reaches " + node);
                }
                Instruction copy = new IdInst(old.getDest(), old.getType(), t);
                List<Instruction> insts = node.block().getInstructions();
                insts.set(indexOf(insts, old), copy);
                introduced.put(copy, e);
                rewritten++;
            }
        }
        log.info("@{}: inserted {} computation(s), rewrote {} use(s)", cfg.getName(), inserted, rewritten);
        return introduced;
    }

    private static int indexOf(List<Instruction> insts, Instruction inst) {
        for (int i = 0; i < insts.size(); i++) {
            if (insts.get(i) == inst) {
                return i;
            }
        }
        throw new IllegalStateException("instruction not in block: " + inst);
    }

    /**
     * Forward copy propagation restricted to the copies code motion created.
     */
    private void propagateCopies(ControlFlowGraph cfg, Set<Instruction> introduced) {
        Universe<List<String>> copies = new Universe<>();
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                if (introduced.contains(inst)) {
                    copies.add(List.of(inst.getDest(), inst.getArg(0)));
                }
            }
        }

        DataflowResult<BasicBlock> result = new DataflowAnalysis<BasicBlock>(cfg, copies.size(), Direction.FORWARD,
                MeetOperator.INTERSECTION, (block, in) -> {
                    BitSet state = (BitSet) in.clone();
                    block.getInstructions().forEach(inst -> copyStep(inst, state, copies, introduced));
                    return state;
                }).solve();

        int replaced = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet state = (BitSet) result.getIn(block).clone();
            for (Instruction inst : block.getInstructions()) {
                Map<String, String> mapping = new HashMap<>();
                for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
                    List<String> pair = copies.get(i);
                    if (inst.getArgs().contains(pair.get(0))) {
                        mapping.put(pair.get(0), pair.get(1));
                    }
                }
                if (!mapping.isEmpty()) {
                    inst.replaceArgs(mapping);
                    replaced += mapping.size();
                }
                copyStep(inst, state, copies, introduced);
            }
        }
        log.debug("@{}: propagated {} copy use(s)", cfg.getName(), replaced);
    }

    private static void copyStep(Instruction inst, BitSet state, Universe<List<String>> copies,
            Set<Instruction> introduced) {
        if (!inst.hasDest()) {
            return;
        }
        String dest = inst.getDest();
        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            if (copies.get(i).contains(dest)) {
                state.clear(i);
            }
        }
        if (introduced.contains(inst)) {
            state.set(copies.indexOf(List.of(dest, inst.getArg(0))));
        }
    }

    private void removeDeadCopies(ControlFlowGraph cfg, Set<Instruction> introduced) {
        int removed = 0;
        boolean changed;
        do {
            LivenessAnalysis liveness = new LivenessAnalysis(cfg).analyze();
            List<Instruction> dead = new ArrayList<>();
            for (BasicBlock block : cfg.getBlocks()) {
                for (Instruction inst : block.getInstructions()) {
                    if (introduced.contains(inst) && !liveness.isLiveAfter(inst, inst.getDest())) {
                        dead.add(inst);
                    }
                }
            }
            for (BasicBlock block : cfg.getBlocks()) {
                block.getInstructions().removeAll(dead);
            }
            removed += dead.size();
            changed = !dead.isEmpty();
        } while (changed);
        log.debug("@{}: dropped {} dead copy(ies)", cfg.getName(), removed);
    }
}
