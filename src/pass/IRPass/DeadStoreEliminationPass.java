package pass.IRPass;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.instructions.AllocInst;
import ir.value.instructions.FreeInst;
import ir.value.instructions.IdInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.StoreInst;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.AbstractLocation;
import pass.IRPass.analysis.AliasAnalysis;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Dead store elimination.
 *
 * A backward must analysis over pointer variables tracks "the memory this
 * pointer addresses is overwritten or freed before anything may read it". A
 * {@code store p v} or {@code free p} establishes the fact for {@code p}, a
 * load through anything that may alias {@code p} or a redefinition of
 * {@code p} destroys it. At returns the fact holds for pointers that only
 * ever address local allocations that never escape.
 *
 * <p>
 * A store carrying the fact is removed only when it cannot fault:
 * <ul>
 * <li>its pointer is the base of a live allocation on every path (a forward
 * must analysis: {@code alloc} and copies of it, killed by any {@code free}
 * that may alias), or</li>
 * <li>a later {@code store} through the same name follows with nothing in
 * between that prints or may fault, so that store faults exactly where this
 * one would have.</li>
 * </ul>
 */
public class DeadStoreEliminationPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.DeadStoreElimination;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: DeadStoreElimination on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        int removed = 0;
        int round;
        do {
            round = removeDeadStores(cfg);
            removed += round;
        } while (round > 0);
        log.info("@{}: removed {} dead store(s)", cfg.getName(), removed);
        return cfg;
    }

    private int removeDeadStores(ControlFlowGraph cfg) {
        AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
        Universe<String> pointers = new Universe<>(alias.getPointers());
        int n = pointers.size();
        if (n == 0) {
            return 0;
        }
        Map<Instruction, BitSet> safe = livePointers(cfg, alias, pointers);

        // [0, n): dead, [n, 2n): dead with no fault or output before the overwrite
        Set<AbstractLocation> escaping = alias.escapingLocations();
        BitSet boundary = new BitSet(2 * n);
        for (String p : pointers.getElements()) {
            Set<AbstractLocation> targets = alias.pointsToAnywhere(p);
            if (!targets.isEmpty() && Collections.disjoint(targets, escaping)) {
                boundary.set(pointers.indexOf(p));
            }
        }

        DataflowResult<BasicBlock> result = new DataflowAnalysis<BasicBlock>(cfg, 2 * n,
                Direction.BACKWARD, MeetOperator.INTERSECTION, (block, out) -> {
                    BitSet state = (BitSet) out.clone();
                    List<Instruction> insts = new ArrayList<>(block.getInstructions());
                    Collections.reverse(insts);
                    insts.forEach(inst -> step(inst, state, alias, pointers));
                    return state;
                }).setBoundary(boundary).solve();

        int removed = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet dead = (BitSet) result.getOut(block).clone();
            List<Instruction> insts = block.getInstructions();
            List<Instruction> doomed = new ArrayList<>();
            for (int i = insts.size() - 1; i >= 0; i--) {
                Instruction inst = insts.get(i);
                if (inst instanceof StoreInst store) {
                    int p = pointers.indexOf(store.getPointer());
                    boolean overwritten = dead.get(n + p) || (dead.get(p) && safe.get(inst).get(p));
                    if (overwritten) {
                        log.debug("@{}: remove dead {}", cfg.getName(), store.toBril());
                        doomed.add(store);
                    }
                }
                step(inst, dead, alias, pointers);
            }
            insts.removeAll(doomed);
            removed += doomed.size();
        }
        return removed;
    }

    /**
     * Backward over one instruction: OUT to IN.
     */
    private void step(Instruction inst, BitSet dead, AliasAnalysis alias, Universe<String> pointers) {
        int n = pointers.size();
        if (inst.hasDest()) {
            int d = pointers.indexOf(inst.getDest());
            if (d >= 0) {
                dead.clear(d);
                dead.clear(n + d);
            }
        }
        if (faultsOrPrints(inst)) {
            dead.clear(n, 2 * n);
        }
        if (inst instanceof LoadInst load) {
            for (int p = dead.nextSetBit(0); p >= 0 && p < n; p = dead.nextSetBit(p + 1)) {
                if (alias.mayAlias(inst, pointers.get(p), load.getPointer())) {
                    dead.clear(p);
                }
            }
        } else if (inst instanceof StoreInst store) {
            int p = pointers.indexOf(store.getPointer());
            dead.set(p);
            dead.set(n + p);
        } else if (inst instanceof FreeInst free) {
            dead.set(pointers.indexOf(free.getPointer()));
        }
    }

    private static boolean faultsOrPrints(Instruction inst) {
        Opcode op = inst.opCode();
        return inst.mayTrap() || op == Opcode.STORE || op == Opcode.FREE || op == Opcode.PRINT
                || op == Opcode.ALLOC;
    }

    /**
     * For every instruction, the pointers that hold the base of a live
     * allocation right before it on every path.
     */
    private static Map<Instruction, BitSet> livePointers(ControlFlowGraph cfg, AliasAnalysis alias,
            Universe<String> pointers) {
        DataflowResult<BasicBlock> result = new DataflowAnalysis<BasicBlock>(cfg, pointers.size(),
                Direction.FORWARD, MeetOperator.INTERSECTION, (block, in) -> {
                    BitSet state = (BitSet) in.clone();
                    block.getInstructions().forEach(inst -> liveStep(inst, state, alias, pointers));
                    return state;
                }).solve();

        Map<Instruction, BitSet> before = new HashMap<>();
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet state = (BitSet) result.getIn(block).clone();
            for (Instruction inst : block.getInstructions()) {
                before.put(inst, (BitSet) state.clone());
                liveStep(inst, state, alias, pointers);
            }
        }
        return before;
    }

    private static void liveStep(Instruction inst, BitSet state, AliasAnalysis alias, Universe<String> pointers) {
        if (inst instanceof FreeInst free) {
            for (int p = state.nextSetBit(0); p >= 0; p = state.nextSetBit(p + 1)) {
                if (alias.mayAlias(inst, pointers.get(p), free.getPointer())) {
                    state.clear(p);
                }
            }
            return;
        }
        if (!inst.hasDest()) {
            return;
        }
        int d = pointers.indexOf(inst.getDest());
        if (d < 0) {
            return;
        }
        boolean base = inst instanceof AllocInst;
        if (inst instanceof IdInst id) {
            int s = pointers.indexOf(id.getSource());
            base = s >= 0 && state.get(s);
        }
        state.set(d, base);
    }
}
