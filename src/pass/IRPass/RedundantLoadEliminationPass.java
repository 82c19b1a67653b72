package pass.IRPass;

import java.util.BitSet;
import java.util.List;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.FreeInst;
import ir.value.instructions.IdInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.StoreInst;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.AliasAnalysis;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Redundant load elimination.
 *
 * Forward must analysis of available memory values: a pair (p, v) means the
 * memory addressed by {@code p} holds the value of {@code v} on every path.
 * Pairs come from {@code store p v} and {@code v = load p}; a store or free
 * through a possibly aliasing pointer and any redefinition of either name
 * kill them. A load through a pointer that must alias an available pair's
 * pointer becomes an {@code id} of the value.
 */
public class RedundantLoadEliminationPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    /** (pointer, value) */
    private record MemoryValue(String pointer, String value) {
    }

    @Override
    public IRPassType getType() {
        return IRPassType.RedundantLoadElimination;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: RedundantLoadElimination on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        int replaced = 0;
        int round;
        // a load turned into a copy can make new pointers must-alias
        do {
            round = replaceRedundantLoads(cfg);
            replaced += round;
        } while (round > 0);
        log.info("@{}: replaced {} redundant load(s)", cfg.getName(), replaced);
        return cfg;
    }

    private int replaceRedundantLoads(ControlFlowGraph cfg) {
        AliasAnalysis alias = new AliasAnalysis(cfg).analyze();

        Universe<MemoryValue> pairs = new Universe<>();
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                if (inst instanceof StoreInst store) {
                    pairs.add(new MemoryValue(store.getPointer(), store.getValue()));
                } else if (inst instanceof LoadInst load && !load.getDest().equals(load.getPointer())) {
                    pairs.add(new MemoryValue(load.getPointer(), load.getDest()));
                }
            }
        }

        DataflowResult<BasicBlock> result = new DataflowAnalysis<BasicBlock>(cfg, pairs.size(),
                Direction.FORWARD, MeetOperator.INTERSECTION, (block, in) -> {
                    BitSet state = (BitSet) in.clone();
                    block.getInstructions().forEach(inst -> step(inst, state, alias, pairs));
                    return state;
                }).solve();

        int replaced = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet available = (BitSet) result.getIn(block).clone();
            List<Instruction> insts = block.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst instanceof LoadInst load) {
                    MemoryValue hit = findAvailable(load, available, alias, pairs);
                    if (hit != null) {
                        insts.set(i, new IdInst(load.getDest(), load.getType(), hit.value()));
                        log.debug("@{}: {} -> id {}", cfg.getName(), load.toBril(), hit.value());
                        replaced++;
                    }
                }
                step(inst, available, alias, pairs);
            }
        }
        return replaced;
    }

    private MemoryValue findAvailable(LoadInst load, BitSet available, AliasAnalysis alias,
            Universe<MemoryValue> pairs) {
        for (int i = available.nextSetBit(0); i >= 0; i = available.nextSetBit(i + 1)) {
            MemoryValue pair = pairs.get(i);
            if (alias.mustAlias(load, load.getPointer(), pair.pointer())) {
                return pair;
            }
        }
        return null;
    }

    private void step(Instruction inst, BitSet state, AliasAnalysis alias, Universe<MemoryValue> pairs) {
        if (inst instanceof StoreInst store) {
            killAliased(inst, store.getPointer(), state, alias, pairs);
            state.set(pairs.indexOf(new MemoryValue(store.getPointer(), store.getValue())));
        } else if (inst instanceof FreeInst free) {
            killAliased(inst, free.getPointer(), state, alias, pairs);
        }
        if (inst.hasDest()) {
            String dest = inst.getDest();
            for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
                MemoryValue pair = pairs.get(i);
                if (pair.pointer().equals(dest) || pair.value().equals(dest)) {
                    state.clear(i);
                }
            }
            if (inst instanceof LoadInst load) {
                int id = pairs.indexOf(new MemoryValue(load.getPointer(), dest));
                if (id >= 0) {
                    state.set(id);
                }
            }
        }
    }

    private void killAliased(Instruction at, String pointer, BitSet state, AliasAnalysis alias,
            Universe<MemoryValue> pairs) {
        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            if (alias.mayAlias(at, pairs.get(i).pointer(), pointer)) {
                state.clear(i);
            }
        }
    }
}
