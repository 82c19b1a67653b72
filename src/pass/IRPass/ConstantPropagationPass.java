package pass.IRPass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import ir.ControlFlowGraph;
import ir.InstructionVisitor;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.constants.Constant;
import ir.value.constants.ConstantBool;
import ir.value.instructions.*;
import pass.IRPassType;
import pass.IRPass.analysis.LatticeValue;
import pass.IRPass.analysis.LatticeValue.Const;
import pass.IRPass.analysis.LatticeValue.Nac;
import pass.IRPass.analysis.LatticeValue.Undef;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Constant folding and propagation.
 *
 * A forward worklist analysis maps every variable to Undef / CONST / NAC at
 * block boundaries. Parameters enter as NAC. Once stable, value operations
 * with constant results become {@code const}, branches on a constant become
 * jumps, and blocks no longer reachable are removed.
 */
public class ConstantPropagationPass implements IRPass {
    private static final Logger logger = LoggingManager.getLogger(ConstantPropagationPass.class);

    private Map<BasicBlock, Map<String, LatticeValue>> inStates;
    private Map<BasicBlock, Map<String, LatticeValue>> outStates;

    @Override
    public IRPassType getType() {
        return IRPassType.ConstantPropagation;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        logger.info("Running pass: ConstantPropagation on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        analyze(cfg);

        int folded = 0;
        int branches = 0;
        for (BasicBlock bb : cfg.getBlocks()) {
            Map<String, LatticeValue> state = new HashMap<>(inStates.get(bb));
            List<Instruction> insts = bb.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst instanceof BranchInst br) {
                    LatticeValue cond = lookup(state, br.getCondition());
                    if (cond instanceof Const c) {
                        boolean taken = ((ConstantBool) c.getValue()).getValue();
                        insts.set(i, new JumpInst(taken ? br.getThenLabel() : br.getElseLabel()));
                        logger.debug("@{}: {} folded to jmp", cfg.getName(), br.toBril());
                        branches++;
                    }
                    continue;
                }
                if (!inst.hasDest()) {
                    continue;
                }
                LatticeValue value = inst.accept(new Evaluator(state));
                state.put(inst.getDest(), value);
                if (value instanceof Const c && inst.opCode().isValueOp()) {
                    insts.set(i, new ConstInst(inst.getDest(), c.getValue()));
                    logger.debug("@{}: {} folded to {}", cfg.getName(), inst.toBril(), c.getValue());
                    folded++;
                }
            }
        }

        if (branches > 0) {
            cfg.rebuildEdges();
            cfg.removeUnreachableBlocks();
        }
        logger.info("@{}: folded {} instruction(s), {} branch(es)", cfg.getName(), folded, branches);
        return cfg;
    }

    /**
     * @return the lattice value of every variable on entry to each block
     */
    public Map<BasicBlock, Map<String, LatticeValue>> analyze(ControlFlowGraph cfg) {
        inStates = new HashMap<>();
        outStates = new HashMap<>();
        for (BasicBlock bb : cfg.getBlocks()) {
            inStates.put(bb, new HashMap<>());
            outStates.put(bb, new HashMap<>());
        }

        Queue<BasicBlock> worklist = new ArrayDeque<>(cfg.getBlocks());
        Set<BasicBlock> queued = new LinkedHashSet<>(cfg.getBlocks());
        while (!worklist.isEmpty()) {
            BasicBlock bb = worklist.poll();
            queued.remove(bb);

            Map<String, LatticeValue> in = computeInState(cfg, bb);
            inStates.put(bb, in);
            Map<String, LatticeValue> out = computeOutState(bb, in);
            if (!out.equals(outStates.get(bb))) {
                outStates.put(bb, out);
                for (BasicBlock succ : bb.getSuccessors()) {
                    if (queued.add(succ)) {
                        worklist.add(succ);
                    }
                }
            }
        }
        return inStates;
    }

    private Map<String, LatticeValue> computeInState(ControlFlowGraph cfg, BasicBlock bb) {
        Map<String, LatticeValue> newInState = new HashMap<>();
        if (bb == cfg.getEntry()) {
            for (Argument arg : cfg.getFunction().getArguments()) {
                newInState.put(arg.name(), Nac.getInstance());
            }
        }
        for (BasicBlock pred : bb.getPredecessors()) {
            for (Map.Entry<String, LatticeValue> entry : outStates.get(pred).entrySet()) {
                newInState.merge(entry.getKey(), entry.getValue(), LatticeValue::meet);
            }
        }
        return newInState;
    }

    private Map<String, LatticeValue> computeOutState(BasicBlock bb, Map<String, LatticeValue> inState) {
        Map<String, LatticeValue> state = new HashMap<>(inState);
        for (Instruction inst : bb.getInstructions()) {
            if (inst.hasDest()) {
                state.put(inst.getDest(), inst.accept(new Evaluator(state)));
            }
        }
        // Undef entries carry no information
        state.values().removeIf(v -> v instanceof Undef);
        return state;
    }

    private static LatticeValue lookup(Map<String, LatticeValue> state, String var) {
        return state.getOrDefault(var, Undef.getInstance());
    }

    /**
     * Abstract value of the destination of one instruction.
     */
    private static class Evaluator implements InstructionVisitor<LatticeValue> {
        private final Map<String, LatticeValue> state;

        Evaluator(Map<String, LatticeValue> state) {
            this.state = state;
        }

        private LatticeValue fold(Instruction inst) {
            List<Constant> operands = new ArrayList<>();
            boolean undef = false;
            for (String arg : inst.getArgs()) {
                LatticeValue v = lookup(state, arg);
                if (v instanceof Nac) {
                    return Nac.getInstance();
                }
                if (v instanceof Undef) {
                    undef = true;
                } else {
                    operands.add(((Const) v).getValue());
                }
            }
            if (undef) {
                return Undef.getInstance();
            }
            Constant result = Constant.fold(inst.opCode(), operands);
            return result == null ? Nac.getInstance() : new Const(result);
        }

        @Override
        public LatticeValue visit(ConstInst inst) {
            return new Const(inst.getValue());
        }

        @Override
        public LatticeValue visit(BinOperator inst) {
            return fold(inst);
        }

        @Override
        public LatticeValue visit(ICmpInst inst) {
            return fold(inst);
        }

        @Override
        public LatticeValue visit(UnaryOperator inst) {
            return fold(inst);
        }

        @Override
        public LatticeValue visit(AllocInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(FreeInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(PtrAddInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(LoadInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(StoreInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(IdInst inst) {
            return lookup(state, inst.getSource());
        }

        @Override
        public LatticeValue visit(BranchInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(JumpInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(ReturnInst inst) {
            return Nac.getInstance();
        }

        @Override
        public LatticeValue visit(PrintInst inst) {
            return Nac.getInstance();
        }
    }
}
