package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;

/**
 * Strong liveness. A variable is strongly live when an effectful instruction
 * reads it, or an assignment whose own destination is strongly live does.
 * Assignments feeding only each other, such as a counter nobody prints, stay
 * faint although ordinary liveness keeps them alive.
 *
 * Not expressible as gen/kill, the block transfer replays {@link #step}.
 */
public class FaintnessAnalysis {
    private final ControlFlowGraph cfg;
    private final Universe<String> variables;
    private final Map<Instruction, BitSet> liveAfter = new HashMap<>();

    public FaintnessAnalysis(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.variables = new Universe<>(cfg.collectVariables());
    }

    public FaintnessAnalysis analyze() {
        DataflowResult<BasicBlock> result = new DataflowAnalysis<BasicBlock>(cfg, variables.size(),
                Direction.BACKWARD, MeetOperator.UNION, (block, out) -> {
                    BitSet live = (BitSet) out.clone();
                    List<Instruction> insts = new ArrayList<>(block.getInstructions());
                    Collections.reverse(insts);
                    insts.forEach(inst -> step(inst, live));
                    return live;
                }).solve();

        for (BasicBlock block : cfg.getBlocks()) {
            BitSet live = (BitSet) result.getOut(block).clone();
            List<Instruction> insts = block.getInstructions();
            for (int i = insts.size() - 1; i >= 0; i--) {
                liveAfter.put(insts.get(i), (BitSet) live.clone());
                step(insts.get(i), live);
            }
        }
        return this;
    }

    /**
     * Backward over one instruction. The operands of a removable assignment
     * become live only when its destination is.
     */
    public void step(Instruction inst, BitSet live) {
        boolean needed = !inst.isRemovable() || live.get(variables.indexOf(inst.getDest()));
        if (inst.hasDest()) {
            live.clear(variables.indexOf(inst.getDest()));
        }
        if (needed) {
            for (String arg : inst.getArgs()) {
                live.set(variables.indexOf(arg));
            }
        }
    }

    public boolean isStronglyLiveAfter(Instruction inst, String var) {
        int id = variables.indexOf(var);
        return id >= 0 && liveAfter.get(inst).get(id);
    }

    /**
     * A removable assignment whose destination is not strongly live after it.
     */
    public boolean isFaint(Instruction inst) {
        return inst.isRemovable() && !isStronglyLiveAfter(inst, inst.getDest());
    }
}
