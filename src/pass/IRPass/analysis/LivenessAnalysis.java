package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.GenKillTransfer;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;

/**
 * Live variables: block-level fixpoint, then a backward replay of every
 * block for per-instruction facts.
 */
public class LivenessAnalysis {
    private final ControlFlowGraph cfg;
    private final Universe<String> variables;
    private DataflowResult<BasicBlock> blockResult;

    // 每条指令之后的活跃变量集合
    private final Map<Instruction, BitSet> instLiveOut = new HashMap<>();

    public LivenessAnalysis(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.variables = new Universe<>(cfg.collectVariables());
    }

    public LivenessAnalysis analyze() {
        GenKillTransfer<BasicBlock> transfer = new GenKillTransfer<>();
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet gen = new BitSet();
            BitSet kill = new BitSet();
            // 本块内首次使用先于定义的才进入 GEN
            for (Instruction inst : block.getInstructions()) {
                for (String arg : inst.getArgs()) {
                    int id = variables.indexOf(arg);
                    if (!kill.get(id)) {
                        gen.set(id);
                    }
                }
                if (inst.hasDest()) {
                    kill.set(variables.indexOf(inst.getDest()));
                }
            }
            transfer.put(block, gen, kill);
        }

        blockResult = new DataflowAnalysis<>(cfg, variables.size(), Direction.BACKWARD, MeetOperator.UNION, transfer)
                .solve();

        for (BasicBlock block : cfg.getBlocks()) {
            BitSet live = blockResult.getOut(block);
            List<Instruction> insts = new ArrayList<>(block.getInstructions());
            Collections.reverse(insts);
            for (Instruction inst : insts) {
                instLiveOut.put(inst, (BitSet) live.clone());
                step(inst, live);
            }
        }
        return this;
    }

    /**
     * live := (live - def) + uses, moving backward over {@code inst}.
     */
    public void step(Instruction inst, BitSet live) {
        if (inst.hasDest()) {
            live.clear(variables.indexOf(inst.getDest()));
        }
        for (String arg : inst.getArgs()) {
            live.set(variables.indexOf(arg));
        }
    }

    public Universe<String> getVariables() {
        return variables;
    }

    public BitSet liveInBits(BasicBlock block) {
        return blockResult.getIn(block);
    }

    public BitSet liveOutBits(BasicBlock block) {
        return blockResult.getOut(block);
    }

    public Set<String> getLiveIn(BasicBlock block) {
        return new TreeSet<>(variables.elementsOf(blockResult.getIn(block)));
    }

    public Set<String> getLiveOut(BasicBlock block) {
        return new TreeSet<>(variables.elementsOf(blockResult.getOut(block)));
    }

    public Set<String> getLiveAfter(Instruction inst) {
        return new TreeSet<>(variables.elementsOf(instLiveOut.get(inst)));
    }

    public boolean isLiveAfter(Instruction inst, String var) {
        int id = variables.indexOf(var);
        return id >= 0 && instLiveOut.get(inst).get(id);
    }
}
