package pass.IRPass;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.LivenessAnalysis;
import util.LoggingManager;
import util.logging.Logger;

import java.util.BitSet;
import java.util.List;

/**
 * Liveness-driven dead code elimination.
 *
 * An instruction is deleted when its destination is dead right after it and
 * it has neither side effects nor a possible fault. Deletions can make more
 * values dead, so liveness and the sweep repeat until a round deletes
 * nothing. Unreachable blocks go first.
 */
public class DeadCodeEliminationPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.DeadCodeElimination;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: DeadCodeElimination on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        if (cfg.removeUnreachableBlocks()) {
            log.debug("@{}: removed unreachable blocks", cfg.getName());
        }

        int removed = 0;
        int round;
        do {
            round = removeDeadInstructions(cfg);
            removed += round;
        } while (round > 0);

        log.info("@{}: removed {} dead instruction(s)", cfg.getName(), removed);
        return cfg;
    }

    private int removeDeadInstructions(ControlFlowGraph cfg) {
        LivenessAnalysis liveness = new LivenessAnalysis(cfg).analyze();
        int removed = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            BitSet live = liveness.liveOutBits(block);
            List<Instruction> insts = block.getInstructions();
            for (int i = insts.size() - 1; i >= 0; i--) {
                Instruction inst = insts.get(i);
                if (inst.isRemovable() && !live.get(liveness.getVariables().indexOf(inst.getDest()))) {
                    log.debug("@{}: remove {}", cfg.getName(), inst.toBril());
                    insts.remove(i);
                    removed++;
                    continue;
                }
                liveness.step(inst, live);
            }
        }
        return removed;
    }
}
