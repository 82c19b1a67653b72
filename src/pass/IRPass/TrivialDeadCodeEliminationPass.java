package pass.IRPass;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.HashSet;
import java.util.Set;

/**
 * Flow-insensitive dead code elimination: drops removable definitions whose
 * destination no instruction of the function reads, until none is left.
 */
public class TrivialDeadCodeEliminationPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.TrivialDeadCodeElimination;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: TrivialDeadCodeElimination on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        int removed = 0;
        boolean changed;
        do {
            Set<String> used = new HashSet<>();
            for (BasicBlock block : cfg.getBlocks()) {
                for (Instruction inst : block.getInstructions()) {
                    used.addAll(inst.getArgs());
                }
            }
            changed = false;
            for (BasicBlock block : cfg.getBlocks()) {
                int before = block.getInstructions().size();
                block.getInstructions().removeIf(inst -> inst.isRemovable() && !used.contains(inst.getDest()));
                int delta = before - block.getInstructions().size();
                if (delta > 0) {
                    removed += delta;
                    changed = true;
                }
            }
        } while (changed);
        log.info("@{}: removed {} unused definition(s)", cfg.getName(), removed);
        return cfg;
    }
}
