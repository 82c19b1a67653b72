package pass.IRPass;

import ir.ControlFlowGraph;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Puts a synthetic {@code jmp}-only block on every edge whose source has
 * several successors and whose target has several predecessors. Edge blocks
 * that stay empty are folded away again when the graph is linearized.
 */
public class CriticalEdgeSplitPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.CriticalEdgeSplit;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph cfg) {
        log.info("Running pass: CriticalEdgeSplit on @{}", cfg.getName());
        ControlFlowGraph result = cfg.copy();
        int split = result.splitCriticalEdges();
        log.debug("@{}: split {} critical edge(s)", cfg.getName(), split);
        return result;
    }
}
