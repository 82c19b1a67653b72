package pass.IRPass.analysis.dataflow;

import java.util.Collection;
import java.util.List;

/**
 * The graph shape a {@link DataflowAnalysis} iterates over. Implemented at
 * block granularity by the control-flow graph and at instruction granularity
 * by {@code InstructionGraph}.
 */
public interface FlowGraph<N> {
    /**
     * @return every node, in layout order
     */
    List<N> getNodes();

    N getEntry();

    Collection<N> predecessorsOf(N node);

    Collection<N> successorsOf(N node);

    /**
     * Nodes without successors.
     */
    default List<N> getExits() {
        return getNodes().stream().filter(n -> successorsOf(n).isEmpty()).toList();
    }
}
