package pass.IRPass.analysis.dataflow;

import java.util.BitSet;
import java.util.Map;

/**
 * Fixpoint facts of one analysis. {@code in} is the fact at the top of a node
 * and {@code out} the fact at its bottom, whatever the direction.
 */
public class DataflowResult<N> {
    private final Map<N, BitSet> in;
    private final Map<N, BitSet> out;
    private final int iterations;

    DataflowResult(Map<N, BitSet> in, Map<N, BitSet> out, int iterations) {
        this.in = in;
        this.out = out;
        this.iterations = iterations;
    }

    public BitSet getIn(N node) {
        return (BitSet) in.get(node).clone();
    }

    public BitSet getOut(N node) {
        return (BitSet) out.get(node).clone();
    }

    public int getIterations() {
        return iterations;
    }
}
