package pass.IRPass.analysis.dataflow;

import java.util.BitSet;

@FunctionalInterface
public interface TransferFunction<N> {
    /**
     * Compute the fact on the far side of {@code node}. Must be monotone and
     * must not modify {@code input}.
     */
    BitSet apply(N node, BitSet input);
}
