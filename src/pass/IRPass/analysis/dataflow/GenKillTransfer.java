package pass.IRPass.analysis.dataflow;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Separable transfer {@code out = gen | (in & ~kill)}.
 */
public class GenKillTransfer<N> implements TransferFunction<N> {
    private final Map<N, BitSet> gen = new HashMap<>();
    private final Map<N, BitSet> kill = new HashMap<>();

    public void put(N node, BitSet genSet, BitSet killSet) {
        gen.put(node, genSet);
        kill.put(node, killSet);
    }

    public BitSet getGen(N node) {
        return gen.getOrDefault(node, new BitSet());
    }

    public BitSet getKill(N node) {
        return kill.getOrDefault(node, new BitSet());
    }

    @Override
    public BitSet apply(N node, BitSet input) {
        BitSet out = (BitSet) input.clone();
        out.andNot(getKill(node));
        out.or(getGen(node));
        return out;
    }
}
