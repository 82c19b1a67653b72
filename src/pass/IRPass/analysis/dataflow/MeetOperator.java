package pass.IRPass.analysis.dataflow;

import java.util.BitSet;

public enum MeetOperator {
    UNION,
    INTERSECTION;

    /**
     * The fact that leaves any other fact unchanged under this meet:
     * empty for union, the whole universe for intersection.
     */
    public BitSet identity(int universeSize) {
        BitSet set = new BitSet(universeSize);
        if (this == INTERSECTION) {
            set.set(0, universeSize);
        }
        return set;
    }

    /**
     * acc := acc meet other
     */
    public void meetInto(BitSet acc, BitSet other) {
        if (this == UNION) {
            acc.or(other);
        } else {
            acc.and(other);
        }
    }
}
