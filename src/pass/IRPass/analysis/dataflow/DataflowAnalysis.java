package pass.IRPass.analysis.dataflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.LoggingManager;
import util.logging.Logger;

/**
 * Generic worklist solver for monotone bit-vector problems.
 *
 * <p>
 * Every fact starts at the meet identity except the boundary, which is the
 * IN of the entry for forward problems and the OUT of every exit for
 * backward problems. Nodes are revisited until no fact changes.
 */
public class DataflowAnalysis<N> {
    private static final Logger log = LoggingManager.getLogger(DataflowAnalysis.class);

    private final FlowGraph<N> graph;
    private final int universeSize;
    private final Direction direction;
    private final MeetOperator meet;
    private final TransferFunction<N> transfer;
    private BitSet boundary;

    public DataflowAnalysis(FlowGraph<N> graph, int universeSize, Direction direction,
            MeetOperator meet, TransferFunction<N> transfer) {
        this.graph = graph;
        this.universeSize = universeSize;
        this.direction = direction;
        this.meet = meet;
        this.transfer = transfer;
        this.boundary = new BitSet(universeSize);
    }

    public DataflowAnalysis<N> setBoundary(BitSet boundary) {
        this.boundary = (BitSet) boundary.clone();
        return this;
    }

    public DataflowResult<N> solve() {
        boolean forward = direction == Direction.FORWARD;
        List<N> nodes = new ArrayList<>(graph.getNodes());
        if (!forward) {
            Collections.reverse(nodes);
        }

        Set<N> boundaryNodes = new HashSet<>(forward ? List.of(graph.getEntry()) : graph.getExits());

        // input: fact flowing into the transfer, output: fact it produces
        Map<N, BitSet> input = new HashMap<>();
        Map<N, BitSet> output = new HashMap<>();
        for (N node : nodes) {
            input.put(node, meet.identity(universeSize));
            output.put(node, meet.identity(universeSize));
        }

        Deque<N> worklist = new ArrayDeque<>(nodes);
        Set<N> queued = new HashSet<>(nodes);
        int iterations = 0;

        while (!worklist.isEmpty()) {
            N node = worklist.poll();
            queued.remove(node);
            iterations++;

            Collection<N> sources = forward ? graph.predecessorsOf(node) : graph.successorsOf(node);
            BitSet in;
            if (boundaryNodes.contains(node)) {
                in = (BitSet) boundary.clone();
                for (N src : sources) {
                    meet.meetInto(in, output.get(src));
                }
            } else if (sources.isEmpty()) {
                in = meet.identity(universeSize);
            } else {
                in = null;
                for (N src : sources) {
                    if (in == null) {
                        in = (BitSet) output.get(src).clone();
                    } else {
                        meet.meetInto(in, output.get(src));
                    }
                }
            }
            input.put(node, in);

            BitSet out = transfer.apply(node, in);
            if (!out.equals(output.get(node))) {
                output.put(node, out);
                for (N dep : forward ? graph.successorsOf(node) : graph.predecessorsOf(node)) {
                    if (queued.add(dep)) {
                        worklist.add(dep);
                    }
                }
            }
        }

        log.debug("{} {} analysis converged after {} node visits", direction, meet, iterations);
        return forward
                ? new DataflowResult<>(input, output, iterations)
                : new DataflowResult<>(output, input, iterations);
    }
}
