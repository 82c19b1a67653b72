package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.dataflow.FlowGraph;

/**
 * The control-flow graph at instruction granularity: one node per
 * instruction, linked to its neighbours in the block, the first instruction
 * of a block to the terminators of its predecessors.
 *
 * Built as a snapshot; rebuild after changing the CFG.
 */
public class InstructionGraph implements FlowGraph<InstructionGraph.Node> {

    public record Node(BasicBlock block, Instruction instruction) {
        @Override
        public String toString() {
            return block + ": " + instruction.toBril();
        }
    }

    private final ControlFlowGraph cfg;
    private final List<Node> nodes = new ArrayList<>();
    private final Map<Instruction, Node> nodeOf = new HashMap<>();
    private final Map<Node, List<Node>> preds = new HashMap<>();
    private final Map<Node, List<Node>> succs = new HashMap<>();

    public InstructionGraph(ControlFlowGraph cfg) {
        this.cfg = cfg;
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                Node node = new Node(block, inst);
                nodes.add(node);
                nodeOf.put(inst, node);
                preds.put(node, new ArrayList<>());
                succs.put(node, new ArrayList<>());
            }
        }
        for (BasicBlock block : cfg.getBlocks()) {
            List<Instruction> insts = block.getInstructions();
            for (int i = 0; i + 1 < insts.size(); i++) {
                link(nodeOf.get(insts.get(i)), nodeOf.get(insts.get(i + 1)));
            }
            Node last = nodeOf.get(insts.get(insts.size() - 1));
            for (BasicBlock succ : block.getSuccessors()) {
                link(last, nodeOf.get(succ.getInstructions().get(0)));
            }
        }
    }

    private void link(Node from, Node to) {
        succs.get(from).add(to);
        preds.get(to).add(from);
    }

    public ControlFlowGraph getCfg() {
        return cfg;
    }

    public Node nodeOf(Instruction inst) {
        return nodeOf.get(inst);
    }

    @Override
    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public Node getEntry() {
        return nodeOf.get(cfg.getEntry().getInstructions().get(0));
    }

    @Override
    public Collection<Node> predecessorsOf(Node node) {
        return preds.get(node);
    }

    @Override
    public Collection<Node> successorsOf(Node node) {
        return succs.get(node);
    }
}
