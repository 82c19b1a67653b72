package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ir.ControlFlowGraph;
import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.instructions.*;
import pass.IRPass.analysis.dataflow.DataflowAnalysis;
import pass.IRPass.analysis.dataflow.DataflowResult;
import pass.IRPass.analysis.dataflow.Direction;
import pass.IRPass.analysis.dataflow.MeetOperator;
import pass.IRPass.analysis.dataflow.Universe;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Flow-sensitive points-to analysis over abstract locations.
 *
 * <p>
 * Forward, union over (pointer variable, location) pairs. {@code alloc} binds
 * its site, {@code id} and {@code ptradd} copy the source set, a pointer
 * parameter points to {@link AbstractLocation#EXTERNAL} and a pointer loaded
 * from memory to every location, since any pointer may have been stored.
 *
 * <p>
 * A second, must, analysis tracks {@code id} copies between pointers so that
 * two different names can be proven to hold the same address.
 *
 * <p>
 * Queries refer to the program point right before the given instruction.
 */
public class AliasAnalysis {
    private static final Logger log = LoggingManager.getLogger(AliasAnalysis.class);

    private final ControlFlowGraph cfg;
    private final Universe<String> pointers = new Universe<>();
    private final Universe<AbstractLocation> locations = new Universe<>();
    private final Map<Instruction, AbstractLocation> allocSites = new HashMap<>();
    private final Universe<List<String>> copies = new Universe<>();

    private final Map<Instruction, BitSet> pointsToBefore = new HashMap<>();
    private final Map<Instruction, BitSet> copiesBefore = new HashMap<>();
    private final BitSet pointsToAnywhere = new BitSet();

    public AliasAnalysis(ControlFlowGraph cfg) {
        this.cfg = cfg;
    }

    public AliasAnalysis analyze() {
        collect();
        int width = pointers.size() * locations.size();

        BitSet boundary = new BitSet(width);
        for (Argument arg : cfg.getFunction().getArguments()) {
            if (arg.type().isPointer()) {
                boundary.set(bit(pointers.indexOf(arg.name()), locations.indexOf(AbstractLocation.EXTERNAL)));
            }
        }
        DataflowResult<BasicBlock> pts = new DataflowAnalysis<BasicBlock>(cfg, width, Direction.FORWARD,
                MeetOperator.UNION, (block, in) -> {
                    BitSet state = (BitSet) in.clone();
                    PointsToTransfer transfer = new PointsToTransfer(state);
                    block.getInstructions().forEach(inst -> inst.accept(transfer));
                    return state;
                }).setBoundary(boundary).solve();

        DataflowResult<BasicBlock> cps = new DataflowAnalysis<BasicBlock>(cfg, copies.size(), Direction.FORWARD,
                MeetOperator.INTERSECTION, (block, in) -> {
                    BitSet state = (BitSet) in.clone();
                    block.getInstructions().forEach(inst -> copyStep(inst, state));
                    return state;
                }).solve();

        for (BasicBlock block : cfg.getBlocks()) {
            BitSet state = pts.getIn(block);
            BitSet copyState = cps.getIn(block);
            PointsToTransfer transfer = new PointsToTransfer(state);
            for (Instruction inst : block.getInstructions()) {
                pointsToBefore.put(inst, (BitSet) state.clone());
                copiesBefore.put(inst, (BitSet) copyState.clone());
                pointsToAnywhere.or(state);
                inst.accept(transfer);
                copyStep(inst, copyState);
            }
            pointsToAnywhere.or(state);
        }
        log.debug("@{}: {} pointer(s), {} location(s)", cfg.getName(), pointers.size(), locations.size());
        return this;
    }

    private void collect() {
        locations.add(AbstractLocation.EXTERNAL);
        for (Argument arg : cfg.getFunction().getArguments()) {
            if (arg.type().isPointer()) {
                pointers.add(arg.name());
            }
        }
        for (BasicBlock block : cfg.getBlocks()) {
            List<Instruction> insts = block.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst.hasDest() && inst.getType().isPointer()) {
                    pointers.add(inst.getDest());
                }
                if (inst instanceof AllocInst alloc) {
                    AbstractLocation site = AbstractLocation.allocSite(block.getLabel(), i, alloc.getDest());
                    allocSites.put(inst, site);
                    locations.add(site);
                }
                if (inst instanceof IdInst id && id.getType().isPointer() && !id.getDest().equals(id.getSource())) {
                    copies.add(List.of(id.getDest(), id.getSource()));
                }
            }
        }
    }

    private int bit(int pointer, int location) {
        return pointer * locations.size() + location;
    }

    private void copyStep(Instruction inst, BitSet state) {
        if (!inst.hasDest()) {
            return;
        }
        String dest = inst.getDest();
        for (int i = state.nextSetBit(0); i >= 0; i = state.nextSetBit(i + 1)) {
            if (copies.get(i).contains(dest)) {
                state.clear(i);
            }
        }
        if (inst instanceof IdInst id) {
            int c = copies.indexOf(List.of(id.getDest(), id.getSource()));
            if (c >= 0) {
                state.set(c);
            }
        }
    }

    /**
     * Points-to transfer of a single instruction, applied in place.
     */
    private class PointsToTransfer implements InstructionVisitor<Void> {
        private final BitSet state;

        PointsToTransfer(BitSet state) {
            this.state = state;
        }

        private BitSet row(String var) {
            BitSet row = new BitSet();
            int p = pointers.indexOf(var);
            if (p < 0) {
                return row;
            }
            for (int l = 0; l < locations.size(); l++) {
                if (state.get(bit(p, l))) {
                    row.set(l);
                }
            }
            return row;
        }

        private void assign(String var, BitSet row) {
            int p = pointers.indexOf(var);
            state.clear(bit(p, 0), bit(p, 0) + locations.size());
            for (int l = row.nextSetBit(0); l >= 0; l = row.nextSetBit(l + 1)) {
                state.set(bit(p, l));
            }
        }

        private Void copy(Instruction inst, String source) {
            if (inst.getType().isPointer()) {
                assign(inst.getDest(), row(source));
            }
            return null;
        }

        @Override
        public Void visit(AllocInst inst) {
            BitSet row = new BitSet();
            row.set(locations.indexOf(allocSites.get(inst)));
            assign(inst.getDest(), row);
            return null;
        }

        @Override
        public Void visit(IdInst inst) {
            return copy(inst, inst.getSource());
        }

        @Override
        public Void visit(PtrAddInst inst) {
            return copy(inst, inst.getPointer());
        }

        @Override
        public Void visit(LoadInst inst) {
            if (inst.getType().isPointer()) {
                BitSet all = new BitSet();
                all.set(0, locations.size());
                assign(inst.getDest(), all);
            }
            return null;
        }

        @Override
        public Void visit(ConstInst inst) {
            return null;
        }

        @Override
        public Void visit(BinOperator inst) {
            return null;
        }

        @Override
        public Void visit(ICmpInst inst) {
            return null;
        }

        @Override
        public Void visit(UnaryOperator inst) {
            return null;
        }

        @Override
        public Void visit(FreeInst inst) {
            return null;
        }

        @Override
        public Void visit(StoreInst inst) {
            return null;
        }

        @Override
        public Void visit(BranchInst inst) {
            return null;
        }

        @Override
        public Void visit(JumpInst inst) {
            return null;
        }

        @Override
        public Void visit(ReturnInst inst) {
            return null;
        }

        @Override
        public Void visit(PrintInst inst) {
            return null;
        }
    }

    /* queries */

    public boolean isPointer(String var) {
        return pointers.contains(var);
    }

    public List<String> getPointers() {
        return pointers.getElements();
    }

    private Set<AbstractLocation> locationsOf(BitSet state, String var) {
        Set<AbstractLocation> result = new LinkedHashSet<>();
        int p = pointers.indexOf(var);
        if (p < 0) {
            return result;
        }
        for (int l = 0; l < locations.size(); l++) {
            if (state.get(bit(p, l))) {
                result.add(locations.get(l));
            }
        }
        return result;
    }

    /**
     * Locations {@code var} may point to right before {@code at}.
     */
    public Set<AbstractLocation> pointsTo(Instruction at, String var) {
        return locationsOf(pointsToBefore.get(at), var);
    }

    /**
     * Locations {@code var} may point to at any point of the function.
     */
    public Set<AbstractLocation> pointsToAnywhere(String var) {
        return locationsOf(pointsToAnywhere, var);
    }

    public boolean mayAlias(Instruction at, String p, String q) {
        if (p.equals(q)) {
            return true;
        }
        if (!isPointer(p) || !isPointer(q)) {
            return true;
        }
        Set<AbstractLocation> a = pointsTo(at, p);
        a.retainAll(pointsTo(at, q));
        return !a.isEmpty();
    }

    /**
     * True when {@code p} and {@code q} certainly hold the same address right
     * before {@code at}: the same variable, or linked by {@code id} copies
     * neither side of which was redefined since.
     */
    public boolean mustAlias(Instruction at, String p, String q) {
        if (p.equals(q)) {
            return true;
        }
        BitSet available = copiesBefore.get(at);
        Map<String, String> parent = new HashMap<>();
        for (int i = available.nextSetBit(0); i >= 0; i = available.nextSetBit(i + 1)) {
            List<String> pair = copies.get(i);
            union(parent, pair.get(0), pair.get(1));
        }
        return find(parent, p).equals(find(parent, q));
    }

    private static String find(Map<String, String> parent, String x) {
        String root = x;
        while (parent.containsKey(root)) {
            root = parent.get(root);
        }
        return root;
    }

    private static void union(Map<String, String> parent, String a, String b) {
        String ra = find(parent, a);
        String rb = find(parent, b);
        if (!ra.equals(rb)) {
            parent.put(ra, rb);
        }
    }

    /**
     * Locations whose contents may be observed after the function returns:
     * external memory, memory whose address is stored somewhere or returned.
     */
    public Set<AbstractLocation> escapingLocations() {
        Set<AbstractLocation> escaping = new HashSet<>();
        escaping.add(AbstractLocation.EXTERNAL);
        boolean changed;
        do {
            changed = false;
            for (BasicBlock block : cfg.getBlocks()) {
                for (Instruction inst : block.getInstructions()) {
                    String leaked = null;
                    if (inst instanceof StoreInst store && isPointer(store.getValue())) {
                        leaked = store.getValue();
                    } else if (inst instanceof ReturnInst ret && ret.hasReturnValue()
                            && isPointer(ret.getReturnValue())) {
                        leaked = ret.getReturnValue();
                    }
                    if (leaked != null) {
                        changed |= escaping.addAll(pointsTo(inst, leaked));
                    }
                }
            }
        } while (changed);
        return escaping;
    }

    public Type typeOf(String var) {
        for (Argument arg : cfg.getFunction().getArguments()) {
            if (arg.name().equals(var)) {
                return arg.type();
            }
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                if (var.equals(inst.getDest())) {
                    return inst.getType();
                }
            }
        }
        return null;
    }

    public List<AbstractLocation> getLocations() {
        return new ArrayList<>(locations.getElements());
    }
}
