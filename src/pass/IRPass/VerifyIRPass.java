package pass.IRPass;

import exception.CompileException;
import ir.ControlFlowGraph;
import ir.InstructionVisitor;
import ir.type.BoolType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.instructions.*;
import pass.IRPassType;
import pass.Pass;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight IR verifier. Checks core invariants after each IR pass:
 * - a unique entry block without predecessors
 * - every block ends in exactly one terminator and has no other
 * - successor/predecessor sets match the terminator targets
 * - every block is reachable from the entry
 * - every operand names a parameter or a destination, with a consistent type
 */
public class VerifyIRPass implements Pass.IRPass {

    @Override
    public IRPassType getType() {
        return IRPassType.VerifyIR;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph cfg) {
        verify(cfg);
        return cfg.copy();
    }

    public void verify(ControlFlowGraph cfg) {
        // 0) 函数块列表不为空且 entry 在列表中
        BasicBlock entry = cfg.getEntry();
        if (entry == null || cfg.getBlock(entry.getLabel()) != entry) {
            fail(cfg, null, null, "function has no entry block");
        }
        if (!entry.getPredecessors().isEmpty()) {
            fail(cfg, entry, null, "entry block has predecessors " + entry.getPredecessors());
        }

        for (BasicBlock bb : cfg.getBlocks()) {
            // 1) 基本块必须以唯一的终结指令结尾
            List<Instruction> insts = bb.getInstructions();
            if (bb.getTerminator() == null) {
                fail(cfg, bb, insts.isEmpty() ? null : insts.get(insts.size() - 1), "block without terminator");
            }
            for (int i = 0; i < insts.size() - 1; i++) {
                if (insts.get(i).isTerminator()) {
                    fail(cfg, bb, insts.get(i), "terminator is not the last instruction in block");
                }
            }

            // 2) CFG 一致性
            Set<BasicBlock> expectSucc = new HashSet<>();
            for (String label : bb.getTerminator().getLabels()) {
                BasicBlock target = cfg.getBlock(label);
                if (target == null) {
                    fail(cfg, bb, bb.getTerminator(), "jump to undefined label ." + label);
                }
                expectSucc.add(target);
            }
            if (!expectSucc.equals(bb.getSuccessors())) {
                fail(cfg, bb, bb.getTerminator(), "successors " + bb.getSuccessors()
                        + " != terminator targets " + expectSucc);
            }
            for (BasicBlock s : expectSucc) {
                if (!s.getPredecessors().contains(bb)) {
                    fail(cfg, bb, bb.getTerminator(), "successor " + s + " does not list me as predecessor");
                }
            }
            for (BasicBlock p : bb.getPredecessors()) {
                if (cfg.getBlock(p.getLabel()) != p || !p.getSuccessors().contains(bb)) {
                    fail(cfg, bb, null, "predecessor " + p + " does not jump here");
                }
            }
        }

        // 3) 可达性
        Set<BasicBlock> reachable = cfg.reachableBlocks();
        for (BasicBlock bb : cfg.getBlocks()) {
            if (!reachable.contains(bb)) {
                fail(cfg, bb, null, "block is unreachable");
            }
        }

        // 4) 变量定义与类型
        checkTypes(cfg);
    }

    private void checkTypes(ControlFlowGraph cfg) {
        Map<String, Type> types = new HashMap<>();
        for (Argument arg : cfg.getFunction().getArguments()) {
            types.put(arg.name(), arg.type());
        }
        for (BasicBlock bb : cfg.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (!inst.hasDest()) {
                    continue;
                }
                Type prev = types.putIfAbsent(inst.getDest(), inst.getType());
                if (prev != null && !prev.equals(inst.getType())) {
                    fail(cfg, bb, inst, inst.getDest() + " defined as both " + prev + " and " + inst.getType());
                }
            }
        }
        for (BasicBlock bb : cfg.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (String arg : inst.getArgs()) {
                    if (!types.containsKey(arg)) {
                        fail(cfg, bb, inst, "use of undefined variable " + arg);
                    }
                }
                String problem = inst.accept(new TypeChecker(types));
                if (problem != null) {
                    fail(cfg, bb, inst, problem);
                }
            }
        }
    }

    /**
     * Returns a description of the first operand type mismatch, or null.
     */
    private static class TypeChecker implements InstructionVisitor<String> {
        private final Map<String, Type> types;

        TypeChecker(Map<String, Type> types) {
            this.types = types;
        }

        private String expect(String var, Type type) {
            Type actual = types.get(var);
            return type.equals(actual) ? null : var + " should be " + type + " but is " + actual;
        }

        private String expectPointer(String var) {
            Type actual = types.get(var);
            return actual != null && actual.isPointer() ? null : var + " should be a pointer but is " + actual;
        }

        private String first(String... problems) {
            for (String p : problems) {
                if (p != null) {
                    return p;
                }
            }
            return null;
        }

        @Override
        public String visit(ConstInst inst) {
            return null;
        }

        @Override
        public String visit(BinOperator inst) {
            Type operand = switch (inst.opCode()) {
                case AND, OR -> BoolType.getBool();
                default -> IntegerType.getInt();
            };
            return first(expect(inst.getLhs(), operand), expect(inst.getRhs(), operand),
                    operand.equals(inst.getType()) ? null : inst.getDest() + " has the wrong result type");
        }

        @Override
        public String visit(ICmpInst inst) {
            return first(expect(inst.getLhs(), IntegerType.getInt()), expect(inst.getRhs(), IntegerType.getInt()));
        }

        @Override
        public String visit(UnaryOperator inst) {
            return expect(inst.getOperand(), BoolType.getBool());
        }

        @Override
        public String visit(AllocInst inst) {
            return expect(inst.getSize(), IntegerType.getInt());
        }

        @Override
        public String visit(FreeInst inst) {
            return expectPointer(inst.getPointer());
        }

        @Override
        public String visit(PtrAddInst inst) {
            return first(expect(inst.getPointer(), inst.getType()), expect(inst.getOffset(), IntegerType.getInt()));
        }

        @Override
        public String visit(LoadInst inst) {
            return expect(inst.getPointer(), PointerType.get(inst.getType()));
        }

        @Override
        public String visit(StoreInst inst) {
            String problem = expectPointer(inst.getPointer());
            if (problem != null) {
                return problem;
            }
            return expect(inst.getValue(), ((PointerType) types.get(inst.getPointer())).getPointeeType());
        }

        @Override
        public String visit(IdInst inst) {
            return expect(inst.getSource(), inst.getType());
        }

        @Override
        public String visit(BranchInst inst) {
            return expect(inst.getCondition(), BoolType.getBool());
        }

        @Override
        public String visit(JumpInst inst) {
            return null;
        }

        @Override
        public String visit(ReturnInst inst) {
            return null;
        }

        @Override
        public String visit(PrintInst inst) {
            return null;
        }
    }

    private void fail(ControlFlowGraph cfg, BasicBlock bb, Instruction inst, String msg) {
        StringBuilder sb = new StringBuilder(msg);
        sb.append("\n  BasicBlock: ").append(bb != null ? bb.getLabel() : "null");
        sb.append("\n  Instruction: ").append(inst != null ? inst.toBril() : "null");
        throw CompileException.malformedCFG(cfg.getName(), sb.toString());
    }
}
