package pass.IRPass.analysis;

import java.util.List;

import ir.type.Type;
import ir.value.Opcode;
import ir.value.instructions.BinOperator;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.UnaryOperator;

/**
 * A syntactic pure expression: opcode, result type and operand names.
 * {@code div} is left out since it may fault.
 */
public record Expression(Opcode op, Type type, List<String> args) {

    /**
     * @return the expression {@code inst} computes, or null when it is not a
     *         movable pure value operation
     */
    public static Expression of(Instruction inst) {
        if (!inst.opCode().isValueOp() || inst.opCode() == Opcode.DIV) {
            return null;
        }
        return new Expression(inst.opCode(), inst.getType(), List.copyOf(inst.getArgs()));
    }

    public boolean usesVariable(String var) {
        return args.contains(var);
    }

    /**
     * Materialize {@code dest = op args}.
     */
    public Instruction toInstruction(String dest) {
        if (op == Opcode.NOT) {
            return new UnaryOperator(dest, args.get(0));
        }
        if (op.isCompare()) {
            return new ICmpInst(dest, op, args.get(0), args.get(1));
        }
        return new BinOperator(dest, op, type, args.get(0), args.get(1));
    }

    @Override
    public String toString() {
        return op.getMnemonic() + " " + String.join(" ", args);
    }
}
