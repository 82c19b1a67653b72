package ir.value.constants;

import java.util.List;

import exception.CompileException;
import ir.type.Type;
import ir.value.Opcode;

/**
 * A literal value of a Bril {@code const} instruction.
 */
public abstract class Constant {
    private final Type type;

    protected Constant(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public abstract String toBril();

    /**
     * Parse the literal text of a {@code const} for the given type.
     */
    public static Constant parse(Type type, String literal) {
        if (type.isBool()) {
            if (!literal.equals("true") && !literal.equals("false")) {
                throw CompileException.illegalInstruction("bool constant " + literal);
            }
            return ConstantBool.get(Boolean.parseBoolean(literal));
        }
        if (type.isInt()) {
            try {
                return new ConstantInt(Long.parseLong(literal));
            } catch (NumberFormatException e) {
                throw new CompileException("Illegal int constant " + literal, e);
            }
        }
        throw CompileException.unSupported("constant of type " + type);
    }

    /**
     * Evaluate a value operation on constant operands.
     *
     * @return the folded constant, or null when the operation cannot be
     *         evaluated at compile time (e.g. division by zero)
     */
    public static Constant fold(Opcode op, List<Constant> args) {
        switch (op) {
            case NOT:
                return ((ConstantBool) args.get(0)).not();
            case AND:
            case OR:
                ConstantBool lb = (ConstantBool) args.get(0);
                ConstantBool rb = (ConstantBool) args.get(1);
                return op == Opcode.AND ? lb.and(rb) : lb.or(rb);
            default:
                break;
        }
        ConstantInt lhs = (ConstantInt) args.get(0);
        ConstantInt rhs = (ConstantInt) args.get(1);
        return switch (op) {
            case ADD -> lhs.add(rhs);
            case SUB -> lhs.sub(rhs);
            case MUL -> lhs.mul(rhs);
            case DIV -> lhs.div(rhs);
            case EQ -> ConstantBool.get(lhs.getValue() == rhs.getValue());
            case LT -> ConstantBool.get(lhs.getValue() < rhs.getValue());
            case GT -> ConstantBool.get(lhs.getValue() > rhs.getValue());
            case LE -> ConstantBool.get(lhs.getValue() <= rhs.getValue());
            case GE -> ConstantBool.get(lhs.getValue() >= rhs.getValue());
            default -> throw CompileException.unSupported("folding " + op.getMnemonic());
        };
    }

    @Override
    public String toString() {
        return toBril();
    }
}
