package frontend.irgen;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;

import exception.CompileException;
import frontend.grammar.BrilTextBaseVisitor;
import frontend.grammar.BrilTextParser;
import ir.InstructionStream;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.Argument;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.constants.Constant;
import ir.value.instructions.*;
import util.LoggingManager;
import util.bril.BrilParseException.ParseError;
import util.logging.Logger;

/**
 * Walks the parse tree and produces, per function, its signature and the flat
 * instruction stream of its body. Malformed instructions are recorded as
 * {@link ParseError}s and skipped so that every problem of a file is
 * reported at once.
 */
public class StreamGenerator extends BrilTextBaseVisitor<Void> {
    private static final Logger logger = LoggingManager.getLogger(StreamGenerator.class);

    public record ParsedFunction(Function function, InstructionStream stream) {
    }

    private final List<ParseError> errors;
    private final List<ParsedFunction> functions = new ArrayList<>();
    private InstructionStream current;

    public StreamGenerator(List<ParseError> errors) {
        this.errors = errors;
    }

    public List<ParsedFunction> generate(BrilTextParser.ProgramContext program) {
        visit(program);
        return functions;
    }

    @Override
    public Void visitFunction(BrilTextParser.FunctionContext ctx) {
        String name = ctx.FUNC_NAME().getText().substring(1);
        List<Argument> args = new ArrayList<>();
        if (ctx.paramList() != null) {
            for (BrilTextParser.ParamContext param : ctx.paramList().param()) {
                Type type = parseType(param.type());
                if (type != null) {
                    args.add(new Argument(param.IDENT().getText(), type));
                }
            }
        }
        Type returnType = ctx.type() != null ? parseType(ctx.type()) : null;

        current = new InstructionStream();
        for (BrilTextParser.ItemContext item : ctx.item()) {
            visit(item);
        }
        logger.debug("@{}: {} stream entries", name, current.size());
        functions.add(new ParsedFunction(new Function(name, args, returnType), current));
        current = null;
        return null;
    }

    @Override
    public Void visitLabelItem(BrilTextParser.LabelItemContext ctx) {
        current.addLabel(ctx.LABEL().getText().substring(1));
        return null;
    }

    @Override
    public Void visitConstItem(BrilTextParser.ConstItemContext ctx) {
        Type type = parseType(ctx.type());
        if (type == null) {
            return null;
        }
        try {
            Constant value = Constant.parse(type, ctx.literal().getText());
            current.add(new ConstInst(ctx.IDENT().getText(), value));
        } catch (CompileException e) {
            error(ctx, e.getMessage());
        }
        return null;
    }

    @Override
    public Void visitValueItem(BrilTextParser.ValueItemContext ctx) {
        String dest = ctx.IDENT(0).getText();
        String mnemonic = ctx.IDENT(1).getText();
        Type type = parseType(ctx.type());
        if (type == null) {
            return null;
        }
        Opcode op = Opcode.fromMnemonic(mnemonic);
        List<String> args = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        splitOperands(ctx.operand(), args, labels);
        if (op == null) {
            error(ctx, "unsupported instruction " + mnemonic);
            return null;
        }
        if (!labels.isEmpty()) {
            error(ctx, mnemonic + " takes no labels");
            return null;
        }

        Instruction inst = switch (op) {
            case ADD, SUB, MUL, DIV, AND, OR -> arity(ctx, args, 2)
                    ? new BinOperator(dest, op, type, args.get(0), args.get(1)) : null;
            case EQ, LT, GT, LE, GE -> arity(ctx, args, 2)
                    ? new ICmpInst(dest, op, args.get(0), args.get(1)) : null;
            case NOT -> arity(ctx, args, 1) ? new UnaryOperator(dest, args.get(0)) : null;
            case ALLOC -> arity(ctx, args, 1) && pointer(ctx, type)
                    ? new AllocInst(dest, (PointerType) type, args.get(0)) : null;
            case PTRADD -> arity(ctx, args, 2) && pointer(ctx, type)
                    ? new PtrAddInst(dest, (PointerType) type, args.get(0), args.get(1)) : null;
            case LOAD -> arity(ctx, args, 1) ? new LoadInst(dest, type, args.get(0)) : null;
            case ID -> arity(ctx, args, 1) ? new IdInst(dest, type, args.get(0)) : null;
            default -> {
                error(ctx, mnemonic + " does not produce a value");
                yield null;
            }
        };
        if (inst != null) {
            current.add(inst);
        }
        return null;
    }

    @Override
    public Void visitEffectItem(BrilTextParser.EffectItemContext ctx) {
        String mnemonic = ctx.IDENT().getText();
        Opcode op = Opcode.fromMnemonic(mnemonic);
        List<String> args = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        splitOperands(ctx.operand(), args, labels);
        if (op == null) {
            error(ctx, "unsupported instruction " + mnemonic);
            return null;
        }

        Instruction inst = switch (op) {
            case STORE -> arity(ctx, args, 2) && noLabels(ctx, labels)
                    ? new StoreInst(args.get(0), args.get(1)) : null;
            case FREE -> arity(ctx, args, 1) && noLabels(ctx, labels) ? new FreeInst(args.get(0)) : null;
            case PRINT -> noLabels(ctx, labels) ? new PrintInst(args) : null;
            case BR -> arity(ctx, args, 1) && labelCount(ctx, labels, 2)
                    ? new BranchInst(args.get(0), labels.get(0), labels.get(1)) : null;
            case JMP -> arity(ctx, args, 0) && labelCount(ctx, labels, 1) ? new JumpInst(labels.get(0)) : null;
            case RET -> {
                if (!noLabels(ctx, labels)) {
                    yield null;
                }
                if (args.size() > 1) {
                    error(ctx, "ret takes at most one operand");
                    yield null;
                }
                yield args.isEmpty() ? new ReturnInst() : new ReturnInst(args.get(0));
            }
            default -> {
                error(ctx, mnemonic + " needs a destination");
                yield null;
            }
        };
        if (inst != null) {
            current.add(inst);
        }
        return null;
    }

    private Type parseType(BrilTextParser.TypeContext ctx) {
        Type inner = ctx.type() != null ? parseType(ctx.type()) : null;
        if (ctx.type() != null && inner == null) {
            return null;
        }
        try {
            return Type.get(ctx.IDENT().getText(), inner);
        } catch (CompileException e) {
            error(ctx, e.getMessage());
            return null;
        }
    }

    private static void splitOperands(List<BrilTextParser.OperandContext> operands,
            List<String> args, List<String> labels) {
        for (BrilTextParser.OperandContext operand : operands) {
            if (operand.LABEL() != null) {
                labels.add(operand.LABEL().getText().substring(1));
            } else {
                args.add(operand.IDENT().getText());
            }
        }
    }

    private boolean arity(ParserRuleContext ctx, List<String> args, int expected) {
        if (args.size() != expected) {
            error(ctx, "expected " + expected + " operand(s) but got " + args.size());
            return false;
        }
        return true;
    }

    private boolean labelCount(ParserRuleContext ctx, List<String> labels, int expected) {
        if (labels.size() != expected) {
            error(ctx, "expected " + expected + " label(s) but got " + labels.size());
            return false;
        }
        return true;
    }

    private boolean noLabels(ParserRuleContext ctx, List<String> labels) {
        return labelCount(ctx, labels, 0);
    }

    private boolean pointer(ParserRuleContext ctx, Type type) {
        if (!type.isPointer()) {
            error(ctx, "expected a pointer type but got " + type.toBril());
            return false;
        }
        return true;
    }

    private void error(ParserRuleContext ctx, String message) {
        errors.add(new ParseError(ctx.getStart().getLine(), message, ctx.getText()));
    }
}
