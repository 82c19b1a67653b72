package util.bril;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import ir.InstructionStream;
import ir.InstructionStream.Entry;
import ir.Program;
import ir.value.Argument;
import ir.value.Function;
import ir.value.constants.ConstantBool;
import ir.value.constants.ConstantInt;
import ir.value.instructions.*;

/**
 * Reference interpreter for tests. Runs the printed form of {@code @main}
 * (the linearized stream, so omitted terminators are not counted) and
 * reports what an external Bril interpreter would: the printed lines, the
 * dynamic instruction count, and a trap message if execution failed.
 */
public class BrilInterpreter {
    private static final long STEP_LIMIT = 5_000_000L;

    public record Result(List<String> output, long dynamicCount, String trap, boolean leaked) {
        public boolean trapped() {
            return trap != null;
        }
    }

    private record Pointer(Object[] region, int offset) {
        @Override
        public String toString() {
            return "<ptr " + offset + ">";
        }
    }

    private final List<String> output = new ArrayList<>();
    private final Map<Object[], Boolean> live = new IdentityHashMap<>();
    private long count = 0;

    public static Result run(Program program, Object... args) {
        return new BrilInterpreter().execute(program.getFunction("main"), args);
    }

    private Result execute(Function main, Object[] args) {
        Map<String, Object> env = new HashMap<>();
        List<Argument> params = main.getArguments();
        for (int i = 0; i < params.size(); i++) {
            env.put(params.get(i).name(), args[i]);
        }
        try {
            interpret(main.getBody().linearize(), env);
        } catch (Trap t) {
            return new Result(output, count, t.getMessage(), false);
        }
        return new Result(output, count, null, !live.isEmpty());
    }

    private static class Trap extends RuntimeException {
        Trap(String message) {
            super(message);
        }
    }

    private void interpret(InstructionStream stream, Map<String, Object> env) {
        List<Entry> entries = stream.getEntries();
        Map<String, Integer> labels = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).isLabel()) {
                labels.put(entries.get(i).label(), i);
            }
        }

        int pc = 0;
        while (pc < entries.size()) {
            Entry entry = entries.get(pc);
            pc++;
            if (entry.isLabel()) {
                continue;
            }
            if (++count > STEP_LIMIT) {
                throw new Trap("step limit exceeded");
            }
            Instruction inst = entry.instruction();
            switch (inst.opCode()) {
                case CONST -> {
                    ConstInst c = (ConstInst) inst;
                    env.put(c.getDest(), c.getValue() instanceof ConstantInt i ? (Object) i.getValue()
                            : (Object) ((ConstantBool) c.getValue()).getValue());
                }
                case ADD -> env.put(inst.getDest(), intArg(env, inst, 0) + intArg(env, inst, 1));
                case SUB -> env.put(inst.getDest(), intArg(env, inst, 0) - intArg(env, inst, 1));
                case MUL -> env.put(inst.getDest(), intArg(env, inst, 0) * intArg(env, inst, 1));
                case DIV -> {
                    long rhs = intArg(env, inst, 1);
                    if (rhs == 0) {
                        throw new Trap("division by zero");
                    }
                    env.put(inst.getDest(), intArg(env, inst, 0) / rhs);
                }
                case EQ -> env.put(inst.getDest(), intArg(env, inst, 0) == intArg(env, inst, 1));
                case LT -> env.put(inst.getDest(), intArg(env, inst, 0) < intArg(env, inst, 1));
                case GT -> env.put(inst.getDest(), intArg(env, inst, 0) > intArg(env, inst, 1));
                case LE -> env.put(inst.getDest(), intArg(env, inst, 0) <= intArg(env, inst, 1));
                case GE -> env.put(inst.getDest(), intArg(env, inst, 0) >= intArg(env, inst, 1));
                case AND -> env.put(inst.getDest(), boolArg(env, inst, 0) && boolArg(env, inst, 1));
                case OR -> env.put(inst.getDest(), boolArg(env, inst, 0) || boolArg(env, inst, 1));
                case NOT -> env.put(inst.getDest(), !boolArg(env, inst, 0));
                case ID -> env.put(inst.getDest(), value(env, inst.getArg(0)));
                case ALLOC -> {
                    long size = intArg(env, inst, 0);
                    if (size <= 0) {
                        throw new Trap("cannot allocate " + size + " entries");
                    }
                    Object[] region = new Object[(int) size];
                    live.put(region, true);
                    env.put(inst.getDest(), new Pointer(region, 0));
                }
                case FREE -> {
                    Pointer p = pointerArg(env, inst, 0);
                    if (p.offset() != 0 || live.remove(p.region()) == null) {
                        throw new Trap("bad free");
                    }
                }
                case PTRADD -> {
                    Pointer p = pointerArg(env, inst, 0);
                    env.put(inst.getDest(), new Pointer(p.region(), p.offset() + (int) intArg(env, inst, 1)));
                }
                case LOAD -> {
                    Pointer p = checked(pointerArg(env, inst, 0));
                    Object v = p.region()[p.offset()];
                    if (v == null) {
                        throw new Trap("load of uninitialized memory");
                    }
                    env.put(inst.getDest(), v);
                }
                case STORE -> {
                    Pointer p = checked(pointerArg(env, inst, 0));
                    p.region()[p.offset()] = value(env, inst.getArg(1));
                }
                case PRINT -> {
                    List<String> parts = new ArrayList<>();
                    for (String arg : inst.getArgs()) {
                        parts.add(String.valueOf(value(env, arg)));
                    }
                    output.add(String.join(" ", parts));
                }
                case JMP -> pc = target(labels, inst.getLabels().get(0));
                case BR -> pc = target(labels, inst.getLabels().get(boolArg(env, inst, 0) ? 0 : 1));
                case RET -> {
                    return;
                }
                default -> throw new Trap("unsupported " + inst.opCode());
            }
        }
    }

    private static int target(Map<String, Integer> labels, String label) {
        Integer index = labels.get(label);
        if (index == null) {
            throw new Trap("unknown label ." + label);
        }
        return index;
    }

    private Pointer checked(Pointer p) {
        if (!live.containsKey(p.region())) {
            throw new Trap("access to freed memory");
        }
        if (p.offset() < 0 || p.offset() >= p.region().length) {
            throw new Trap("out of bounds access");
        }
        return p;
    }

    private static Object value(Map<String, Object> env, String var) {
        Object v = env.get(var);
        if (v == null) {
            throw new Trap("undefined variable " + var);
        }
        return v;
    }

    private static long intArg(Map<String, Object> env, Instruction inst, int i) {
        return (Long) value(env, inst.getArg(i));
    }

    private static boolean boolArg(Map<String, Object> env, Instruction inst, int i) {
        return (Boolean) value(env, inst.getArg(i));
    }

    private static Pointer pointerArg(Map<String, Object> env, Instruction inst, int i) {
        return (Pointer) value(env, inst.getArg(i));
    }
}
