package ir.value;

import java.util.HashMap;
import java.util.Map;

public enum Opcode {
    // constant definition
    CONST("const"),

    // value operations
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    EQ("eq"),
    LT("lt"),
    GT("gt"),
    LE("le"),
    GE("ge"),
    AND("and"),
    OR("or"),
    NOT("not"),

    // memory operations
    ALLOC("alloc"),
    FREE("free"),
    PTRADD("ptradd"),
    LOAD("load"),
    STORE("store"),
    ID("id"),

    // control
    BR("br"),
    JMP("jmp"),
    RET("ret"),
    PRINT("print"),
    ;

    private static final Map<String, Opcode> BY_MNEMONIC = new HashMap<>();

    static {
        for (Opcode op : values()) {
            BY_MNEMONIC.put(op.mnemonic, op);
        }
    }

    private final String mnemonic;

    Opcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * @return the opcode spelled {@code mnemonic} in Bril text, or null
     */
    public static Opcode fromMnemonic(String mnemonic) {
        return BY_MNEMONIC.get(mnemonic);
    }

    /**
     * 判断操作码是否为终结指令
     *
     * @return 如果是终结指令返回 true
     */
    public boolean isTerminator() {
        return this == RET || this == BR || this == JMP;
    }

    public boolean isBinary() {
        return switch (this) {
            case ADD, SUB, MUL, DIV, AND, OR -> true;
            default -> false;
        };
    }

    public boolean isCompare() {
        return switch (this) {
            case EQ, LT, GT, LE, GE -> true;
            default -> false;
        };
    }

    /**
     * Pure arithmetic / logic / comparison operations.
     */
    public boolean isValueOp() {
        return isBinary() || isCompare() || this == NOT;
    }

    public boolean isCommutative() {
        return switch (this) {
            case ADD, MUL, EQ, AND, OR -> true;
            default -> false;
        };
    }
}
