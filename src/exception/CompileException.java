package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException noArgs() {
        return new CompileException("need args to process");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException("Unexpected args: " + msg);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    public static CompileException illegalInstruction(String msg) {
        return new CompileException("Illegal instruction: " + msg);
    }

    public static CompileException undefinedLabel(String function, String label) {
        return new CompileException("Undefined label ." + label + " in @" + function);
    }

    public static CompileException duplicateLabel(String function, String label) {
        return new CompileException("Duplicate label ." + label + " in @" + function);
    }

    public static CompileException undefinedVariable(String function, String var) {
        return new CompileException("Use of undefined variable " + var + " in @" + function);
    }

    public static CompileException duplicateFunction(String function) {
        return new CompileException("Function @" + function + " has already been declared");
    }

    public static CompileException missingTerminator(String function, String label) {
        return new CompileException("Block ." + label + " in @" + function
                + " does not end in exactly one terminator");
    }

    public static CompileException fallthrough(String function, String from, String into) {
        return new CompileException("Block ." + from + " in @" + function
                + " falls through into labeled block ." + into + " without a terminator");
    }

    public static CompileException criticalEdge(String function, String from, String to) {
        return new CompileException("Critical edge ." + from + " -> ." + to + " in @" + function);
    }

    public static CompileException malformedCFG(String function, String msg) {
        return new CompileException("[IRVerifier] @" + function + ": " + msg);
    }
}
