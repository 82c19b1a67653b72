package util.bril;

import java.util.ArrayList;
import java.util.List;

/**
 * Bril 文本解析异常类
 *
 * Raised for malformed program text; carries every error found, each with
 * its line number.
 */
public class BrilParseException extends Exception {

    private final int lineNumber;
    private final List<ParseError> errors;

    /**
     * 解析错误详情类
     */
    public static class ParseError {
        private final int lineNumber;
        private final String errorMessage;
        private final String context;

        public ParseError(int lineNumber, String errorMessage, String context) {
            this.lineNumber = lineNumber;
            this.errorMessage = errorMessage;
            this.context = context;
        }

        public ParseError(int lineNumber, String errorMessage) {
            this(lineNumber, errorMessage, "");
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public String getContext() {
            return context;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (context != null && !context.isEmpty()) {
                sb.append("\n  -> ").append(context.trim());
            }
            return sb.toString();
        }
    }

    public BrilParseException(String message) {
        super(message);
        this.lineNumber = -1;
        this.errors = new ArrayList<>();
    }

    public BrilParseException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
        this.errors = new ArrayList<>();
    }

    /**
     * 创建包含多个错误的异常
     */
    public BrilParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.lineNumber = errors.isEmpty() ? -1 : errors.get(0).getLineNumber();
        this.errors = new ArrayList<>(errors);
    }

    public BrilParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.errors = new ArrayList<>();
    }

    /**
     * 获取出错的行号 (first error when there are several)
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    public boolean hasMultipleErrors() {
        return errors.size() > 1;
    }

    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i).toString());
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }

    public static BrilParseException syntaxError(String message, int lineNumber) {
        return new BrilParseException("Syntax error: " + message, lineNumber);
    }
}
