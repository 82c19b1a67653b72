package ir.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import ir.ControlFlowGraph;
import ir.InstructionStream;
import ir.type.Type;

public class Function {
    private final String name;
    private final List<Argument> arguments;
    // null for functions returning nothing
    private final Type returnType;
    private ControlFlowGraph body;

    public Function(String name, List<Argument> arguments, Type returnType) {
        this.name = name;
        this.arguments = new ArrayList<>(arguments);
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Type getReturnType() {
        return returnType;
    }

    public ControlFlowGraph getBody() {
        return body;
    }

    public void setBody(ControlFlowGraph body) {
        this.body = body;
    }

    public String getSignature() {
        StringBuilder sb = new StringBuilder("@").append(name);
        if (!arguments.isEmpty()) {
            sb.append('(')
                    .append(arguments.stream().map(Argument::toBril).collect(Collectors.joining(", ")))
                    .append(')');
        }
        if (returnType != null) {
            sb.append(": ").append(returnType.toBril());
        }
        return sb.toString();
    }

    public List<String> toBril() {
        List<String> lines = new ArrayList<>();
        lines.add(getSignature() + " {");
        if (body != null) {
            InstructionStream stream = body.linearize();
            lines.addAll(stream.toBril());
        }
        lines.add("}");
        return lines;
    }
}
