package ir;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exception.CompileException;
import ir.value.Function;

/**
 * A Bril program: functions in source order, unique by name.
 */
public class Program {
    private final String name;
    private final Map<String, Function> functions = new LinkedHashMap<>();

    public Program(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void addFunction(Function function) {
        if (functions.containsKey(function.getName())) {
            throw CompileException.duplicateFunction(function.getName());
        }
        functions.put(function.getName(), function);
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public List<Function> getFunctions() {
        return new ArrayList<>(functions.values());
    }

    public String toBril() {
        StringBuilder sb = new StringBuilder();
        for (Function function : functions.values()) {
            for (String line : function.toBril()) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }

    public void printToFile(String path) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(path))) {
            writer.write(toBril());
        }
    }

    @Override
    public String toString() {
        return toBril();
    }
}
