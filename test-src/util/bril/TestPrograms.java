package util.bril;

import java.io.IOException;

import ir.Program;
import pass.IRPassType;
import pass.PassManager;

/**
 * Loading and optimizing the programs under {@code test-resources/programs}.
 */
public final class TestPrograms {

    private TestPrograms() {
    }

    public static Program load(String name) throws IOException, BrilParseException {
        return BrilLoader.loadFromResource("programs/" + name + ".bril");
    }

    public static Program load(String name, LoaderConfig config) throws IOException, BrilParseException {
        return BrilLoader.loadFromResource("programs/" + name + ".bril", config);
    }

    public static Program parse(String text) throws BrilParseException {
        return BrilLoader.parseFromString(text, "inline");
    }

    /**
     * Run the given passes in order on every function, without the pass
     * manager.
     */
    public static Program apply(Program program, IRPassType... types) {
        for (IRPassType type : types) {
            type.create().run(program);
        }
        return program;
    }

    public static Program optimize(String name, String pipeline) throws IOException, BrilParseException {
        Program program = load(name);
        PassManager.resetInstance();
        PassManager manager = PassManager.getInstance();
        manager.setPipeline(pipeline);
        manager.runIRPasses(program);
        PassManager.resetInstance();
        return program;
    }

    public static String text(Program program, String function) {
        return program.getFunction(function).getBody().toBril();
    }

    public static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }
}
