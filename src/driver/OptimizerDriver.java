package driver;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import exception.CompileException;
import ir.Program;
import pass.PassManager;
import util.bril.BrilLoader;
import util.bril.BrilParseException;
import util.bril.LoaderConfig;
import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;

public class OptimizerDriver {
    private static OptimizerDriver optimizerDriver = new OptimizerDriver();
    private static final Logger logger = LogManager.getLogger(OptimizerDriver.class);

    private String source = null;
    private String target = null;
    private String pipeline = PassManager.DEFAULT_PIPELINE;
    private List<String> passNames = null;

    private OptimizerDriver() {
    }

    public static OptimizerDriver getInstance() {
        return optimizerDriver;
    }

    /**
     * Forget parsed arguments (used by tests that drive several runs)
     */
    public static void resetInstance() {
        optimizerDriver = new OptimizerDriver();
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        var iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> target = next(iter, cmd);
                case "-p" -> {
                    pipeline = next(iter, cmd);
                    // fail early on a misspelled name
                    PassManager.pipeline(pipeline);
                }
                case "-passes" -> passNames = Arrays.stream(next(iter, cmd).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
                case "-debug" -> {
                    Config.getInstance().isDebug = true;
                    LogManager.setRootLevel(LogLevel.DEBUG);
                    LogManager.enableFile();
                }
                case "-fallthrough" -> Config.getInstance().allowFallthrough = true;
                default -> {
                    if (cmd.equals("-") || cmd.endsWith(".bril")) {
                        source = cmd;
                    } else {
                        throw CompileException.wrongArgs(cmd);
                    }
                }
            }
        }
        if (source == null) {
            throw CompileException.wrongArgs("no input, expected a .bril file or -");
        }
    }

    private static String next(Iterator<String> iter, String cmd) {
        if (!iter.hasNext()) {
            throw CompileException.wrongArgs("Need arg after " + cmd);
        }
        return iter.next();
    }

    /*
     * real driver: load, optimize, print
     */
    public void run() {
        run(System.in, System.out);
    }

    public void run(InputStream stdin, PrintStream stdout) {
        LoaderConfig loaderConfig = LoaderConfig.defaultConfig()
                .setAllowFallthrough(Config.getInstance().allowFallthrough)
                .setDebugMode(Config.getInstance().isDebug);
        Program program = load(loaderConfig, stdin);

        PassManager.resetInstance();
        PassManager passManager = PassManager.getInstance();
        if (passNames != null) {
            passManager.setPipelineFromNames(passNames);
        } else {
            passManager.setPipeline(pipeline);
        }
        logger.info("optimizing {} with {}", source, passManager.getPipeline());
        passManager.runIRPasses(program);

        if (target == null) {
            stdout.print(program.toBril());
            stdout.flush();
        } else {
            try {
                program.printToFile(target);
            } catch (IOException e) {
                throw new RuntimeException("failed to write " + target, e);
            }
        }
    }

    private Program load(LoaderConfig loaderConfig, InputStream stdin) {
        try {
            if (source.equals("-")) {
                return BrilLoader.loadFromStream(stdin, loaderConfig);
            }
            return BrilLoader.loadFromFile(source, loaderConfig);
        } catch (IOException e) {
            throw new RuntimeException("failed to read " + source, e);
        } catch (BrilParseException e) {
            throw new CompileException("failed to parse " + source + ": " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getPipelineName() {
        return pipeline;
    }

    public List<String> getPassNames() {
        return passNames;
    }
}
