package util.bril;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import frontend.grammar.BrilTextLexer;
import frontend.grammar.BrilTextParser;
import frontend.irgen.StreamGenerator;
import frontend.irgen.StreamGenerator.ParsedFunction;
import ir.CFGBuilder;
import ir.Program;
import util.LoggingManager;
import util.bril.BrilParseException.ParseError;
import util.logging.Logger;

/**
 * Bril 加载器工具类
 *
 * 用于将 Bril 文本解析并转换为项目的 IR 对象: text is parsed with the ANTLR
 * grammar, flattened into instruction streams and built into control-flow
 * graphs.
 *
 * Syntax problems surface as {@link BrilParseException}; structural problems
 * (undefined labels or variables, fall-through) as
 * {@link exception.CompileException}.
 */
public class BrilLoader {
    private static final Logger log = LoggingManager.getLogger(BrilLoader.class);

    /**
     * 从文件路径加载单个 .bril 文件
     */
    public static Program loadFromFile(String filePath) throws IOException, BrilParseException {
        return loadFromFile(filePath, LoaderConfig.defaultConfig());
    }

    public static Program loadFromFile(String filePath, LoaderConfig config) throws IOException, BrilParseException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + filePath);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parse(CharStreams.fromString(content, path.toString()), extractProgramName(path.getFileName().toString()),
                config);
    }

    /**
     * 从资源路径加载 .bril 文件, e.g. "programs/loop.bril"
     */
    public static Program loadFromResource(String resourcePath) throws IOException, BrilParseException {
        return loadFromResource(resourcePath, LoaderConfig.defaultConfig());
    }

    public static Program loadFromResource(String resourcePath, LoaderConfig config)
            throws IOException, BrilParseException {
        return parseFromString(readResource(resourcePath), extractProgramName(resourcePath), config);
    }

    /**
     * @return the text of a class-path resource
     */
    public static String readResource(String resourcePath) throws IOException {
        try (InputStream inputStream = BrilLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        }
    }

    public static Program loadFromStream(InputStream in, LoaderConfig config) throws IOException, BrilParseException {
        return parse(CharStreams.fromStream(in, StandardCharsets.UTF_8), "stdin", config);
    }

    public static Program parseFromString(String content, String programName) throws BrilParseException {
        return parseFromString(content, programName, LoaderConfig.defaultConfig());
    }

    public static Program parseFromString(String content, String programName, LoaderConfig config)
            throws BrilParseException {
        return parse(CharStreams.fromString(content, programName), programName, config);
    }

    private static Program parse(CharStream input, String programName, LoaderConfig config)
            throws BrilParseException {
        List<ParseError> errors = new ArrayList<>();
        CollectingErrorListener listener = new CollectingErrorListener(errors);

        BrilTextLexer lexer = new BrilTextLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        BrilTextParser parser = new BrilTextParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        BrilTextParser.ProgramContext tree = parser.program();
        if (!errors.isEmpty()) {
            throw new BrilParseException("Parse failed with errors", truncate(errors, config));
        }
        if (config.isDebugMode()) {
            log.debug("parse tree of {}: {}", programName, tree.toStringTree(parser));
        }

        List<ParsedFunction> functions = new StreamGenerator(errors).generate(tree);
        if (!errors.isEmpty()) {
            throw new BrilParseException("Parse failed with errors", truncate(errors, config));
        }

        Program program = new Program(programName);
        CFGBuilder builder = new CFGBuilder(config);
        for (ParsedFunction parsed : functions) {
            parsed.function().setBody(builder.build(parsed.function(), parsed.stream()));
            program.addFunction(parsed.function());
        }
        log.info("loaded {} function(s) from {}", functions.size(), programName);
        return program;
    }

    private static List<ParseError> truncate(List<ParseError> errors, LoaderConfig config) {
        return errors.size() > config.getMaxErrors() ? errors.subList(0, config.getMaxErrors()) : errors;
    }

    private static String extractProgramName(String fileName) {
        int slash = fileName.lastIndexOf('/');
        String base = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        if (base.endsWith(".bril")) {
            return base.substring(0, base.length() - 5);
        }
        return base;
    }

    private static class CollectingErrorListener extends BaseErrorListener {
        private final List<ParseError> errors;

        CollectingErrorListener(List<ParseError> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new ParseError(line, "Syntax error: " + msg, "column " + charPositionInLine));
        }
    }
}
