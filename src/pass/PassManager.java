package pass;

import driver.Config;
import exception.CompileException;
import ir.ControlFlowGraph;
import ir.Program;
import ir.value.Function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import pass.IRPass.VerifyIRPass;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

public class PassManager {
    public static final String DEFAULT_PIPELINE = "baseline";

    private static final Map<String, List<IRPassType>> PIPELINES = new LinkedHashMap<>();

    static {
        // round trip through the CFG only
        PIPELINES.put("baseline", List.of());
        PIPELINES.put("tdce", List.of(IRPassType.TrivialDeadCodeElimination));
        PIPELINES.put("constant_folding", List.of(
                IRPassType.ConstantPropagation,
                IRPassType.TrivialDeadCodeElimination));
        PIPELINES.put("liveness", List.of(IRPassType.DeadCodeElimination));
        PIPELINES.put("constant_liveness", List.of(
                IRPassType.ConstantPropagation,
                IRPassType.DeadCodeElimination));
        PIPELINES.put("dse", List.of(IRPassType.DeadStoreElimination));
        PIPELINES.put("rle", List.of(IRPassType.RedundantLoadElimination));
        PIPELINES.put("stl", List.of(IRPassType.StoreToLoadForwarding));
        PIPELINES.put("alias_full", List.of(
                IRPassType.RedundantLoadElimination,
                IRPassType.StoreToLoadForwarding,
                IRPassType.DeadStoreElimination));
        PIPELINES.put("lcm", List.of(
                IRPassType.LazyCodeMotion,
                IRPassType.DeadCodeElimination));
        PIPELINES.put("pdce", List.of(IRPassType.PartialDeadCodeElimination));
        PIPELINES.put("full", List.of(
                IRPassType.ConstantPropagation,
                IRPassType.DeadCodeElimination,
                IRPassType.StoreToLoadForwarding,
                IRPassType.RedundantLoadElimination,
                IRPassType.DeadStoreElimination,
                IRPassType.ConstantPropagation,
                IRPassType.DeadCodeElimination,
                IRPassType.LazyCodeMotion,
                IRPassType.PartialDeadCodeElimination,
                IRPassType.DeadCodeElimination));
    }

    private final List<IRPass> irPipeline = new ArrayList<>();

    private final Set<String> enabledIR;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dir.passes=constantpropagation,deadcodeelimination
        enabledIR = loadEnabled("ir.passes");
        setPipeline(DEFAULT_PIPELINE);
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    public static Set<String> pipelineNames() {
        return Collections.unmodifiableSet(PIPELINES.keySet());
    }

    public static List<IRPassType> pipeline(String name) {
        List<IRPassType> types = PIPELINES.get(name);
        if (types == null) {
            throw CompileException.wrongArgs("unknown pipeline " + name + ", expected one of " + PIPELINES.keySet());
        }
        return types;
    }

    /**
     * Select one of the named pipelines.
     */
    public void setPipeline(String name) {
        setIRPipeline(pipeline(name).toArray(new IRPassType[0]));
    }

    /**
     * Select passes by their names, e.g. "constantpropagation,deadcodeelimination".
     */
    public void setPipelineFromNames(List<String> names) {
        List<IRPassType> types = new ArrayList<>();
        for (String name : names) {
            IRPassType type = IRPassType.fromName(name);
            if (type == null) {
                throw CompileException.wrongArgs("unknown pass " + name);
            }
            types.add(type);
        }
        setIRPipeline(types.toArray(new IRPassType[0]));
    }

    public List<IRPassType> getPipeline() {
        return irPipeline.stream().map(IRPass::getType).toList();
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    public void runIRPasses(Program program) {
        boolean verify = Config.getInstance().isDebug;
        VerifyIRPass verifier = new VerifyIRPass();

        for (IRPass p : irPipeline) {
            log.info("[IR] " + p.getType().getName());
            for (Function function : program.getFunctions()) {
                ControlFlowGraph before = function.getBody();
                ControlFlowGraph after = p.run(before);
                if (verify) {
                    // 在每个 IR pass 后运行轻量校验，第一时间捕获破坏 IR 的 pass
                    try {
                        verifier.verify(after);
                    } catch (CompileException ver) {
                        log.error("[IRVerifier] Failed right after pass: {}", p.getType().getName());
                        throw new CompileException("pass " + p.getType().getName() + " broke @"
                                + function.getName() + ": " + ver.getMessage(), ver);
                    }
                    log.debug("@{} after {}:\n{}", function.getName(), p.getType().getName(), after.toBril());
                }
                function.setBody(after);
            }
        }
    }

    /**
     * 按顺序整体设置 IR pipeline（会清空重建）
     */
    private void setIRPipeline(IRPassType... types) {
        irPipeline.clear();
        for (IRPassType type : types) {
            if (enabledIR.isEmpty() || enabledIR.contains(type.getName())) {
                irPipeline.add(type.create());
            }
        }
    }
}
