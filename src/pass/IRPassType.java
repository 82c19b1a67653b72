package pass;

import java.util.function.Supplier;
import pass.IRPass.*;
import pass.Pass.IRPass;

/**
 * IRPassFactory: create the IRPass here
 */
public enum IRPassType implements PassType<IRPass> {
    CriticalEdgeSplit(CriticalEdgeSplitPass::new),

    ConstantPropagation(ConstantPropagationPass::new),
    DeadCodeElimination(DeadCodeEliminationPass::new),
    TrivialDeadCodeElimination(TrivialDeadCodeEliminationPass::new),

    DeadStoreElimination(DeadStoreEliminationPass::new),
    RedundantLoadElimination(RedundantLoadEliminationPass::new),
    StoreToLoadForwarding(StoreToLoadForwardingPass::new),

    LazyCodeMotion(LazyCodeMotionPass::new),
    PartialDeadCodeElimination(PartialDeadCodeEliminationPass::new),

    VerifyIR(VerifyIRPass::new),
    // add more irpass here
    ;

    private final Supplier<IRPass> supplier;

    IRPassType(Supplier<IRPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<IRPass> constructor() {
        return supplier;
    }

    /**
     * @return the pass type called {@code name} (case-insensitive), or null
     */
    public static IRPassType fromName(String name) {
        return PassType.byName(IRPassType.class, name);
    }
}
