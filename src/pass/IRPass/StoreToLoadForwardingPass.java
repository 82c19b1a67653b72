package pass.IRPass;

import java.util.ArrayList;
import java.util.List;

import ir.ControlFlowGraph;
import ir.value.BasicBlock;
import ir.value.instructions.FreeInst;
import ir.value.instructions.IdInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.StoreInst;
import pass.IRPassType;
import pass.Pass;
import pass.IRPass.analysis.AliasAnalysis;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Block-local store-to-load forwarding: {@code x = load p} after
 * {@code store q v} in the same block, with {@code q} must-aliasing
 * {@code p} and nothing in between that may clobber the memory or rename
 * {@code q} or {@code v}, becomes {@code x = id v}.
 */
public class StoreToLoadForwardingPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public IRPassType getType() {
        return IRPassType.StoreToLoadForwarding;
    }

    @Override
    public ControlFlowGraph run(ControlFlowGraph input) {
        log.info("Running pass: StoreToLoadForwarding on @{}", input.getName());
        ControlFlowGraph cfg = input.copy();
        int forwarded = 0;
        int round;
        do {
            round = forwardStores(cfg);
            forwarded += round;
        } while (round > 0);
        log.info("@{}: forwarded {} store(s) to loads", cfg.getName(), forwarded);
        return cfg;
    }

    private int forwardStores(ControlFlowGraph cfg) {
        AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
        int forwarded = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            // 当前块内仍然有效的 store
            List<StoreInst> stores = new ArrayList<>();
            List<Instruction> insts = block.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst instanceof StoreInst store) {
                    stores.removeIf(s -> alias.mayAlias(inst, s.getPointer(), store.getPointer()));
                    stores.add(store);
                } else if (inst instanceof FreeInst free) {
                    stores.removeIf(s -> alias.mayAlias(inst, s.getPointer(), free.getPointer()));
                } else if (inst instanceof LoadInst load) {
                    for (StoreInst s : stores) {
                        if (alias.mustAlias(load, load.getPointer(), s.getPointer())) {
                            insts.set(i, new IdInst(load.getDest(), load.getType(), s.getValue()));
                            log.debug("@{}: forward {} into {}", cfg.getName(), s.toBril(), load.toBril());
                            forwarded++;
                            break;
                        }
                    }
                }
                if (inst.hasDest()) {
                    String dest = inst.getDest();
                    stores.removeIf(s -> s.getPointer().equals(dest) || s.getValue().equals(dest));
                }
            }
        }
        return forwarded;
    }
}
