package ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exception.CompileException;
import ir.value.Argument;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.instructions.Instruction;
import ir.value.instructions.JumpInst;
import ir.value.instructions.ReturnInst;
import util.LoggingManager;
import util.bril.LoaderConfig;
import util.logging.Logger;

/**
 * Turns the flat instruction stream of a function into a control-flow graph.
 *
 * <ul>
 * <li>blocks start at labels and end after terminators; a block without a
 * leading label gets a generated one</li>
 * <li>every block gets an explicit terminator: a trailing {@code ret} for the
 * last block, a {@code jmp} into the next one when fall-through is
 * allowed</li>
 * <li>the entry never has predecessors</li>
 * <li>unreachable blocks are dropped and critical edges split</li>
 * </ul>
 */
public class CFGBuilder {
    private static final Logger log = LoggingManager.getLogger(CFGBuilder.class);

    private final LoaderConfig config;

    // a block under construction; label is null for anonymous blocks
    private static class PendingBlock {
        String label;
        final List<Instruction> instructions = new ArrayList<>();

        PendingBlock(String label) {
            this.label = label;
        }

        boolean terminated() {
            return !instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator();
        }
    }

    public CFGBuilder(LoaderConfig config) {
        this.config = config;
    }

    public CFGBuilder() {
        this(LoaderConfig.defaultConfig());
    }

    public ControlFlowGraph build(Function function, InstructionStream stream) {
        String fn = function.getName();
        List<PendingBlock> pending = formBlocks(stream);
        nameBlocks(fn, pending);
        addTerminators(fn, pending);

        ControlFlowGraph cfg = new ControlFlowGraph(function);
        for (PendingBlock p : pending) {
            BasicBlock block = new BasicBlock(p.label);
            p.instructions.forEach(block::addInstruction);
            cfg.addBlock(block);
        }
        cfg.rebuildEdges();
        checkVariables(function, cfg);
        addEntry(cfg);

        if (cfg.removeUnreachableBlocks()) {
            log.debug("@{}: dropped unreachable blocks", fn);
        }
        if (config.isSplitCriticalEdges()) {
            int split = cfg.splitCriticalEdges();
            if (split > 0) {
                log.debug("@{}: split {} critical edge(s)", fn, split);
            }
        }
        return cfg;
    }

    private List<PendingBlock> formBlocks(InstructionStream stream) {
        List<PendingBlock> blocks = new ArrayList<>();
        PendingBlock current = null;
        for (InstructionStream.Entry entry : stream.getEntries()) {
            if (entry.isLabel()) {
                current = new PendingBlock(entry.label());
                blocks.add(current);
                continue;
            }
            if (current == null || current.terminated()) {
                current = new PendingBlock(null);
                blocks.add(current);
            }
            current.instructions.add(entry.instruction());
        }
        if (blocks.isEmpty()) {
            blocks.add(new PendingBlock(null));
        }
        return blocks;
    }

    private void nameBlocks(String fn, List<PendingBlock> blocks) {
        Set<String> labels = new HashSet<>();
        for (PendingBlock block : blocks) {
            if (block.label != null && !labels.add(block.label)) {
                throw CompileException.duplicateLabel(fn, block.label);
            }
        }
        int counter = 0;
        for (PendingBlock block : blocks) {
            if (block.label == null) {
                String name;
                do {
                    name = "b" + counter++;
                } while (labels.contains(name));
                labels.add(name);
                block.label = name;
            }
        }
    }

    private void addTerminators(String fn, List<PendingBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            PendingBlock block = blocks.get(i);
            if (block.terminated()) {
                continue;
            }
            if (i == blocks.size() - 1) {
                block.instructions.add(new ReturnInst().markImplicit());
            } else if (config.isAllowFallthrough()) {
                block.instructions.add(new JumpInst(blocks.get(i + 1).label).markImplicit());
            } else {
                throw CompileException.fallthrough(fn, block.label, blocks.get(i + 1).label);
            }
        }
    }

    /**
     * Prepend a fresh entry when the first block is a jump target.
     */
    private void addEntry(ControlFlowGraph cfg) {
        BasicBlock first = cfg.getEntry();
        if (first.getPredecessors().isEmpty()) {
            return;
        }
        BasicBlock entry = new BasicBlock(cfg.freshLabel("entry"));
        entry.addInstruction(new JumpInst(first.getLabel()).markImplicit());
        cfg.addBlockFirst(entry);
        cfg.rebuildEdges();
    }

    /**
     * Every operand must be a parameter or the destination of some
     * instruction of the function. Path sensitivity is left to the
     * interpreter.
     */
    private void checkVariables(Function function, ControlFlowGraph cfg) {
        Set<String> defined = new LinkedHashSet<>();
        for (Argument arg : function.getArguments()) {
            defined.add(arg.name());
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                if (inst.hasDest()) {
                    defined.add(inst.getDest());
                }
            }
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (Instruction inst : block.getInstructions()) {
                for (String arg : inst.getArgs()) {
                    if (!defined.contains(arg)) {
                        throw CompileException.undefinedVariable(function.getName(), arg);
                    }
                }
            }
        }
    }

    /**
     * Structural check for graphs assembled in code rather than parsed: one
     * terminator per block, at its end.
     */
    public static void checkTerminators(ControlFlowGraph cfg) {
        for (BasicBlock block : cfg.getBlocks()) {
            List<Instruction> insts = block.getInstructions();
            long count = insts.stream().filter(Instruction::isTerminator).count();
            if (count != 1 || block.getTerminator() == null) {
                throw CompileException.missingTerminator(cfg.getName(), block.getLabel());
            }
        }
    }
}
