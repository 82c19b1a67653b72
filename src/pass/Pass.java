package pass;

import ir.ControlFlowGraph;
import ir.Program;
import ir.value.Function;

public interface Pass {
    // just a mark class for future change

    public interface IRPass extends Pass {
        IRPassType getType();

        /**
         * Transform one function body. The input graph is left untouched; the
         * result is a fresh graph.
         */
        ControlFlowGraph run(ControlFlowGraph cfg);

        default void run(Program program) {
            for (Function function : program.getFunctions()) {
                function.setBody(run(function.getBody()));
            }
        }
    }
}
