package pass;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import ir.Program;
import util.bril.BrilInterpreter;
import util.bril.BrilLoader;
import util.bril.TestPrograms;

/**
 * Every pipeline on every program: same output, same trap, never more work.
 */
public class PipelineEquivalenceTest {

  private static final List<String> PROGRAMS = List.of(
      "fold", "branch_fold", "dead_code", "div_trap", "alias_dse", "memory", "escape",
      "lcm_loop", "lcm_diamond", "pdce_branch", "faint_loop", "critical_edge", "pointers",
      "lcm_carried", "freed_store", "oob_store", "freed_load", "oob_load");

  // passes that reach a fixpoint in one application
  private static final List<String> IDEMPOTENT = List.of(
      "tdce", "constant_folding", "liveness", "constant_liveness", "dse", "rle", "stl", "alias_full", "pdce",
      "full");

  @Test
  public void testOutputIsPreserved() throws Exception {
    for (String pipeline : PassManager.pipelineNames()) {
      for (String name : PROGRAMS) {
        BrilInterpreter.Result before = BrilInterpreter.run(TestPrograms.load(name));
        Program optimized = TestPrograms.optimize(name, pipeline);
        BrilInterpreter.Result after = BrilInterpreter.run(optimized);
        String where = pipeline + " on " + name;
        assertEquals(where, before.output(), after.output());
        assertEquals(where, before.trap(), after.trap());
        assertTrue(where, after.dynamicCount() <= before.dynamicCount());
      }
    }
  }

  @Test
  public void testOptimizedProgramReparses() throws Exception {
    for (String name : PROGRAMS) {
      String text = TestPrograms.optimize(name, "full").toBril();
      assertEquals(name, text, BrilLoader.parseFromString(text, name).toBril());
    }
  }

  @Test
  public void testSecondRunChangesNothing() throws Exception {
    for (String pipeline : IDEMPOTENT) {
      for (String name : PROGRAMS) {
        Program once = TestPrograms.optimize(name, pipeline);
        String first = once.toBril();
        PassManager.resetInstance();
        PassManager manager = PassManager.getInstance();
        manager.setPipeline(pipeline);
        manager.runIRPasses(once);
        PassManager.resetInstance();
        assertEquals(pipeline + " on " + name, first, once.toBril());
      }
    }
  }

  @Test
  public void testFaultsAreKept() throws Exception {
    Map<String, String> traps = Map.of(
        "freed_store", "access to freed memory",
        "oob_store", "out of bounds access",
        "freed_load", "access to freed memory",
        "oob_load", "out of bounds access");
    for (String pipeline : PassManager.pipelineNames()) {
      for (Map.Entry<String, String> entry : traps.entrySet()) {
        BrilInterpreter.Result result = BrilInterpreter.run(TestPrograms.optimize(entry.getKey(), pipeline));
        String where = pipeline + " on " + entry.getKey();
        assertEquals(where, entry.getValue(), result.trap());
        assertTrue(where, result.output().isEmpty());
      }
    }
  }
}
