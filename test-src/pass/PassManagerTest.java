package pass;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.After;
import org.junit.Test;

import driver.Config;
import exception.CompileException;
import ir.Program;
import util.bril.BrilInterpreter;
import util.bril.TestPrograms;

public class PassManagerTest {

  @After
  public void tearDown() {
    System.clearProperty("ir.passes");
    Config.getInstance().isDebug = false;
    PassManager.resetInstance();
  }

  @Test
  public void testNamedPipelines() {
    assertThat(PassManager.pipelineNames(), hasItems("baseline", "tdce", "constant_folding", "liveness",
        "constant_liveness", "dse", "rle", "stl", "alias_full", "lcm", "pdce", "full"));
    assertTrue(PassManager.pipeline("baseline").isEmpty());
    assertEquals(List.of(IRPassType.LazyCodeMotion, IRPassType.DeadCodeElimination), PassManager.pipeline("lcm"));
    assertEquals(List.of(IRPassType.ConstantPropagation, IRPassType.TrivialDeadCodeElimination),
        PassManager.pipeline("constant_folding"));
  }

  @Test
  public void testDefaultIsBaseline() {
    assertTrue(PassManager.getInstance().getPipeline().isEmpty());
  }

  @Test(expected = CompileException.class)
  public void testUnknownPipeline() {
    PassManager.pipeline("o3");
  }

  @Test
  public void testPipelineFromNames() {
    PassManager manager = PassManager.getInstance();
    manager.setPipelineFromNames(List.of("ConstantPropagation", "deadcodeelimination"));
    assertEquals(List.of(IRPassType.ConstantPropagation, IRPassType.DeadCodeElimination), manager.getPipeline());
  }

  @Test
  public void testUnknownPassName() {
    try {
      PassManager.getInstance().setPipelineFromNames(List.of("constantpropagation", "gvn"));
      fail("gvn is not a pass");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("gvn"));
    }
  }

  @Test
  public void testEnabledPassesFilterPipeline() {
    System.setProperty("ir.passes", "deadcodeelimination");
    PassManager.resetInstance();
    PassManager manager = PassManager.getInstance();
    manager.setPipeline("constant_liveness");
    assertEquals(List.of(IRPassType.DeadCodeElimination), manager.getPipeline());
  }

  @Test
  public void testMemoryPassesEndWithStoreRemoval() {
    assertEquals(List.of(IRPassType.RedundantLoadElimination, IRPassType.StoreToLoadForwarding,
        IRPassType.DeadStoreElimination), PassManager.pipeline("alias_full"));
    List<IRPassType> full = PassManager.pipeline("full");
    int dse = full.indexOf(IRPassType.DeadStoreElimination);
    assertTrue(full.subList(dse, full.size()).contains(IRPassType.ConstantPropagation));
    assertTrue(dse < full.indexOf(IRPassType.LazyCodeMotion));
  }

  @Test
  public void testRunWithVerification() throws Exception {
    Config.getInstance().isDebug = true;
    Program program = TestPrograms.optimize("branch_fold", "full");
    assertEquals(List.of("10", "20"), BrilInterpreter.run(program).output());
    assertThat(program.toBril(), not(containsString("br ")));
  }
}
