package pass.IRPass.analysis;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import ir.ControlFlowGraph;
import ir.value.instructions.Instruction;
import util.bril.TestPrograms;

public class FaintnessAnalysisTest {

  @Test
  public void testSelfFeedingCounterIsFaint() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("faint_loop").getFunction("main").getBody();
    FaintnessAnalysis faintness = new FaintnessAnalysis(cfg).analyze();
    List<Instruction> body = cfg.getBlock("body").getInstructions();
    assertEquals("k: int = add k one;", body.get(0).toBril());
    assertTrue(faintness.isFaint(body.get(0)));
    assertFalse(faintness.isFaint(body.get(1)));
    assertTrue(faintness.isFaint(cfg.getEntry().getInstructions().get(1)));
    assertTrue(faintness.isStronglyLiveAfter(body.get(1), "i"));
    assertFalse(faintness.isStronglyLiveAfter(body.get(1), "k"));

    // ordinary liveness keeps k alive
    LivenessAnalysis liveness = new LivenessAnalysis(cfg).analyze();
    assertTrue(liveness.isLiveAfter(body.get(0), "k"));
  }

  @Test
  public void testEffectsAreNeverFaint() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("div_trap").getFunction("main").getBody();
    FaintnessAnalysis faintness = new FaintnessAnalysis(cfg).analyze();
    List<Instruction> insts = cfg.getEntry().getInstructions();
    Instruction div = insts.get(2);
    assertEquals("q: int = div x zero;", div.toBril());
    assertFalse(faintness.isFaint(div));
    assertFalse(faintness.isFaint(insts.get(3)));
    // zero only feeds the division, which may trap and so counts as needed
    assertFalse(faintness.isFaint(insts.get(1)));
  }

  @Test
  public void testUnusedChainIsFaint() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("dead_code").getFunction("main").getBody();
    FaintnessAnalysis faintness = new FaintnessAnalysis(cfg).analyze();
    List<Instruction> entry = cfg.getEntry().getInstructions();
    assertTrue(faintness.isFaint(entry.get(4)));
    assertTrue(faintness.isFaint(entry.get(5)));
    assertFalse(faintness.isFaint(entry.get(3)));
    assertTrue(faintness.isFaint(cfg.getBlock("body").getInstructions().get(1)));
  }
}
