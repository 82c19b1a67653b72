package pass.IRPass;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import exception.CompileException;
import ir.ControlFlowGraph;
import ir.type.IntegerType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.instructions.BinOperator;
import ir.value.instructions.JumpInst;
import ir.value.instructions.PrintInst;
import util.bril.TestPrograms;

public class VerifyIRPassTest {

  private static ControlFlowGraph body(String fixture) throws Exception {
    return TestPrograms.load(fixture).getFunction("main").getBody();
  }

  private static String failure(ControlFlowGraph cfg) {
    try {
      new VerifyIRPass().verify(cfg);
    } catch (CompileException e) {
      return e.getMessage();
    }
    fail("expected the verifier to reject @" + cfg.getName());
    return null;
  }

  @Test
  public void testLoadedProgramsAreWellFormed() throws Exception {
    for (String name : List.of("fold", "alias_dse", "memory", "lcm_loop", "critical_edge", "faint_loop")) {
      new VerifyIRPass().verify(body(name));
    }
  }

  @Test
  public void testUndefinedVariable() throws Exception {
    ControlFlowGraph cfg = body("fold");
    cfg.getEntry().addBeforeTerminator(new PrintInst(List.of("ghost")));
    assertThat(failure(cfg), containsString("undefined variable ghost"));
  }

  @Test
  public void testOperandTypeMismatch() throws Exception {
    ControlFlowGraph cfg = body("branch_fold");
    cfg.getEntry().addBeforeTerminator(new BinOperator("w", Opcode.ADD, IntegerType.getInt(), "c", "c"));
    assertThat(failure(cfg), containsString("[IRVerifier] @main"));
  }

  @Test
  public void testDanglingJump() throws Exception {
    ControlFlowGraph cfg = body("fold");
    cfg.getEntry().setTerminator(new JumpInst("nowhere"));
    assertThat(failure(cfg), containsString("undefined label .nowhere"));
  }

  @Test
  public void testStaleSuccessorSet() throws Exception {
    ControlFlowGraph cfg = body("lcm_loop");
    BasicBlock entry = cfg.getEntry();
    entry.getSuccessors().clear();
    assertThat(failure(cfg), containsString("successors"));
  }

  @Test
  public void testMissingTerminator() throws Exception {
    ControlFlowGraph cfg = body("dead_code");
    BasicBlock entry = cfg.getEntry();
    entry.getInstructions().remove(entry.getInstructions().size() - 1);
    assertThat(failure(cfg), containsString("block without terminator"));
  }
}
