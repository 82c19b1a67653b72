package pass.IRPass;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import ir.ControlFlowGraph;
import ir.Program;
import ir.value.constants.ConstantInt;
import pass.IRPassType;
import pass.IRPass.analysis.LatticeValue;
import pass.IRPass.analysis.LatticeValue.Const;
import pass.IRPass.analysis.LatticeValue.Nac;
import pass.IRPass.analysis.LatticeValue.Undef;
import util.bril.BrilInterpreter;
import util.bril.TestPrograms;

public class ConstantPropagationPassTest {

  @Test
  public void testFoldsArithmetic() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("fold"), IRPassType.ConstantPropagation);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("z: int = const 9;"));
    assertThat(text, not(containsString("add")));
    assertEquals(List.of("9"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testFoldsConstantBranch() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("branch_fold"), IRPassType.ConstantPropagation);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("c: bool = const true;"));
    assertThat(text, not(containsString("br ")));
    assertThat(text, not(containsString(".large:")));
    assertThat(text, containsString("s: int = const 10;"));
    // a division by a known non-zero constant is folded too
    assertThat(text, containsString("d: int = const 20;"));
    assertEquals(List.of("10", "20"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testDivisionByZeroIsKept() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("div_trap"), IRPassType.ConstantPropagation);
    assertThat(TestPrograms.text(program, "main"), containsString("q: int = div x zero;"));
    assertTrue(BrilInterpreter.run(program).trapped());
  }

  @Test
  public void testParametersAreUnknown() throws Exception {
    Program program = TestPrograms.parse(
        "@main(n: int) {\n"
        + "  one: int = const 1;\n"
        + "  m: int = add n one;\n"
        + "  print m;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.ConstantPropagation);
    assertThat(TestPrograms.text(program, "main"), containsString("m: int = add n one;"));
    assertEquals(List.of("5"), BrilInterpreter.run(program, 4L).output());
  }

  @Test
  public void testLoopVariablesAreNotConstant() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("dead_code").getFunction("main").getBody();
    Map<?, Map<String, LatticeValue>> in = new ConstantPropagationPass().analyze(cfg);
    Map<String, LatticeValue> atLoop = in.get(cfg.getBlock("loop"));
    assertEquals(Nac.getInstance(), atLoop.get("i"));
    assertEquals(new Const(new ConstantInt(5)), atLoop.get("n"));
    assertEquals(new Const(new ConstantInt(1)), atLoop.get("one"));

    Program program = TestPrograms.apply(TestPrograms.load("dead_code"), IRPassType.ConstantPropagation);
    assertThat(TestPrograms.text(program, "main"), containsString("cond: bool = lt i n;"));
    assertEquals(List.of("10"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testMeet() {
    LatticeValue one = new Const(new ConstantInt(1));
    LatticeValue two = new Const(new ConstantInt(2));
    assertEquals(one, LatticeValue.meet(Undef.getInstance(), one));
    assertEquals(one, LatticeValue.meet(one, new Const(new ConstantInt(1))));
    assertEquals(Nac.getInstance(), LatticeValue.meet(one, two));
    assertEquals(Nac.getInstance(), LatticeValue.meet(Nac.getInstance(), Undef.getInstance()));
    assertTrue(one.isConstant());
  }

  @Test
  public void testInputIsLeftUntouched() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("branch_fold").getFunction("main").getBody();
    String before = cfg.toBril();
    ControlFlowGraph after = new ConstantPropagationPass().run(cfg);
    assertEquals(before, cfg.toBril());
    assertNotSame(cfg, after);
    assertTrue(cfg.containsBlock("large"));
  }
}
