package pass.IRPass;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.After;
import org.junit.Test;

import driver.Config;
import ir.Program;
import pass.IRPassType;
import util.bril.BrilInterpreter;
import util.bril.TestPrograms;

public class LazyCodeMotionPassTest {

  @After
  public void tearDown() {
    Config.getInstance().lcmEdgePlacement = false;
  }

  @Test
  public void testRedundancyInsideBlockIsComputedOnce() throws Exception {
    Program source = TestPrograms.load("lcm_loop");
    Program program = TestPrograms.apply(TestPrograms.load("lcm_loop"), IRPassType.LazyCodeMotion);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("lcm.t0: int = add a0 a1;"));
    assertThat(text, containsString("lcm.t1: int = mul a2 a3;"));
    assertEquals(1, TestPrograms.occurrences(text, "= add a0 a1;"));
    assertEquals(1, TestPrograms.occurrences(text, "= mul a2 a3;"));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("434"), after.output());
    // two computations saved on each of the five iterations
    assertEquals(before.dynamicCount() - 10, after.dynamicCount());
  }

  @Test
  public void testPartialRedundancyAcrossJoin() throws Exception {
    Program source = TestPrograms.load("lcm_diamond");
    Program program = TestPrograms.apply(TestPrograms.load("lcm_diamond"), IRPassType.LazyCodeMotion);
    String text = TestPrograms.text(program, "main");
    assertEquals(2, TestPrograms.occurrences(text, "lcm.t0: int = add a b;"));
    assertEquals(2, TestPrograms.occurrences(text, "print lcm.t0;"));
    assertThat(text, not(containsString("y: int")));
    // the else arm only gets the computation after its own print
    assertTrue(text.indexOf("print a;") < text.lastIndexOf("lcm.t0: int = add a b;"));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("6", "13"), after.output());
    assertEquals(before.dynamicCount(), after.dynamicCount());
  }

  @Test
  public void testNothingIsPlacedOnEdgesByDefault() throws Exception {
    Program source = TestPrograms.load("critical_edge");
    Program program = TestPrograms.apply(TestPrograms.load("critical_edge"), IRPassType.LazyCodeMotion);
    assertThat(TestPrograms.text(program, "main"), not(containsString(".b0.to.join:")));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("3", "3"), after.output());
    assertEquals(before.dynamicCount(), after.dynamicCount());
  }

  @Test
  public void testEdgePlacement() throws Exception {
    Config.getInstance().lcmEdgePlacement = true;
    Program source = TestPrograms.load("critical_edge");
    Program program = TestPrograms.apply(TestPrograms.load("critical_edge"), IRPassType.LazyCodeMotion);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString(".b0.to.join:"));
    assertThat(text, not(containsString("y: int")));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("3", "3"), after.output());
    assertEquals(before.dynamicCount() - 1, after.dynamicCount());
  }

  @Test
  public void testTrappingExpressionsStayPut() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("div_trap"), IRPassType.LazyCodeMotion);
    BrilInterpreter.Result result = BrilInterpreter.run(program);
    assertTrue(result.trapped());
    assertThat(result.trap(), containsString("division by zero"));
  }

  @Test
  public void testLoopCarriedCopiesAreNotIntroduced() throws Exception {
    Program source = TestPrograms.load("lcm_carried");
    Program program = TestPrograms.apply(TestPrograms.load("lcm_carried"), IRPassType.LazyCodeMotion);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("x: int = add a b;"));
    assertThat(text, containsString("y: int = add a b;"));
    assertThat(text, containsString("a: int = add a one;"));
    assertThat(text, not(containsString("= id lcm.")));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("0 0", "5 5", "6 6", "7 7", "8 8"), after.output());
    assertEquals(before.dynamicCount(), after.dynamicCount());
  }
}
