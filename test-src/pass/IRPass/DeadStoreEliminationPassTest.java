package pass.IRPass;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import ir.Program;
import pass.IRPassType;
import util.bril.BrilInterpreter;
import util.bril.TestPrograms;

public class DeadStoreEliminationPassTest {

  @Test
  public void testOverwrittenStoresAreRemoved() throws Exception {
    Program source = TestPrograms.load("alias_dse");
    Program program = TestPrograms.apply(TestPrograms.load("alias_dse"), IRPassType.DeadStoreElimination);
    String text = TestPrograms.text(program, "main");
    assertThat(text, not(containsString("store valstwo two;")));
    assertThat(text, containsString("store valstwo zero;"));
    assertThat(text, containsString("store ptr one;"));
    // the first store to vals is overwritten on both paths, the second is read
    assertEquals(1, TestPrograms.occurrences(text, "store vals zero;"));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(List.of("0 0"), after.output());
    assertEquals(before.output(), after.output());
    assertEquals(before.dynamicCount() - 2, after.dynamicCount());
  }

  @Test
  public void testStoresThroughParametersSurvive() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("pointers"), IRPassType.DeadStoreElimination);
    // the caller may read the second store, the first one is overwritten
    assertEquals(1, TestPrograms.occurrences(TestPrograms.text(program, "fill"), "store p v;"));
    assertThat(TestPrograms.text(program, "main"), containsString("store buf five;"));
    assertEquals(List.of("5"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testEscapingMemoryIsKept() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("escape"), IRPassType.DeadStoreElimination);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("store cell data;"));
    assertThat(text, containsString("store inner one;"));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testStoreBeforeFreeIsDead() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  store p one;\n"
        + "  x: int = load p;\n"
        + "  store p x;\n"
        + "  free p;\n"
        + "  print x;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.DeadStoreElimination);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("store p one;"));
    assertThat(text, not(containsString("store p x;")));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());
    assertFalse(BrilInterpreter.run(program).leaked());
  }

  @Test
  public void testStoreToFreedMemoryIsKept() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  free p;\n"
        + "  store p one;\n"
        + "  print one;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.DeadStoreElimination);
    assertThat(TestPrograms.text(program, "main"), containsString("store p one;"));
    BrilInterpreter.Result result = BrilInterpreter.run(program);
    assertEquals("access to freed memory", result.trap());
    assertTrue(result.output().isEmpty());
  }

  @Test
  public void testStoreOutOfBoundsIsKept() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  five: int = const 5;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  q: ptr<int> = ptradd p five;\n"
        + "  store q one;\n"
        + "  print one;\n"
        + "  free p;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.DeadStoreElimination);
    assertThat(TestPrograms.text(program, "main"), containsString("store q one;"));
    BrilInterpreter.Result result = BrilInterpreter.run(program);
    assertEquals("out of bounds access", result.trap());
    assertTrue(result.output().isEmpty());
  }

  @Test
  public void testOverwrittenFaultingStoreGoesOnlyWithoutPrintBetween() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  two: int = const 2;\n"
        + "  three: int = const 3;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  free p;\n"
        + "  store p one;\n"
        + "  print one;\n"
        + "  store p two;\n"
        + "  store p three;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.DeadStoreElimination);
    String text = TestPrograms.text(program, "main");
    // the fault moves from the second store to the third, the print still never runs
    assertThat(text, containsString("store p one;"));
    assertThat(text, not(containsString("store p two;")));
    assertThat(text, containsString("store p three;"));
    assertThat(text, containsString("print one;"));
    BrilInterpreter.Result result = BrilInterpreter.run(program);
    assertEquals("access to freed memory", result.trap());
    assertTrue(result.output().isEmpty());
  }
}
