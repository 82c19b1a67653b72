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

public class RedundantLoadEliminationPassTest {

  @Test
  public void testLoadsAcrossBlocksBecomeCopies() throws Exception {
    Program source = TestPrograms.load("memory");
    Program program = TestPrograms.apply(TestPrograms.load("memory"), IRPassType.RedundantLoadElimination);
    String text = TestPrograms.text(program, "main");
    assertEquals(0, TestPrograms.occurrences(text, "= load "));
    assertThat(text, containsString("a: int = id seven;"));
    assertThat(text, containsString("e: int = id two;"));
    assertThat(text, containsString("f: int = id seven;"));
    assertThat(text, containsString("g: int = id two;"));

    BrilInterpreter.Result before = BrilInterpreter.run(source);
    BrilInterpreter.Result after = BrilInterpreter.run(program);
    assertEquals(before.output(), after.output());
    assertEquals(before.dynamicCount(), after.dynamicCount());
  }

  @Test
  public void testReplacedLoadExposesMoreCopies() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("escape"), IRPassType.RedundantLoadElimination);
    String text = TestPrograms.text(program, "main");
    // once inner is a copy of data, the store through it is known to hit data
    assertThat(text, containsString("inner: ptr<int> = id data;"));
    assertThat(text, containsString("x: int = id one;"));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());

    String first = program.toBril();
    TestPrograms.apply(program, IRPassType.RedundantLoadElimination);
    assertEquals(first, program.toBril());
  }

  @Test
  public void testStoreThroughUnknownPointerKillsValues() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  two: int = const 2;\n"
        + "  a: ptr<int> = alloc one;\n"
        + "  b: ptr<int> = alloc one;\n"
        + "  cell: ptr<ptr<int>> = alloc one;\n"
        + "  c: bool = lt one two;\n"
        + "  br c .left .right;\n"
        + ".left:\n"
        + "  store cell a;\n"
        + "  jmp .join;\n"
        + ".right:\n"
        + "  store cell b;\n"
        + "  jmp .join;\n"
        + ".join:\n"
        + "  store a one;\n"
        + "  store b one;\n"
        + "  inner: ptr<int> = load cell;\n"
        + "  store inner two;\n"
        + "  x: int = load a;\n"
        + "  print x;\n"
        + "  free a;\n"
        + "  free b;\n"
        + "  free cell;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.RedundantLoadElimination);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("inner: ptr<int> = load cell;"));
    assertThat(text, containsString("x: int = load a;"));
    assertEquals(List.of("2"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testValueOnlyOnOnePathIsNotReused() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  two: int = const 2;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  store p one;\n"
        + "  c: bool = lt one two;\n"
        + "  br c .write .skip;\n"
        + ".write:\n"
        + "  store p two;\n"
        + "  jmp .skip;\n"
        + ".skip:\n"
        + "  x: int = load p;\n"
        + "  print x;\n"
        + "  free p;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.RedundantLoadElimination);
    assertThat(TestPrograms.text(program, "main"), containsString("x: int = load p;"));
    assertEquals(List.of("2"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testRedefinedValueIsNotReused() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  v: int = const 5;\n"
        + "  store p v;\n"
        + "  v: int = const 6;\n"
        + "  x: int = load p;\n"
        + "  print x v;\n"
        + "  free p;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.RedundantLoadElimination);
    assertThat(TestPrograms.text(program, "main"), containsString("x: int = load p;"));
    assertEquals(List.of("5 6"), BrilInterpreter.run(program).output());
  }
}
