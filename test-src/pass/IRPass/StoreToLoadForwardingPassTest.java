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

public class StoreToLoadForwardingPassTest {

  @Test
  public void testForwardsWithinBlock() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("memory"), IRPassType.StoreToLoadForwarding);
    String text = TestPrograms.text(program, "main");
    // q is a copy of p
    assertThat(text, containsString("a: int = id seven;"));
    assertThat(text, containsString("b: int = id seven;"));
    // other blocks are out of reach
    assertThat(text, containsString("d: int = load p;"));
    assertThat(text, containsString("f: int = load p;"));
    assertEquals(List.of("2", "7 7 9"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testMayAliasStoreBlocksForwarding() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  two: int = const 2;\n"
        + "  p: ptr<int> = alloc two;\n"
        + "  q: ptr<int> = ptradd p one;\n"
        + "  store p one;\n"
        + "  store q two;\n"
        + "  x: int = load p;\n"
        + "  print x;\n"
        + "  free p;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.StoreToLoadForwarding);
    assertThat(TestPrograms.text(program, "main"), containsString("x: int = load p;"));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testRedefinedPointerBlocksForwarding() throws Exception {
    Program program = TestPrograms.parse(
        "@main {\n"
        + "  one: int = const 1;\n"
        + "  p: ptr<int> = alloc one;\n"
        + "  r: ptr<int> = alloc one;\n"
        + "  store p one;\n"
        + "  store r one;\n"
        + "  p: ptr<int> = id r;\n"
        + "  x: int = load p;\n"
        + "  print x;\n"
        + "  free r;\n"
        + "}\n");
    TestPrograms.apply(program, IRPassType.StoreToLoadForwarding);
    String text = TestPrograms.text(program, "main");
    // forwarded from store r, not from the stale store p
    assertThat(text, containsString("x: int = id one;"));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());
  }

  @Test
  public void testForwardedPointerIsFollowed() throws Exception {
    Program program = TestPrograms.apply(TestPrograms.load("escape"), IRPassType.StoreToLoadForwarding);
    String text = TestPrograms.text(program, "main");
    assertThat(text, containsString("inner: ptr<int> = id data;"));
    assertThat(text, containsString("x: int = id one;"));
    assertEquals(List.of("1"), BrilInterpreter.run(program).output());

    String first = program.toBril();
    TestPrograms.apply(program, IRPassType.StoreToLoadForwarding);
    assertEquals(first, program.toBril());
  }
}
