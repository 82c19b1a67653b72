package util.bril;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import org.junit.Test;

import exception.CompileException;
import ir.Program;

public class BrilLoaderTest {

  private static final String[] PROGRAMS = {
      "fold", "branch_fold", "dead_code", "div_trap", "alias_dse", "memory", "escape",
      "lcm_loop", "lcm_diamond", "pdce_branch", "faint_loop", "critical_edge", "pointers",
      "lcm_carried", "freed_store", "oob_store", "freed_load", "oob_load" };

  @Test
  public void testPrintedProgramParsesToItself() throws Exception {
    for (String name : PROGRAMS) {
      String once = TestPrograms.load(name).toBril();
      String twice = BrilLoader.parseFromString(once, name).toBril();
      assertEquals(name, once, twice);
    }
  }

  @Test
  public void testPrintedProgramBehavesLikeSource() throws Exception {
    for (String name : PROGRAMS) {
      Program source = TestPrograms.load(name);
      Program reparsed = BrilLoader.parseFromString(source.toBril(), name);
      assertEquals(name, BrilInterpreter.run(source).output(), BrilInterpreter.run(reparsed).output());
    }
  }

  @Test
  public void testFunctionSignatures() throws Exception {
    Program program = TestPrograms.load("pointers");
    assertEquals(2, program.getFunctions().size());
    assertEquals("@fill(p: ptr<int>, v: int)", program.getFunction("fill").getSignature());
    assertEquals("@main", program.getFunction("main").getSignature());
    assertThat(program.toBril(), containsString("@fill(p: ptr<int>, v: int) {"));
  }

  @Test
  public void testCommentsAndNegativeConstants() throws Exception {
    Program program = TestPrograms.parse(
        "# leading comment\n"
        + "@main {\n"
        + "  x: int = const -3;  # trailing comment\n"
        + "  b: bool = const true;\n"
        + "  print x b;\n"
        + "}\n");
    assertThat(program.toBril(), containsString("x: int = const -3;"));
    assertEquals("-3 true", BrilInterpreter.run(program).output().get(0));
  }

  @Test
  public void testSyntaxErrorReportsLine() {
    try {
      TestPrograms.parse("@main {\n  x: int = const 1;\n  y: int = ;\n}\n");
      fail("expected a parse error");
    } catch (BrilParseException e) {
      assertEquals(3, e.getLineNumber());
      assertFalse(e.getErrors().isEmpty());
    }
  }

  @Test
  public void testUnknownOpcodeIsReported() {
    try {
      TestPrograms.parse("@main {\n  x: int = const 1;\n  y: int = frob x;\n  print y;\n}\n");
      fail("expected a parse error");
    } catch (BrilParseException e) {
      assertEquals(3, e.getLineNumber());
      assertThat(e.getMessage(), containsString("frob"));
    }
  }

  @Test
  public void testWrongArityIsReported() {
    try {
      TestPrograms.parse("@main {\n  x: int = const 1;\n  y: int = add x;\n  print y;\n}\n");
      fail("expected a parse error");
    } catch (BrilParseException e) {
      assertThat(e.getMessage(), containsString("expected 2 operand(s)"));
    }
  }

  @Test
  public void testAllErrorsOfAFileAreCollected() {
    try {
      TestPrograms.parse("@main {\n  a: int = frob;\n  b: int = blah;\n}\n");
      fail("expected a parse error");
    } catch (BrilParseException e) {
      assertTrue(e.hasMultipleErrors());
      assertEquals(2, e.getLineNumber());
    }
  }

  @Test(expected = CompileException.class)
  public void testUndefinedLabel() throws Exception {
    TestPrograms.parse("@main {\n  jmp .nowhere;\n}\n");
  }

  @Test
  public void testDuplicateLabel() throws Exception {
    try {
      TestPrograms.parse("@main {\n.a:\n  jmp .a;\n.a:\n  ret;\n}\n");
      fail("expected a compile error");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("Duplicate label .a"));
    }
  }

  @Test
  public void testUndefinedVariable() throws Exception {
    try {
      TestPrograms.parse("@main {\n  print y;\n}\n");
      fail("expected a compile error");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("undefined variable y"));
    }
  }

  @Test(expected = CompileException.class)
  public void testDuplicateFunction() throws Exception {
    TestPrograms.parse("@main {\n  ret;\n}\n@main {\n  ret;\n}\n");
  }

  @Test
  public void testFallthroughRejectedByDefault() throws Exception {
    try {
      TestPrograms.load("fallthrough");
      fail("expected a compile error");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("falls through"));
    }
  }

  @Test
  public void testFallthroughAcceptedWhenLenient() throws Exception {
    Program program = TestPrograms.load("fallthrough", LoaderConfig.lenientConfig());
    assertEquals("2", BrilInterpreter.run(program).output().get(0));
    // the implicit jump into .loop is not printed
    assertThat(program.toBril(), not(containsString("jmp .loop;")));
  }

  @Test(expected = java.io.IOException.class)
  public void testMissingResource() throws Exception {
    BrilLoader.loadFromResource("programs/does_not_exist.bril");
  }
}
