package driver;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import exception.CompileException;
import pass.PassManager;
import util.bril.BrilLoader;

public class OptimizerDriverTest {

  @After
  public void tearDown() {
    OptimizerDriver.resetInstance();
    PassManager.resetInstance();
    Config.getInstance().allowFallthrough = false;
    Config.getInstance().isDebug = false;
  }

  private static String optimize(String program, String... args) {
    OptimizerDriver driver = OptimizerDriver.getInstance();
    driver.parseArgs(args);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    driver.run(new ByteArrayInputStream(program.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(out, true, StandardCharsets.UTF_8));
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void testParseArgs() {
    OptimizerDriver driver = OptimizerDriver.getInstance();
    driver.parseArgs(new String[] { "prog.bril", "-p", "lcm", "-o", "out.bril" });
    assertEquals("prog.bril", driver.getSource());
    assertEquals("out.bril", driver.getTarget());
    assertEquals("lcm", driver.getPipelineName());
    assertNull(driver.getPassNames());
  }

  @Test
  public void testPassList() {
    OptimizerDriver driver = OptimizerDriver.getInstance();
    driver.parseArgs(new String[] { "-passes", "constantpropagation, deadcodeelimination,", "-" });
    assertEquals(List.of("constantpropagation", "deadcodeelimination"), driver.getPassNames());
    assertEquals("-", driver.getSource());
  }

  @Test(expected = CompileException.class)
  public void testNoArgs() {
    OptimizerDriver.getInstance().parseArgs(new String[0]);
  }

  @Test(expected = CompileException.class)
  public void testMissingSource() {
    OptimizerDriver.getInstance().parseArgs(new String[] { "-p", "full" });
  }

  @Test(expected = CompileException.class)
  public void testDanglingOption() {
    OptimizerDriver.getInstance().parseArgs(new String[] { "a.bril", "-o" });
  }

  @Test
  public void testUnknownPipelineFailsEarly() {
    try {
      OptimizerDriver.getInstance().parseArgs(new String[] { "a.bril", "-p", "o3" });
      fail("o3 is not a pipeline");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("o3"));
    }
  }

  @Test(expected = CompileException.class)
  public void testUnknownOption() {
    OptimizerDriver.getInstance().parseArgs(new String[] { "a.bril", "-O2" });
  }

  @Test
  public void testOptimizesStdin() throws Exception {
    String text = optimize(BrilLoader.readResource("programs/fold.bril"), "-", "-p", "constant_folding");
    assertThat(text, containsString("z: int = const 9;"));
    assertThat(text, not(containsString("add x y")));
  }

  @Test
  public void testBaselinePrintsProgramBack() throws Exception {
    String source = BrilLoader.readResource("programs/lcm_diamond.bril");
    String text = optimize(source, "-");
    assertEquals(BrilLoader.parseFromString(source, "lcm_diamond").toBril(), text);
  }

  @Test
  public void testFallthroughFlag() throws Exception {
    String source = BrilLoader.readResource("programs/fallthrough.bril");
    try {
      optimize(source, "-");
      fail("strict loading rejects fall-through");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("falls through"));
    }
    OptimizerDriver.resetInstance();
    String text = optimize(source, "-", "-fallthrough");
    assertFalse(text.isEmpty());
  }

  @Test
  public void testParseErrorBecomesCompileException() {
    try {
      optimize("@main {\n  x: int = frob;\n}\n", "-");
      fail("frob is not an opcode");
    } catch (CompileException e) {
      assertThat(e.getMessage(), containsString("failed to parse -"));
    }
  }

  @Test
  public void testWritesTarget() throws Exception {
    Path out = Files.createTempFile("optimized", ".bril");
    try {
      optimize(BrilLoader.readResource("programs/dead_code.bril"), "-", "-p", "liveness", "-o", out.toString());
      String text = Files.readString(out);
      assertThat(text, not(containsString("waste")));
    } finally {
      Files.deleteIfExists(out);
    }
  }
}
