package pass.IRPass.analysis;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Set;

import org.junit.Test;

import ir.ControlFlowGraph;
import ir.value.instructions.Instruction;
import util.bril.TestPrograms;

public class AliasAnalysisTest {

  private static AliasAnalysis analyze(String program, String function) throws Exception {
    ControlFlowGraph cfg = TestPrograms.load(program).getFunction(function).getBody();
    return new AliasAnalysis(cfg).analyze();
  }

  @Test
  public void testAllocationSitesAreDistinct() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("alias_dse").getFunction("main").getBody();
    AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
    // external plus one site per alloc
    assertEquals(3, alias.getLocations().size());
    assertEquals(List.of("vals", "valstwo", "ptr"), alias.getPointers());
    assertFalse(alias.isPointer("zero"));

    Instruction firstStore = cfg.getEntry().getInstructions().get(5);
    assertEquals("store vals zero;", firstStore.toBril());
    assertEquals(1, alias.pointsTo(firstStore, "vals").size());
    assertFalse(alias.mayAlias(firstStore, "vals", "valstwo"));
    assertTrue(alias.mayAlias(firstStore, "vals", "vals"));
  }

  @Test
  public void testMergedPointerMayAliasBoth() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("alias_dse").getFunction("main").getBody();
    AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
    Instruction storePtr = cfg.getBlock("join").getInstructions().get(0);
    assertEquals("store ptr one;", storePtr.toBril());

    Set<AbstractLocation> targets = alias.pointsTo(storePtr, "ptr");
    assertEquals(2, targets.size());
    assertTrue(targets.containsAll(alias.pointsToAnywhere("vals")));
    assertTrue(targets.containsAll(alias.pointsToAnywhere("valstwo")));
    assertTrue(alias.mayAlias(storePtr, "ptr", "vals"));
    assertTrue(alias.mayAlias(storePtr, "ptr", "valstwo"));
    // only one of the two paths copies vals into ptr
    assertFalse(alias.mustAlias(storePtr, "ptr", "vals"));
  }

  @Test
  public void testCopyGivesMustAlias() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("alias_dse").getFunction("main").getBody();
    AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
    Instruction jump = cfg.getBlock("same").getInstructions().get(1);
    assertTrue(alias.mustAlias(jump, "ptr", "vals"));
    assertTrue(alias.mustAlias(jump, "vals", "ptr"));
    assertFalse(alias.mustAlias(jump, "ptr", "valstwo"));

    Instruction other = cfg.getBlock("other").getInstructions().get(1);
    assertFalse(alias.mustAlias(other, "ptr", "valstwo"));
    assertEquals(alias.pointsToAnywhere("valstwo"), alias.pointsTo(other, "ptr"));
  }

  @Test
  public void testParametersPointOutside() throws Exception {
    AliasAnalysis alias = analyze("pointers", "fill");
    ControlFlowGraph cfg = TestPrograms.load("pointers").getFunction("fill").getBody();
    AliasAnalysis fresh = new AliasAnalysis(cfg).analyze();
    Instruction store = cfg.getEntry().getInstructions().get(0);
    assertEquals(Set.of(AbstractLocation.EXTERNAL), fresh.pointsTo(store, "p"));
    assertEquals(Set.of(AbstractLocation.EXTERNAL), alias.escapingLocations());
    assertTrue(alias.typeOf("p").isPointer());
    assertTrue(alias.typeOf("v").isInt());
    assertNull(alias.typeOf("nothing"));
  }

  @Test
  public void testStoredAddressEscapes() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("escape").getFunction("main").getBody();
    AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
    Set<AbstractLocation> escaping = alias.escapingLocations();
    assertTrue(escaping.containsAll(alias.pointsToAnywhere("data")));
    assertFalse(escaping.containsAll(alias.pointsToAnywhere("cell")));
    assertThat(escaping, hasItem(AbstractLocation.EXTERNAL));

    // a pointer read from memory may point anywhere
    Instruction storeInner = cfg.getEntry().getInstructions().get(5);
    assertEquals("store inner one;", storeInner.toBril());
    assertEquals(alias.getLocations().size(), alias.pointsTo(storeInner, "inner").size());
    assertTrue(alias.mayAlias(storeInner, "inner", "data"));
    assertFalse(alias.mustAlias(storeInner, "inner", "data"));
  }

  @Test
  public void testUnknownNamesMayAlias() throws Exception {
    ControlFlowGraph cfg = TestPrograms.load("memory").getFunction("main").getBody();
    AliasAnalysis alias = new AliasAnalysis(cfg).analyze();
    Instruction first = cfg.getEntry().getInstructions().get(0);
    assertTrue(alias.mayAlias(first, "p", "seven"));
    assertThat(alias.getLocations().get(0), is(AbstractLocation.EXTERNAL));
    assertTrue(AbstractLocation.EXTERNAL.isExternal());
  }
}
