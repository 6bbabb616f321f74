package org.ggp.ismcts.search;

import static org.ggp.ismcts.search.ScriptedModel.iv;

import java.util.Arrays;
import java.util.Random;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.ggp.ismcts.model.Evaluation;
import org.ggp.ismcts.model.ValueInterval;
import org.ggp.ismcts.search.SearchTreeNode.NodeKind;
import org.junit.Assert;
import org.junit.Test;

public class DecisionNodeTest extends Assert
{
  private static final double TOLERANCE = 1e-12;

  private static final double[] UNIFORM_3 = {1.0 / 3, 1.0 / 3, 1.0 / 3};

  private static SearchParameters parameters(double xiExplorationConstant)
  {
    return new SearchParameters(xiExplorationConstant, 0.05, 1e-6, true);
  }

  /**
   * Build a tree whose root has three actions, each leading to an endless subtree with a fixed value.
   */
  private static SearchTree threeArmedTree(double[] xiPrior, ValueInterval[] xiArms, double xiExplorationConstant)
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1, 2);
    ScriptedModel lModel = new ScriptedModel();
    String[] lLabels = {"a", "b", "c"};

    for (int lii = 0; lii < 3; lii++)
    {
      lRoot.then(lii, ScriptedInfoSet.endless(lLabels[lii], 1));
      lModel.constant(lLabels[lii], xiArms[lii]);
    }
    lModel.actions("root", new Evaluation(xiPrior, iv(-1, 1, -1, 1), xiArms));

    return new SearchTree(lModel, lRoot, parameters(xiExplorationConstant), new Random(42));
  }

  @Test
  public void testFirstVisitOnlyExpands()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1)
                                           .then(0, ScriptedInfoSet.terminal("win", 1, -1))
                                           .then(1, ScriptedInfoSet.terminal("draw", 0, 0));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(new double[] {0.5, 0.5},
                                      new double[] {0, 0},
                                      new double[][] {{1, -1}, {0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(1));
    DecisionNode lRootNode = lTree.getRoot();

    assertFalse(lRootNode.isExpanded());
    assertNull(lRootNode.getChild(0));

    lTree.visit();
    assertEquals(1, lRootNode.getNumVisits());
    assertTrue(lRootNode.isExpanded());
    assertEquals(0, lRootNode.getChild(0).getNumVisits());
    assertEquals(0, lRootNode.getChild(1).getNumVisits());
    assertEquals(ValueInterval.fromValues(0, 0), lRootNode.getQ());
    assertEquals(1, lModel.getCalls("root"));

    lTree.visit();
    assertEquals(2, lRootNode.getNumVisits());
    assertEquals(1, lRootNode.getChild(0).getNumVisits() + lRootNode.getChild(1).getNumVisits());

    //  The winning child is the only candidate
    assertEquals(1, lRootNode.getChild(0).getNumVisits());
    assertEquals(1, lRootNode.getNumPureSelections());
    assertEquals(ValueInterval.fromValues(1, -1), lRootNode.getQ());
    assertEquals(1, lModel.getCalls("root"));
  }

  @Test
  public void testChildrenSeededFromModel()
  {
    ValueInterval[] lArms = {iv(0.5, 0.6, -0.6, -0.5), iv(0.0, 0.4, -0.4, 0.0), iv(-1, -0.5, 0.5, 1)};
    SearchTree lTree = threeArmedTree(UNIFORM_3, lArms, 1.0);

    lTree.visit();

    DecisionNode lRoot = lTree.getRoot();
    assertEquals(iv(-1, 1, -1, 1), lRoot.getInitialValue());
    assertArrayEquals(UNIFORM_3, lRoot.getPrior(), TOLERANCE);
    for (int lii = 0; lii < 3; lii++)
    {
      assertEquals(lArms[lii], lRoot.getChildAt(lii).getQ());
      assertEquals(lArms[lii], lRoot.getInitialChildValue(lii));
      assertEquals(NodeKind.DECISION, lRoot.getChildAt(lii).getKind());
    }
  }

  @Test
  public void testPureSelectionIsDeterministic()
  {
    ValueInterval[] lArms = {iv(0.5, 0.6, -0.6, -0.5), iv(0.0, 0.4, -0.4, 0.0), iv(-1, -0.5, 0.5, 1)};
    SearchTree lTree = threeArmedTree(UNIFORM_3, lArms, 0.001);
    DecisionNode lRoot = lTree.getRoot();

    lTree.visit();
    for (int lii = 0; lii < 50; lii++)
    {
      assertArrayEquals(new int[] {0}, lRoot.computeCandidates());
      lTree.visit();
    }

    assertEquals(50, lRoot.getChild(0).getNumVisits());
    assertEquals(0, lRoot.getChild(1).getNumVisits());
    assertEquals(0, lRoot.getChild(2).getNumVisits());
    assertEquals(50, lRoot.getNumPureSelections());
    assertEquals(0, lRoot.getNumMixedSelections());
    assertArrayEquals(new double[] {1, 0, 0}, lRoot.getPureDistribution(), TOLERANCE);
    assertArrayEquals(new double[] {0, 0, 0}, lRoot.getMixedDistribution(), TOLERANCE);
    assertEquals(lArms[0], lRoot.getQ());
  }

  @Test
  public void testMixedSelectionStaysInCandidateSet()
  {
    ValueInterval[] lArms = {iv(0.0, 1.0, -1.0, 0.0), iv(0.2, 0.8, -0.8, -0.2), iv(-1, -0.9, 0.9, 1)};
    double[] lPrior = {0.2, 0.3, 0.5};
    SearchTree lTree = threeArmedTree(lPrior, lArms, 0.001);
    DecisionNode lRoot = lTree.getRoot();

    lTree.visit();
    for (int lii = 0; lii < 200; lii++)
    {
      int[] lCandidates = lRoot.computeCandidates();
      assertArrayEquals(new int[] {0, 1}, lCandidates);

      int[] lBefore = childVisits(lRoot);
      lTree.visit();
      int[] lAfter = childVisits(lRoot);

      int lVisited = -1;
      for (int lChild = 0; lChild < 3; lChild++)
      {
        if (lAfter[lChild] != lBefore[lChild])
        {
          assertEquals(-1, lVisited);
          assertEquals(lBefore[lChild] + 1, lAfter[lChild]);
          lVisited = lChild;
        }
      }
      assertTrue("Visited " + lVisited + " outside " + Arrays.toString(lCandidates),
                 lVisited == 0 || lVisited == 1);
    }

    assertEquals(0, lRoot.getChild(2).getNumVisits());
    assertTrue(lRoot.getChild(0).getNumVisits() > 0);
    assertTrue(lRoot.getChild(1).getNumVisits() > 0);
    assertEquals(200, lRoot.getNumMixedSelections());
    assertEquals(0, lRoot.getNumPureSelections());
    assertArrayEquals(new double[] {0.4, 0.6, 0}, lRoot.getMixedDistribution(), TOLERANCE);

    //  Value is the mixing distribution applied to the arms
    ValueInterval lQ = lRoot.getQ();
    assertEquals(0.12, lQ.getLower(0), TOLERANCE);
    assertEquals(0.88, lQ.getUpper(0), TOLERANCE);
    assertEquals(-0.88, lQ.getLower(1), TOLERANCE);
    assertEquals(-0.12, lQ.getUpper(1), TOLERANCE);
  }

  @Test
  public void testSelectionWithTraceLogging()
  {
    Configurator.setLevel(DecisionNode.class.getName(), Level.TRACE);
    try
    {
      ValueInterval[] lArms = {iv(0.0, 1.0, -1.0, 0.0), iv(0.2, 0.8, -0.8, -0.2), iv(-1, -0.9, 0.9, 1)};
      SearchTree lTree = threeArmedTree(new double[] {0.2, 0.3, 0.5}, lArms, 0.001);
      for (int lii = 0; lii < 11; lii++)
      {
        lTree.visit();
      }
      assertEquals(10, lTree.getRoot().getNumMixedSelections());

      SearchTree lPureTree = threeArmedTree(UNIFORM_3,
                                            new ValueInterval[] {iv(0.5, 0.6, -0.6, -0.5),
                                                                 iv(0, 0.1, -0.1, 0),
                                                                 iv(-0.5, -0.4, 0.4, 0.5)},
                                            0.001);
      for (int lii = 0; lii < 11; lii++)
      {
        lPureTree.visit();
      }
      assertEquals(10, lPureTree.getRoot().getNumPureSelections());
    }
    finally
    {
      Configurator.setLevel(DecisionNode.class.getName(), Level.WARN);
    }
  }

  @Test
  public void testRootAdoptsPlayerCountFromModel()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1)
                                           .then(0, ScriptedInfoSet.terminal("lead", 1, 0, -1))
                                           .then(1, ScriptedInfoSet.terminal("even", 0, 0, 0));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(new double[] {0.5, 0.5},
                                      new double[] {0, 0, 0},
                                      new double[][] {{1, 0, -1}, {0, 0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(3));
    DecisionNode lRootNode = lTree.getRoot();

    assertNull(lRootNode.getQ());

    lTree.visit();
    assertEquals(ValueInterval.fromValues(0, 0, 0), lRootNode.getQ());

    lTree.visit();
    assertEquals(3, lRootNode.getQ().getNumPlayers());
    assertEquals(ValueInterval.fromValues(1, 0, -1), lRootNode.getQ());
  }

  @Test
  public void testChildValueWithWrongPlayerCountIsContractViolation()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1)
                                           .then(0, ScriptedInfoSet.terminal("x", 1, 0, -1))
                                           .then(1, ScriptedInfoSet.terminal("y", 0, 0, 0));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(new double[] {0.5, 0.5},
                                      new double[] {0, 0, 0},
                                      new double[][] {{1, -1}, {0, 0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(3));

    try
    {
      lTree.visit();
      fail("Expected a contract violation");
    }
    catch (SearchContractException lEx)
    {
      assertEquals("expand", lEx.getOperation());
    }
  }

  @Test
  public void testMixingDistributionUsesOwnPrior()
  {
    ValueInterval[] lArms = {iv(0.0, 1.0, -1.0, 0.0), iv(0.2, 0.8, -0.8, -0.2), iv(-1, -0.9, 0.9, 1)};
    SearchTree lTree = threeArmedTree(new double[] {0.1, 0.3, 0.6}, lArms, 0.001);
    lTree.visit();

    double[] lMixing = lTree.getRoot().getMixingDistribution(new int[] {0, 1});
    assertArrayEquals(new double[] {0.25, 0.75, 0}, lMixing, TOLERANCE);
  }

  @Test
  public void testNoPriorMassOverCandidatesIsContractViolation()
  {
    ValueInterval[] lArms = {iv(0.0, 1.0, -1.0, 0.0), iv(0.2, 0.8, -0.8, -0.2), iv(-1, -0.9, 0.9, 1)};
    SearchTree lTree = threeArmedTree(new double[] {0, 0, 1}, lArms, 0.001);
    lTree.visit();

    try
    {
      lTree.visit();
      fail("Expected a contract violation");
    }
    catch (SearchContractException lEx)
    {
      assertEquals("select", lEx.getOperation());
      assertTrue(lEx.getNodeDescription().contains("root"));
    }
  }

  @Test
  public void testBackupConservation()
  {
    ValueInterval[] lArms = {iv(0.0, 0.5, -0.5, 0.0), iv(0.1, 0.4, -0.4, -0.1), iv(0.3, 0.35, -0.35, -0.3)};
    SearchTree lTree = threeArmedTree(UNIFORM_3, lArms, 2.0);
    DecisionNode lRoot = lTree.getRoot();

    for (int lii = 1; lii <= 100; lii++)
    {
      lTree.visit();
      assertEquals(lii, lRoot.getNumVisits());
      assertEquals(lRoot.getNumVisits() - 1, lRoot.getNumPureSelections() + lRoot.getNumMixedSelections());

      ValueInterval lQ = lRoot.getQ();
      for (int lPlayer = 0; lPlayer < 2; lPlayer++)
      {
        assertTrue(lQ.getLower(lPlayer) <= lQ.getUpper(lPlayer));
      }
    }

    //  The mixture of arm values must lie within the hull of the arms
    assertTrue(lRoot.getQ().getLower(0) >= -TOLERANCE);
    assertTrue(lRoot.getQ().getUpper(0) <= 0.5 + TOLERANCE);
  }

  @Test
  public void testTerminalRootNeverChanges()
  {
    ScriptedModel lModel = new ScriptedModel();
    SearchTree lTree = new SearchTree(lModel,
                                      ScriptedInfoSet.terminal("over", 0.25, -0.25),
                                      parameters(1.0),
                                      new Random(3));
    DecisionNode lRoot = lTree.getRoot();
    ValueInterval lBefore = lRoot.getQ();
    assertEquals(ValueInterval.fromValues(0.25, -0.25), lBefore);

    for (int lii = 1; lii <= 10; lii++)
    {
      lTree.visit();
      assertEquals(lii, lRoot.getNumVisits());
      assertEquals(lBefore, lRoot.getQ());
    }

    assertTrue(lRoot.isTerminal());
    assertFalse(lRoot.isExpanded());
    assertEquals(0, lRoot.getNumPureSelections() + lRoot.getNumMixedSelections());
    assertEquals(0, lModel.getCalls("over"));
  }

  @Test
  public void testHiddenInformationForOpponentCreatesSamplingChild()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1, 2)
      .then(0, ScriptedInfoSet.hidden("opponent-hidden", 1, true, true))
      .then(1, ScriptedInfoSet.hidden("own-hidden", 0, true, true))
      .then(2, ScriptedInfoSet.decision("opponent-public", 1, 0));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(UNIFORM_3, new double[] {0, 0}, new double[][] {{0, 0}, {0, 0}, {0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(5));

    lTree.visit();

    assertEquals(NodeKind.SAMPLING, lTree.getRoot().getChild(0).getKind());
    assertEquals(NodeKind.DECISION, lTree.getRoot().getChild(1).getKind());
    assertEquals(NodeKind.DECISION, lTree.getRoot().getChild(2).getKind());
  }

  @Test
  public void testMismatchedEvaluationIsContractViolation()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1)
                                           .then(0, ScriptedInfoSet.terminal("x", 1, -1))
                                           .then(1, ScriptedInfoSet.terminal("y", -1, 1));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(UNIFORM_3, new double[] {0, 0}, new double[][] {{0, 0}, {0, 0}, {0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(5));

    try
    {
      lTree.visit();
      fail("Expected a contract violation");
    }
    catch (SearchContractException lEx)
    {
      assertEquals("expand", lEx.getOperation());
    }
  }

  @Test
  public void testNegativePriorIsContractViolation()
  {
    ScriptedInfoSet lRoot = ScriptedInfoSet.decision("root", 0, 0, 1)
                                           .then(0, ScriptedInfoSet.terminal("x", 1, -1))
                                           .then(1, ScriptedInfoSet.terminal("y", -1, 1));
    ScriptedModel lModel = new ScriptedModel()
      .actions("root", new Evaluation(new double[] {1.5, -0.5}, new double[] {0, 0}, new double[][] {{0, 0}, {0, 0}}));
    SearchTree lTree = new SearchTree(lModel, lRoot, parameters(1.0), new Random(5));

    try
    {
      lTree.visit();
      fail("Expected a contract violation");
    }
    catch (SearchContractException lEx)
    {
      assertEquals("expand", lEx.getOperation());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownActionRejected()
  {
    SearchTree lTree = threeArmedTree(UNIFORM_3,
                                      new ValueInterval[] {iv(0, 0, 0, 0), iv(0, 0, 0, 0), iv(0, 0, 0, 0)},
                                      1.0);
    lTree.getRoot().getChild(7);
  }

  private static int[] childVisits(DecisionNode xiNode)
  {
    int[] lVisits = new int[xiNode.getNumChildren()];
    for (int lii = 0; lii < lVisits.length; lii++)
    {
      lVisits[lii] = xiNode.getChildAt(lii).getNumVisits();
    }
    return lVisits;
  }
}
