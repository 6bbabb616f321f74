package org.ggp.ismcts.search;

import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.ismcts.infoset.InfoSet;
import org.ggp.ismcts.model.Model;
import org.ggp.ismcts.util.cfg.MachineSpecificConfiguration;
import org.ggp.ismcts.util.cfg.MachineSpecificConfiguration.CfgItem;

/**
 * A persistent interval-valued search tree.  Each call to {@link #visit()} performs one simulation from the root,
 * growing the same tree.
 *
 * Choosing a move from the root statistics is left to the caller.
 */
public class SearchTree
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Model mModel;
  private final SearchParameters mParameters;
  private final Random mRandom;
  private final DecisionNode mRoot;

  /**
   * Create a tree using the machine-specific configuration for its parameters and random seed.
   *
   * @param xiModel       - the model used to expand nodes.
   * @param xiRootInfoSet - information set of the root, in which the current player chooses an action.
   */
  public SearchTree(Model xiModel, InfoSet xiRootInfoSet)
  {
    this(xiModel, xiRootInfoSet, SearchParameters.fromConfiguration(), createConfiguredRandom());
  }

  /**
   * Create a tree.
   *
   * @param xiModel       - the model used to expand nodes.
   * @param xiRootInfoSet - information set of the root, in which the current player chooses an action.
   * @param xiParameters  - search parameters.
   * @param xiRandom      - random source for all sampling in the tree.
   */
  public SearchTree(Model xiModel, InfoSet xiRootInfoSet, SearchParameters xiParameters, Random xiRandom)
  {
    mModel = xiModel;
    mParameters = xiParameters;
    mRandom = xiRandom;
    //  The root has no value until its first evaluation fixes the number of players
    mRoot = new DecisionNode(this, xiRootInfoSet, null);

    LOGGER.debug("Created search tree with " + xiParameters);
  }

  private static Random createConfiguredRandom()
  {
    int lSeed = MachineSpecificConfiguration.getCfgInt(CfgItem.RANDOM_SEED);
    return (lSeed < 0) ? new Random() : new Random(lSeed);
  }

  /**
   * Perform one simulation from the root.
   */
  public void visit()
  {
    mRoot.visit(mModel);
  }

  public DecisionNode getRoot()
  {
    return mRoot;
  }

  public Model getModel()
  {
    return mModel;
  }

  public SearchParameters getParameters()
  {
    return mParameters;
  }

  Random getRandom()
  {
    return mRandom;
  }

  /**
   * Dump the statistics of the immediate children of the root.
   */
  public void dumpRootData()
  {
    LOGGER.info("Root after " + mRoot.getNumVisits() + " visits: Q = " + mRoot.getQ() + " (" +
                mRoot.getNumPureSelections() + " pure, " + mRoot.getNumMixedSelections() + " mixed selections)");

    if (!mRoot.isExpanded())
    {
      return;
    }

    int lPlayer = mRoot.getChoosingPlayer();
    int[] lActions = mRoot.getActions();
    double[] lPrior = mRoot.getPrior();
    double[] lPure = mRoot.getPureDistribution();
    double[] lMixed = mRoot.getMixedDistribution();

    for (int lii = 0; lii < lActions.length; lii++)
    {
      SearchTreeNode lChild = mRoot.getChildAt(lii);
      LOGGER.info(String.format("Action %d: [%.4f, %.4f] after %d visits, prior %.3f, pure %.3f, mixed %.3f",
                                lActions[lii],
                                lChild.getQ().getLower(lPlayer),
                                lChild.getQ().getUpper(lPlayer),
                                lChild.getNumVisits(),
                                lPrior[lii],
                                lPure[lii],
                                lMixed[lii]));
    }
  }
}
