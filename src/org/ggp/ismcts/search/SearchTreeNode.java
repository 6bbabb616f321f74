package org.ggp.ismcts.search;

import org.ggp.ismcts.infoset.InfoSet;
import org.ggp.ismcts.model.Evaluation;
import org.ggp.ismcts.model.Model;
import org.ggp.ismcts.model.ValueInterval;

/**
 * A node in an interval-valued search tree.
 *
 * There are exactly two kinds of node - {@link DecisionNode} and {@link SamplingNode} - and the constructor is
 * package-private so that no others can be added.  Nodes are created once, updated on every visit that reaches them
 * and live as long as the tree.
 */
public abstract class SearchTreeNode
{
  /**
   * The kinds of node.
   */
  public static enum NodeKind
  {
    /**
     * The acting player chooses amongst public actions.
     */
    DECISION,

    /**
     * Undetermined hidden information is resolved by sampling from a belief.
     */
    SAMPLING
  }

  /**
   * Expansion state.  A node calls the model exactly once, on the transition to EXPANDED.
   */
  public static enum ExpansionState
  {
    UNEXPANDED,
    EXPANDED
  }

  protected final SearchTree mTree;
  protected final InfoSet mInfoSet;
  protected final int mChoosingPlayer;
  protected final double[] mGameOutcome;
  protected ValueInterval mQ;
  protected int mNumVisits = 0;
  protected ExpansionState mExpansionState = ExpansionState.UNEXPANDED;

  SearchTreeNode(SearchTree xiTree, InfoSet xiInfoSet, ValueInterval xiInitialQ)
  {
    mTree = xiTree;
    mInfoSet = xiInfoSet;
    mChoosingPlayer = xiInfoSet.getCurrentPlayer();
    double[] lOutcome = xiInfoSet.getGameOutcome();
    mGameOutcome = (lOutcome == null) ? null : lOutcome.clone();
    mQ = xiInitialQ;
  }

  /**
   * @return the kind of this node.
   */
  public abstract NodeKind getKind();

  /**
   * Perform one simulation through this node.
   *
   * @param xiModel - the model used to expand nodes.
   */
  public abstract void visit(Model xiModel);

  /**
   * @return whether the game has ended in this node's information set.
   */
  public boolean isTerminal()
  {
    return mGameOutcome != null;
  }

  public InfoSet getInfoSet()
  {
    return mInfoSet;
  }

  /**
   * @return the player to act in this node.
   */
  public int getChoosingPlayer()
  {
    return mChoosingPlayer;
  }

  /**
   * @return the current value interval of this node, or null for a root that has not yet been expanded.
   */
  public ValueInterval getQ()
  {
    return mQ;
  }

  /**
   * @return the number of visits that have reached this node.
   */
  public int getNumVisits()
  {
    return mNumVisits;
  }

  public ExpansionState getExpansionState()
  {
    return mExpansionState;
  }

  public boolean isExpanded()
  {
    return mExpansionState == ExpansionState.EXPANDED;
  }

  /**
   * Create the child reached from this node, of the kind dictated by the resulting information set.
   *
   * @param xiChildInfoSet - the child's information set.
   * @param xiSamplingKind - whether the child should be a sampling node.
   * @param xiSeed         - initial value interval of the child.
   */
  SearchTreeNode createChild(InfoSet xiChildInfoSet, boolean xiSamplingKind, ValueInterval xiSeed)
  {
    if (xiSamplingKind)
    {
      return new SamplingNode(mTree, xiChildInfoSet, xiSeed);
    }
    return new DecisionNode(mTree, xiChildInfoSet, xiSeed);
  }

  /**
   * Check that an evaluation returned by the model is usable for this node.
   *
   * @param xiEvaluation - the evaluation.
   * @param xiSize       - the number of children it must cover.
   * @param xiOperation  - the operation requesting it.
   */
  void validateEvaluation(Evaluation xiEvaluation, int xiSize, String xiOperation)
  {
    if (xiEvaluation == null)
    {
      throw contractViolation(xiOperation, "model returned no evaluation");
    }
    if (xiEvaluation.size() != xiSize || xiEvaluation.getNumChildValues() != xiSize)
    {
      throw contractViolation(xiOperation, "evaluation covers " + xiEvaluation.size() + " entries and " +
                                           xiEvaluation.getNumChildValues() + " child values, expected " + xiSize);
    }
    if (xiEvaluation.getValue() == null)
    {
      throw contractViolation(xiOperation, "evaluation has no value");
    }
    if (mQ != null)
    {
      checkNumPlayers(xiEvaluation.getValue(), mQ.getNumPlayers(), xiOperation);
    }

    double[] lDistribution = xiEvaluation.getDistribution();
    for (int lii = 0; lii < lDistribution.length; lii++)
    {
      if (!(lDistribution[lii] >= 0) || Double.isInfinite(lDistribution[lii]))
      {
        throw contractViolation(xiOperation, "distribution entry " + lii + " is " + lDistribution[lii]);
      }
    }
  }

  void checkNumPlayers(ValueInterval xiInterval, int xiNumPlayers, String xiOperation)
  {
    if (xiInterval.getNumPlayers() != xiNumPlayers)
    {
      throw contractViolation(xiOperation, "interval " + xiInterval + " does not cover " + xiNumPlayers + " players");
    }
  }

  SearchContractException contractViolation(String xiOperation, String xiDetail)
  {
    return new SearchContractException(toString(), xiOperation, xiDetail);
  }

  @Override
  public String toString()
  {
    return getKind() + " node for player " + mChoosingPlayer + " in " + mInfoSet;
  }
}
