package org.ggp.ismcts.search;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.ismcts.infoset.InfoSet;
import org.ggp.ismcts.model.Evaluation;
import org.ggp.ismcts.model.Model;
import org.ggp.ismcts.model.ValueInterval;

/**
 * A node in which the acting player chooses amongst public actions.
 *
 * Selection uses a PUCT rule applied to both bounds of each child's value interval.  When a single child's optimistic
 * score reaches the best pessimistic score it is chosen outright (the pure case).  Otherwise the prior, restricted to
 * every child that could still be best, is sampled (the mixed case).  The node's value is the historically weighted
 * blend of the running pure and mixed selection distributions applied to the current child values.
 */
public class DecisionNode extends SearchTreeNode
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final int[] mActions;
  private final TIntIntHashMap mActionIndex;
  private SearchTreeNode[] mChildren = null;

  private double[] mPrior = null;
  private ValueInterval mInitialValue = null;
  private ValueInterval[] mInitialChildValues = null;

  private final StrategyAverage mPure;
  private final StrategyAverage mMixed;

  DecisionNode(SearchTree xiTree, InfoSet xiInfoSet, ValueInterval xiInitialQ)
  {
    super(xiTree, xiInfoSet, xiInitialQ);

    if (isTerminal())
    {
      mActions = new int[0];
      mQ = ValueInterval.fromValues(mGameOutcome);
    }
    else
    {
      mActions = xiInfoSet.getActions().clone();
    }

    mActionIndex = new TIntIntHashMap(Math.max(mActions.length * 2, 4), 0.5f, -1, -1);
    for (int lii = 0; lii < mActions.length; lii++)
    {
      mActionIndex.put(mActions[lii], lii);
    }

    mPure = new StrategyAverage(mActions.length);
    mMixed = new StrategyAverage(mActions.length);
  }

  @Override
  public NodeKind getKind()
  {
    return NodeKind.DECISION;
  }

  @Override
  public void visit(Model xiModel)
  {
    mNumVisits++;

    if (isTerminal())
    {
      return;
    }

    if (mExpansionState == ExpansionState.UNEXPANDED)
    {
      expand(xiModel);
      return;
    }

    int lSelected = select();

    //  Recurse
    mChildren[lSelected].visit(xiModel);

    backUp();
  }

  private void expand(Model xiModel)
  {
    if (mActions.length == 0)
    {
      throw contractViolation("expand", "non-terminal information set has no legal actions");
    }

    Evaluation lEvaluation = xiModel.evaluateActions(mInfoSet);
    validateEvaluation(lEvaluation, mActions.length, "expand");

    mPrior = lEvaluation.getDistribution();
    mInitialValue = lEvaluation.getValue();
    mInitialChildValues = new ValueInterval[mActions.length];
    mChildren = new SearchTreeNode[mActions.length];

    for (int lii = 0; lii < mActions.length; lii++)
    {
      ValueInterval lSeed = lEvaluation.getChildValue(lii);
      if (lSeed == null)
      {
        throw contractViolation("expand", "no child value for action " + mActions[lii]);
      }
      checkNumPlayers(lSeed, mInitialValue.getNumPlayers(), "expand");
      mInitialChildValues[lii] = lSeed;

      InfoSet lChildInfoSet = mInfoSet.apply(mActions[lii]);
      boolean lSampling = (lChildInfoSet.getGameOutcome() == null) &&
                          (lChildInfoSet.getCurrentPlayer() != mChoosingPlayer) &&
                          lChildInfoSet.hasHiddenInfo();
      mChildren[lii] = createChild(lChildInfoSet, lSampling, lSeed);
    }

    mQ = mInitialValue;
    mExpansionState = ExpansionState.EXPANDED;

    LOGGER.debug("Expanded " + this + " with prior " + Arrays.toString(mPrior) + " and value " + mQ);
  }

  /**
   * Compute the optimistic and pessimistic PUCT score of every child, for the acting player.
   *
   * @return scores indexed by [child][bound].
   */
  private double[][] computeScores()
  {
    int lTotalVisits = 0;
    for (SearchTreeNode lChild : mChildren)
    {
      lTotalVisits += lChild.mNumVisits;
    }

    double lExplorationNumerator = mTree.getParameters().getExplorationConstant() * Math.sqrt(lTotalVisits);
    double[][] lScores = new double[mChildren.length][2];

    for (int lii = 0; lii < mChildren.length; lii++)
    {
      SearchTreeNode lChild = mChildren[lii];
      double lExploration = lExplorationNumerator * mPrior[lii] / (lChild.mNumVisits + 1);

      lScores[lii][ValueInterval.LOWER] = lChild.mQ.getLower(mChoosingPlayer) + lExploration;
      lScores[lii][ValueInterval.UPPER] = lChild.mQ.getUpper(mChoosingPlayer) + lExploration;
    }

    return lScores;
  }

  /**
   * Compute the candidate set: every child whose optimistic score reaches the best pessimistic score.
   *
   * @return the indices of the candidates, in action order.  Never empty.
   */
  int[] computeCandidates()
  {
    assert(isExpanded());
    double[][] lScores = computeScores();

    int lBestLowerIndex = 0;
    for (int lii = 1; lii < lScores.length; lii++)
    {
      if (lScores[lii][ValueInterval.LOWER] > lScores[lBestLowerIndex][ValueInterval.LOWER])
      {
        lBestLowerIndex = lii;
      }
    }
    double lBestLower = lScores[lBestLowerIndex][ValueInterval.LOWER];

    int[] lCandidates = new int[lScores.length];
    int lNumCandidates = 0;
    for (int lii = 0; lii < lScores.length; lii++)
    {
      if (lScores[lii][ValueInterval.UPPER] >= lBestLower)
      {
        lCandidates[lNumCandidates++] = lii;
      }
    }

    assert(lNumCandidates > 0);
    return Arrays.copyOf(lCandidates, lNumCandidates);
  }

  /**
   * Restrict this node's prior to the candidate set and renormalize.
   *
   * @param xiCandidates - the candidate indices.
   */
  double[] getMixingDistribution(int[] xiCandidates)
  {
    double[] lDistribution = new double[mPrior.length];
    double lMass = 0;
    for (int lIndex : xiCandidates)
    {
      lDistribution[lIndex] = mPrior[lIndex];
      lMass += mPrior[lIndex];
    }

    if (!(lMass > 0))
    {
      throw contractViolation("select", "prior has no mass over candidate actions " +
                                        Arrays.toString(candidateActions(xiCandidates)));
    }

    for (int lii = 0; lii < lDistribution.length; lii++)
    {
      lDistribution[lii] /= lMass;
    }
    return lDistribution;
  }

  private int select()
  {
    int[] lCandidates = computeCandidates();
    int lSelected;

    if (lCandidates.length == 1)
    {
      lSelected = lCandidates[0];
      mPure.addPureSample(lSelected);
      if (LOGGER.isTraceEnabled())
      {
        LOGGER.trace("Pure selection of action " + mActions[lSelected]);
      }
    }
    else
    {
      double[] lMixing = getMixingDistribution(lCandidates);
      lSelected = Distributions.sample(lMixing, mTree.getRandom());
      mMixed.addSample(lMixing);
      if (LOGGER.isTraceEnabled())
      {
        LOGGER.trace("Mixed selection of action " + mActions[lSelected] + " from " +
                     Arrays.toString(candidateActions(lCandidates)));
      }
    }

    return lSelected;
  }

  private void backUp()
  {
    ValueInterval[] lChildQ = new ValueInterval[mChildren.length];
    for (int lii = 0; lii < mChildren.length; lii++)
    {
      lChildQ[lii] = mChildren[lii].mQ;
    }

    int lNumPure = mPure.getNumSamples();
    int lNumMixed = mMixed.getNumSamples();
    int lTotal = lNumPure + lNumMixed;
    assert(lTotal == mNumVisits - 1);

    //  Weight each running distribution by its share of the selection history
    double[] lWeights = new double[mChildren.length];
    for (int lii = 0; lii < lWeights.length; lii++)
    {
      lWeights[lii] = (lNumMixed * mMixed.getProbability(lii) + lNumPure * mPure.getProbability(lii)) / lTotal;
    }

    mQ = ValueInterval.weightedSum(lChildQ, lWeights);
  }

  private int[] candidateActions(int[] xiCandidates)
  {
    int[] lActions = new int[xiCandidates.length];
    for (int lii = 0; lii < xiCandidates.length; lii++)
    {
      lActions[lii] = mActions[xiCandidates[lii]];
    }
    return lActions;
  }

  /**
   * @return the legal actions, in child order.
   */
  public int[] getActions()
  {
    return mActions.clone();
  }

  /**
   * @return the child reached by the specified action, or null if this node has not been expanded.
   */
  public SearchTreeNode getChild(int xiAction)
  {
    int lIndex = mActionIndex.get(xiAction);
    if (lIndex < 0)
    {
      throw new IllegalArgumentException("Action " + xiAction + " is not legal in " + this);
    }
    return (mChildren == null) ? null : mChildren[lIndex];
  }

  /**
   * @return the child at the specified position in action order, or null if this node has not been expanded.
   */
  public SearchTreeNode getChildAt(int xiIndex)
  {
    return (mChildren == null) ? null : mChildren[xiIndex];
  }

  public int getNumChildren()
  {
    return mActions.length;
  }

  /**
   * @return a copy of the prior, or null if this node has not been expanded.
   */
  public double[] getPrior()
  {
    return (mPrior == null) ? null : mPrior.clone();
  }

  /**
   * @return the value reported by the model on expansion, or null if this node has not been expanded.
   */
  public ValueInterval getInitialValue()
  {
    return mInitialValue;
  }

  /**
   * @return the seed value given to the child at the specified position, or null if not expanded.
   */
  public ValueInterval getInitialChildValue(int xiIndex)
  {
    return (mInitialChildValues == null) ? null : mInitialChildValues[xiIndex];
  }

  /**
   * @return the running average of pure-case selections.
   */
  public double[] getPureDistribution()
  {
    return mPure.toArray();
  }

  /**
   * @return the running average of mixed-case selection distributions.
   */
  public double[] getMixedDistribution()
  {
    return mMixed.toArray();
  }

  public int getNumPureSelections()
  {
    return mPure.getNumSamples();
  }

  public int getNumMixedSelections()
  {
    return mMixed.getNumSamples();
  }
}
