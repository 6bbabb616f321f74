package org.ggp.ismcts.search;

import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.ismcts.infoset.InfoSet;
import org.ggp.ismcts.model.Evaluation;
import org.ggp.ismcts.model.Model;
import org.ggp.ismcts.model.ValueInterval;

/**
 * A node representing an information set with undetermined hidden information.
 *
 * On expansion the model's belief is restricted to the legal hidden values and a child is created for each of them.
 * Every visit then draws a hidden value from the belief and continues the simulation in the corresponding child.
 */
public class SamplingNode extends SearchTreeNode
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final boolean[] mHiddenValueMask;
  private final int mNumLegalValues;
  private final TIntObjectHashMap<SearchTreeNode> mChildren = new TIntObjectHashMap<>();

  private double[] mBelief = null;
  private ValueInterval mInitialValue = null;
  private ValueInterval[] mChildQ = null;
  private ValueInterval mLastRobustnessBound = null;
  private int mLastSampledValue = -1;

  SamplingNode(SearchTree xiTree, InfoSet xiInfoSet, ValueInterval xiInitialQ)
  {
    super(xiTree, xiInfoSet, xiInitialQ);

    mHiddenValueMask = xiInfoSet.getHiddenValueMask().clone();

    int lNumLegal = 0;
    for (boolean lLegal : mHiddenValueMask)
    {
      if (lLegal)
      {
        lNumLegal++;
      }
    }

    if (lNumLegal == 0)
    {
      throw contractViolation("create", "hidden value mask has no legal values");
    }
    mNumLegalValues = lNumLegal;
  }

  @Override
  public NodeKind getKind()
  {
    return NodeKind.SAMPLING;
  }

  @Override
  public void visit(Model xiModel)
  {
    mNumVisits++;

    if (mExpansionState == ExpansionState.UNEXPANDED)
    {
      expand(xiModel);
    }

    int lHiddenValue = Distributions.sample(mBelief, mTree.getRandom());
    mLastSampledValue = lHiddenValue;

    SearchParameters lParameters = mTree.getParameters();
    if (lParameters.isComputePhi())
    {
      refreshChildQ();
      mLastRobustnessBound = BeliefRobustness.phi(lHiddenValue, lParameters.getPhiEpsilon(), mChildQ, mBelief);
    }

    mChildren.get(lHiddenValue).visit(xiModel);
  }

  private void expand(Model xiModel)
  {
    Evaluation lEvaluation = xiModel.evaluateHidden(mInfoSet);
    validateEvaluation(lEvaluation, mHiddenValueMask.length, "expand");

    mBelief = lEvaluation.getDistribution();
    applyHiddenValueMask();

    mChildQ = new ValueInterval[mHiddenValueMask.length];
    for (int lHiddenValue = 0; lHiddenValue < mHiddenValueMask.length; lHiddenValue++)
    {
      if (!mHiddenValueMask[lHiddenValue])
      {
        continue;
      }

      ValueInterval lSeed = lEvaluation.getChildValue(lHiddenValue);
      if (lSeed == null)
      {
        throw contractViolation("expand", "no child value for hidden value " + lHiddenValue);
      }
      checkNumPlayers(lSeed, lEvaluation.getValue().getNumPlayers(), "expand");

      InfoSet lChildInfoSet = mInfoSet.instantiateHiddenState(lHiddenValue);
      boolean lSampling = (lChildInfoSet.getGameOutcome() == null) && lChildInfoSet.hasHiddenInfo();
      if (lSampling && lChildInfoSet.getCurrentPlayer() != mChoosingPlayer)
      {
        throw contractViolation("expand", "hidden value " + lHiddenValue + " hands the move to player " +
                                          lChildInfoSet.getCurrentPlayer() + " with hidden information unresolved");
      }

      SearchTreeNode lChild = createChild(lChildInfoSet, lSampling, lSeed);
      mChildren.put(lHiddenValue, lChild);
      mChildQ[lHiddenValue] = lChild.mQ;
    }

    mInitialValue = lEvaluation.getValue();
    mQ = mInitialValue;
    mExpansionState = ExpansionState.EXPANDED;

    LOGGER.debug("Expanded " + this + " with belief " + Arrays.toString(mBelief));
  }

  /**
   * Restrict the belief to legal hidden values and renormalize, falling back to the uniform distribution over legal
   * values unless more than the threshold mass remains.  No mass at all always falls back.
   */
  private void applyHiddenValueMask()
  {
    double lMass = 0;
    for (int lii = 0; lii < mBelief.length; lii++)
    {
      if (!mHiddenValueMask[lii])
      {
        mBelief[lii] = 0;
      }
      lMass += mBelief[lii];
    }

    if (!(lMass > mTree.getParameters().getBeliefMassThreshold()))
    {
      LOGGER.debug("Belief mass " + lMass + " after masking at " + this + " - using uniform belief");
      for (int lii = 0; lii < mBelief.length; lii++)
      {
        mBelief[lii] = mHiddenValueMask[lii] ? 1.0 / mNumLegalValues : 0;
      }
    }
    else
    {
      for (int lii = 0; lii < mBelief.length; lii++)
      {
        mBelief[lii] /= lMass;
      }
    }
  }

  private void refreshChildQ()
  {
    for (int lHiddenValue = 0; lHiddenValue < mChildQ.length; lHiddenValue++)
    {
      if (mHiddenValueMask[lHiddenValue])
      {
        mChildQ[lHiddenValue] = mChildren.get(lHiddenValue).mQ;
      }
    }
  }

  /**
   * @return the child for the specified hidden value, or null if there is none (not expanded, or illegal value).
   */
  public SearchTreeNode getChild(int xiHiddenValue)
  {
    return mChildren.get(xiHiddenValue);
  }

  /**
   * @return the number of legal hidden values (and therefore children once expanded).
   */
  public int getNumLegalValues()
  {
    return mNumLegalValues;
  }

  /**
   * @return a copy of the legality mask over hidden values.
   */
  public boolean[] getHiddenValueMask()
  {
    return mHiddenValueMask.clone();
  }

  /**
   * @return a copy of the masked belief, or null if this node has not been expanded.
   */
  public double[] getBelief()
  {
    return (mBelief == null) ? null : mBelief.clone();
  }

  /**
   * @return the value reported by the model on expansion, or null if this node has not been expanded.
   */
  public ValueInterval getInitialValue()
  {
    return mInitialValue;
  }

  /**
   * @return the children's value intervals as last collected, indexed by hidden value (null for illegal values), or
   *         null if this node has not been expanded.
   */
  public ValueInterval[] getChildQ()
  {
    return (mChildQ == null) ? null : mChildQ.clone();
  }

  /**
   * @return the robustness bound computed on the most recent visit, or null if none has been computed.
   */
  public ValueInterval getLastRobustnessBound()
  {
    return mLastRobustnessBound;
  }

  /**
   * @return the hidden value drawn on the most recent visit, or -1 before the first visit.
   */
  public int getLastSampledValue()
  {
    return mLastSampledValue;
  }
}
