package org.ggp.ismcts.search;

/**
 * Running (unweighted) average of probability distributions over a node's children.
 */
public class StrategyAverage
{
  private final double[] mAverage;
  private int mNumSamples = 0;

  /**
   * @param xiSize - the number of children the distributions cover.
   */
  public StrategyAverage(int xiSize)
  {
    mAverage = new double[xiSize];
  }

  /**
   * Accrue a distribution into the average.
   *
   * @param xiDistribution - the distribution.
   */
  public void addSample(double[] xiDistribution)
  {
    assert(xiDistribution.length == mAverage.length);

    for (int lii = 0; lii < mAverage.length; lii++)
    {
      mAverage[lii] = (mAverage[lii] * mNumSamples + xiDistribution[lii]) / (mNumSamples + 1);
    }
    mNumSamples++;
  }

  /**
   * Accrue the distribution that selects a single child with certainty.
   *
   * @param xiIndex - the child selected.
   */
  public void addPureSample(int xiIndex)
  {
    for (int lii = 0; lii < mAverage.length; lii++)
    {
      mAverage[lii] = (mAverage[lii] * mNumSamples + (lii == xiIndex ? 1 : 0)) / (mNumSamples + 1);
    }
    mNumSamples++;
  }

  /**
   * @return the number of distributions accrued.
   */
  public int getNumSamples()
  {
    return mNumSamples;
  }

  /**
   * @return the average probability of the specified child.
   */
  public double getProbability(int xiIndex)
  {
    return mAverage[xiIndex];
  }

  /**
   * @return a copy of the average distribution.  All zero until a sample has been accrued.
   */
  public double[] toArray()
  {
    return mAverage.clone();
  }
}
