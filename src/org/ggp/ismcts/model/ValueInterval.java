package org.ggp.ismcts.model;

import java.util.Arrays;

/**
 * A confidence interval on the game outcome, for each player.
 *
 * The true value lies between the lower and upper bound under all resolutions of the remaining uncertainty.  Instances
 * are immutable and always satisfy lower <= upper for every player.
 */
public final class ValueInterval
{
  /**
   * Bound indices, for use with {@link #getBound(int, int)}.
   */
  public static final int LOWER = 0;
  public static final int UPPER = 1;

  private final double[] mLower;
  private final double[] mUpper;

  private ValueInterval(double[] xiLower, double[] xiUpper)
  {
    mLower = xiLower;
    mUpper = xiUpper;
  }

  /**
   * Create an interval from explicit bounds.
   *
   * @param xiLower - the lower bound for each player.
   * @param xiUpper - the upper bound for each player.
   *
   * @return the interval.
   *
   * @throws IllegalArgumentException if the bounds have different lengths or any lower bound exceeds its upper bound.
   */
  public static ValueInterval of(double[] xiLower, double[] xiUpper)
  {
    if (xiLower.length != xiUpper.length)
    {
      throw new IllegalArgumentException("Bounds cover " + xiLower.length + " and " + xiUpper.length + " players");
    }

    for (int lii = 0; lii < xiLower.length; lii++)
    {
      // Written so that NaN bounds are rejected too.
      if (!(xiLower[lii] <= xiUpper[lii]))
      {
        throw new IllegalArgumentException("Interval for player " + lii + " has lower bound " + xiLower[lii] +
                                           " above upper bound " + xiUpper[lii]);
      }
    }

    return new ValueInterval(xiLower.clone(), xiUpper.clone());
  }

  /**
   * Promote a scalar value per player to a degenerate interval.
   *
   * @param xiValues - the value for each player.
   */
  public static ValueInterval fromValues(double... xiValues)
  {
    return of(xiValues, xiValues);
  }

  /**
   * @return the interval [0, 0] for each of the specified number of players.
   */
  public static ValueInterval zero(int xiNumPlayers)
  {
    return new ValueInterval(new double[xiNumPlayers], new double[xiNumPlayers]);
  }

  /**
   * Compute the per-player weighted sum of intervals.  Weights must be non-negative, which keeps the bounds ordered.
   *
   * @param xiIntervals - the intervals, all covering the same number of players.
   * @param xiWeights   - one weight per interval.
   */
  public static ValueInterval weightedSum(ValueInterval[] xiIntervals, double[] xiWeights)
  {
    assert(xiIntervals.length == xiWeights.length);
    assert(xiIntervals.length > 0);

    int lNumPlayers = xiIntervals[0].getNumPlayers();
    double[] lLower = new double[lNumPlayers];
    double[] lUpper = new double[lNumPlayers];

    for (int lii = 0; lii < xiIntervals.length; lii++)
    {
      double lWeight = xiWeights[lii];
      assert(lWeight >= 0);
      if (lWeight == 0)
      {
        continue;
      }

      ValueInterval lInterval = xiIntervals[lii];
      for (int lPlayer = 0; lPlayer < lNumPlayers; lPlayer++)
      {
        lLower[lPlayer] += lWeight * lInterval.mLower[lPlayer];
        lUpper[lPlayer] += lWeight * lInterval.mUpper[lPlayer];
      }
    }

    return of(lLower, lUpper);
  }

  /**
   * @return the number of players covered.
   */
  public int getNumPlayers()
  {
    return mLower.length;
  }

  /**
   * @return the lower bound for the specified player.
   */
  public double getLower(int xiPlayer)
  {
    return mLower[xiPlayer];
  }

  /**
   * @return the upper bound for the specified player.
   */
  public double getUpper(int xiPlayer)
  {
    return mUpper[xiPlayer];
  }

  /**
   * @param xiPlayer - the player.
   * @param xiBound  - {@link #LOWER} or {@link #UPPER}.
   *
   * @return the requested bound.
   */
  public double getBound(int xiPlayer, int xiBound)
  {
    return (xiBound == LOWER) ? mLower[xiPlayer] : mUpper[xiPlayer];
  }

  /**
   * @return whether the lower and upper bound coincide for every player.
   */
  public boolean isDegenerate()
  {
    return Arrays.equals(mLower, mUpper);
  }

  /**
   * @return whether this interval contains the other one, for every player.
   */
  public boolean contains(ValueInterval xiOther)
  {
    for (int lii = 0; lii < mLower.length; lii++)
    {
      if (xiOther.mLower[lii] < mLower[lii] || xiOther.mUpper[lii] > mUpper[lii])
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof ValueInterval))
    {
      return false;
    }
    ValueInterval lOther = (ValueInterval)xiOther;
    return Arrays.equals(mLower, lOther.mLower) && Arrays.equals(mUpper, lOther.mUpper);
  }

  @Override
  public int hashCode()
  {
    return 31 * Arrays.hashCode(mLower) + Arrays.hashCode(mUpper);
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder("{");
    for (int lii = 0; lii < mLower.length; lii++)
    {
      if (lii > 0)
      {
        lBuilder.append(", ");
      }
      lBuilder.append('[').append(mLower[lii]).append(", ").append(mUpper[lii]).append(']');
    }
    return lBuilder.append('}').toString();
  }
}
