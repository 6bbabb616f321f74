package org.ggp.ismcts.search;

import java.util.Random;

/**
 * Helpers for discrete probability distributions held as arrays.
 */
final class Distributions
{
  private Distributions()
  {
  }

  static double sum(double[] xiValues)
  {
    double lSum = 0;
    for (double lValue : xiValues)
    {
      lSum += lValue;
    }
    return lSum;
  }

  /**
   * Draw an index from a distribution.
   *
   * @param xiDistribution - non-negative weights summing to 1.
   * @param xiRandom       - random source.
   *
   * @return an index with positive probability.
   */
  static int sample(double[] xiDistribution, Random xiRandom)
  {
    double lTarget = xiRandom.nextDouble();
    double lCumulative = 0;
    int lLastPositive = -1;

    for (int lii = 0; lii < xiDistribution.length; lii++)
    {
      if (xiDistribution[lii] > 0)
      {
        lCumulative += xiDistribution[lii];
        lLastPositive = lii;
        if (lTarget < lCumulative)
        {
          return lii;
        }
      }
    }

    //  Rounding can leave the cumulative total fractionally below 1
    assert(lLastPositive >= 0);
    return lLastPositive;
  }
}
