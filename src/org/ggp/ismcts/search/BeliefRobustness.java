package org.ggp.ismcts.search;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;
import java.util.Comparator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.ismcts.model.ValueInterval;

import com.google.common.primitives.Doubles;

/**
 * Bounds on the advantage of one hidden value being real, relative to the belief-weighted average, when an adversary
 * may perturb the belief and pick values within each hidden value's interval.
 *
 * For a sampled hidden value c this computes, per player, the interval
 *
 * <pre>
 *   Phi(H) = union over H' with ||H - H'||_1 <= 2 eps, over lower(Q) <= q <= upper(Q), of (q[c] - sum_i H'[i] q[i])
 * </pre>
 *
 * where H' ranges over distributions on the same support, so eps is the total probability mass moved between hidden
 * values (half the L1 distance).  The objective is linear in H' once q is
 * fixed at the appropriate end of each interval, so the extreme H' is found greedily: mass is taken from the hidden
 * values that help the objective least and given to those that help it most.
 */
public final class BeliefRobustness
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final double MASS_TOLERANCE = 1e-9;

  private BeliefRobustness()
  {
  }

  /**
   * Compute the robustness interval.
   *
   * @param xiRevealed - the hidden value c, sampled from the belief.
   * @param xiEpsilon  - probability mass the adversary may move.  Values above 1 are treated as 1.
   * @param xiChildQ   - value interval per hidden value.  Null entries mark hidden values that cannot be real; they
   *                     are given no mass.
   * @param xiBelief   - the belief H, a distribution over the non-null entries of xiChildQ.
   *
   * @return the lower and upper bound of Phi for each player.
   */
  public static ValueInterval phi(int xiRevealed, double xiEpsilon, ValueInterval[] xiChildQ, double[] xiBelief)
  {
    checkArgument(xiEpsilon >= 0, "Negative perturbation budget: %s", xiEpsilon);
    checkArgument(xiChildQ.length == xiBelief.length,
                  "%s value intervals for %s belief entries", xiChildQ.length, xiBelief.length);
    checkElementIndex(xiRevealed, xiBelief.length, "revealed hidden value");
    checkArgument(xiChildQ[xiRevealed] != null, "revealed hidden value %s has no value interval", xiRevealed);

    int[] lSupport = support(xiChildQ);
    int lNumPlayers = xiChildQ[xiRevealed].getNumPlayers();
    double lEpsilon = Math.min(xiEpsilon, 1);

    double[] lLower = new double[lNumPlayers];
    double[] lUpper = new double[lNumPlayers];

    for (int lPlayer = 0; lPlayer < lNumPlayers; lPlayer++)
    {
      double lMin = extreme(xiRevealed, lEpsilon, xiChildQ, xiBelief, lSupport, lPlayer, ValueInterval.LOWER);
      double lMax = extreme(xiRevealed, lEpsilon, xiChildQ, xiBelief, lSupport, lPlayer, ValueInterval.UPPER);

      assert(lMin <= lMax + MASS_TOLERANCE) : "Phi bounds crossed: " + lMin + " > " + lMax;

      //  Identical extremes computed along different paths can differ in the last place
      lLower[lPlayer] = Math.min(lMin, lMax);
      lUpper[lPlayer] = Math.max(lMin, lMax);
    }

    ValueInterval lResult = ValueInterval.of(lLower, lUpper);

    if (LOGGER.isTraceEnabled())
    {
      LOGGER.trace("Phi computation: c = " + xiRevealed + ", eps = " + xiEpsilon +
                   ", H = [" + Doubles.join(", ", xiBelief) + "], Q = " + Arrays.toString(xiChildQ) +
                   ", Phi = " + lResult);
    }

    return lResult;
  }

  /**
   * Compute one extreme of the objective for one player.
   *
   * @param xiBound - {@link ValueInterval#LOWER} to minimise, {@link ValueInterval#UPPER} to maximise.
   */
  private static double extreme(int xiRevealed,
                                double xiEpsilon,
                                ValueInterval[] xiChildQ,
                                double[] xiBelief,
                                int[] xiSupport,
                                int xiPlayer,
                                int xiBound)
  {
    //  The revealed value sits at the bound being computed, every other value at the opposite end of its interval
    final double[] lQ = new double[xiBelief.length];
    for (int lIndex : xiSupport)
    {
      lQ[lIndex] = xiChildQ[lIndex].getBound(xiPlayer, 1 - xiBound);
    }
    lQ[xiRevealed] = xiChildQ[xiRevealed].getBound(xiPlayer, xiBound);

    //  Order by value, highest first.  Moving mass onto high values lowers the objective.
    Integer[] lOrder = new Integer[xiSupport.length];
    for (int lii = 0; lii < xiSupport.length; lii++)
    {
      lOrder[lii] = xiSupport[lii];
    }
    Arrays.sort(lOrder, new Comparator<Integer>()
    {
      @Override
      public int compare(Integer xiA, Integer xiB)
      {
        return Double.compare(lQ[xiB], lQ[xiA]);
      }
    });

    double[] lPerturbed = xiBelief.clone();

    //  To minimise, drain the lowest values and fill the highest.  To maximise, the reverse.
    double lMoved;
    if (xiBound == ValueInterval.LOWER)
    {
      lMoved = drain(lPerturbed, lOrder, xiEpsilon, true);
      fill(lPerturbed, lOrder, lMoved, false);
    }
    else
    {
      lMoved = drain(lPerturbed, lOrder, xiEpsilon, false);
      fill(lPerturbed, lOrder, lMoved, true);
    }

    assert(Math.abs(Distributions.sum(lPerturbed) - 1) < MASS_TOLERANCE) : Arrays.toString(lPerturbed);

    double lResult = lQ[xiRevealed];
    for (int lIndex : xiSupport)
    {
      lResult -= lPerturbed[lIndex] * lQ[lIndex];
    }
    return lResult;
  }

  /**
   * Remove up to xiBudget of mass, walking the order from one end.
   *
   * @param xiFromLowest - whether to start at the lowest value (the end of the order).
   *
   * @return the mass actually removed.
   */
  private static double drain(double[] xiBelief, Integer[] xiOrder, double xiBudget, boolean xiFromLowest)
  {
    double lRemaining = xiBudget;
    for (int lii = 0; lii < xiOrder.length && lRemaining > 0; lii++)
    {
      int lIndex = xiOrder[xiFromLowest ? xiOrder.length - 1 - lii : lii];
      double lUsed = Math.min(lRemaining, xiBelief[lIndex]);
      xiBelief[lIndex] -= lUsed;
      lRemaining -= lUsed;
    }
    return xiBudget - lRemaining;
  }

  /**
   * Add exactly xiAmount of mass, walking the order from one end.  Each entry is capped at 1.
   *
   * @param xiFromLowest - whether to start at the lowest value (the end of the order).
   */
  private static void fill(double[] xiBelief, Integer[] xiOrder, double xiAmount, boolean xiFromLowest)
  {
    double lRemaining = xiAmount;
    for (int lii = 0; lii < xiOrder.length && lRemaining > 0; lii++)
    {
      int lIndex = xiOrder[xiFromLowest ? xiOrder.length - 1 - lii : lii];
      double lUsed = Math.min(lRemaining, 1 - xiBelief[lIndex]);
      xiBelief[lIndex] += lUsed;
      lRemaining -= lUsed;
    }

    //  Everything drained came from these entries, so there is always room to put it back
    assert(lRemaining < MASS_TOLERANCE);
  }

  private static int[] support(ValueInterval[] xiChildQ)
  {
    int[] lSupport = new int[xiChildQ.length];
    int lSize = 0;
    for (int lii = 0; lii < xiChildQ.length; lii++)
    {
      if (xiChildQ[lii] != null)
      {
        lSupport[lSize++] = lii;
      }
    }
    return Arrays.copyOf(lSupport, lSize);
  }
}
