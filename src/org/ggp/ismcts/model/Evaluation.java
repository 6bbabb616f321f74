package org.ggp.ismcts.model;

/**
 * The result of evaluating an information set: a distribution over its children, a value for the information set
 * itself and a seed value for each child.
 */
public class Evaluation
{
  private final double[] mDistribution;
  private final ValueInterval mValue;
  private final ValueInterval[] mChildValues;

  /**
   * Create an evaluation with interval values.
   *
   * @param xiDistribution - prior (over actions) or belief (over hidden values).
   * @param xiValue        - value of the evaluated information set.
   * @param xiChildValues  - seed value per child, in the same order as the distribution.  Entries for children that
   *                         cannot exist (illegal hidden values) may be null.
   */
  public Evaluation(double[] xiDistribution, ValueInterval xiValue, ValueInterval[] xiChildValues)
  {
    mDistribution = xiDistribution.clone();
    mValue = xiValue;
    mChildValues = xiChildValues.clone();
  }

  /**
   * Create an evaluation with scalar values, each promoted to a degenerate interval.
   *
   * @param xiDistribution - prior (over actions) or belief (over hidden values).
   * @param xiValue        - value of the evaluated information set, per player.
   * @param xiChildValues  - seed value per child, per player.
   */
  public Evaluation(double[] xiDistribution, double[] xiValue, double[][] xiChildValues)
  {
    this(xiDistribution, ValueInterval.fromValues(xiValue), promote(xiChildValues));
  }

  private static ValueInterval[] promote(double[][] xiValues)
  {
    ValueInterval[] lResult = new ValueInterval[xiValues.length];
    for (int lii = 0; lii < xiValues.length; lii++)
    {
      if (xiValues[lii] != null)
      {
        lResult[lii] = ValueInterval.fromValues(xiValues[lii]);
      }
    }
    return lResult;
  }

  /**
   * @return a copy of the distribution.
   */
  public double[] getDistribution()
  {
    return mDistribution.clone();
  }

  /**
   * @return the number of children this evaluation covers.
   */
  public int size()
  {
    return mDistribution.length;
  }

  public ValueInterval getValue()
  {
    return mValue;
  }

  /**
   * @return the seed value for the specified child, or null if none was supplied.
   */
  public ValueInterval getChildValue(int xiIndex)
  {
    return mChildValues[xiIndex];
  }

  public int getNumChildValues()
  {
    return mChildValues.length;
  }
}
