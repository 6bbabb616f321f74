package org.ggp.ismcts.search;

import java.util.HashMap;
import java.util.Map;

import org.ggp.ismcts.infoset.InfoSet;
import org.ggp.ismcts.model.Evaluation;
import org.ggp.ismcts.model.Model;
import org.ggp.ismcts.model.ValueInterval;

/**
 * Model returning fixed evaluations keyed by the label of a {@link ScriptedInfoSet}, and counting its calls.
 */
public class ScriptedModel implements Model
{
  private final Map<String, Evaluation> mActionEvaluations = new HashMap<>();
  private final Map<String, Evaluation> mHiddenEvaluations = new HashMap<>();
  private final Map<String, Integer> mCalls = new HashMap<>();

  /**
   * @return an interval for two players.
   */
  public static ValueInterval iv(double xiLower0, double xiUpper0, double xiLower1, double xiUpper1)
  {
    return ValueInterval.of(new double[] {xiLower0, xiLower1}, new double[] {xiUpper0, xiUpper1});
  }

  public ScriptedModel actions(String xiLabel, Evaluation xiEvaluation)
  {
    mActionEvaluations.put(xiLabel, xiEvaluation);
    return this;
  }

  public ScriptedModel hidden(String xiLabel, Evaluation xiEvaluation)
  {
    mHiddenEvaluations.put(xiLabel, xiEvaluation);
    return this;
  }

  /**
   * Script an endless information set to evaluate to the same interval as its seed, so that its value never changes.
   */
  public ScriptedModel constant(String xiLabel, ValueInterval xiValue)
  {
    return actions(xiLabel, new Evaluation(new double[] {1.0}, xiValue, new ValueInterval[] {xiValue}));
  }

  /**
   * @return the number of evaluations (of either sort) requested for the label.
   */
  public int getCalls(String xiLabel)
  {
    Integer lCalls = mCalls.get(xiLabel);
    return (lCalls == null) ? 0 : lCalls;
  }

  @Override
  public Evaluation evaluateActions(InfoSet xiInfoSet)
  {
    return lookUp(mActionEvaluations, xiInfoSet);
  }

  @Override
  public Evaluation evaluateHidden(InfoSet xiInfoSet)
  {
    return lookUp(mHiddenEvaluations, xiInfoSet);
  }

  private Evaluation lookUp(Map<String, Evaluation> xiEvaluations, InfoSet xiInfoSet)
  {
    String lLabel = ((ScriptedInfoSet)xiInfoSet).getLabel();
    mCalls.put(lLabel, getCalls(lLabel) + 1);

    Evaluation lEvaluation = xiEvaluations.get(lLabel);
    if (lEvaluation == null)
    {
      throw new AssertionError("Unexpected evaluation of " + lLabel);
    }
    return lEvaluation;
  }
}
