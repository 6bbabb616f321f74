package org.ggp.ismcts.model;

import org.ggp.ismcts.infoset.InfoSet;

/**
 * A learned evaluator, producing distributions and value estimates for information sets.
 *
 * Both operations are pure functions of the information set.  The search calls each at most once per tree node and
 * caches the result on the node.
 */
public interface Model
{
  /**
   * Evaluate the choice of public action.
   *
   * @param xiInfoSet - the information set, in which the current player chooses an action.
   *
   * @return the prior over actions, the value of the information set and one seed value per action.  The prior and the
   *         child values are indexed by position in {@link InfoSet#getActions()}.
   */
  public Evaluation evaluateActions(InfoSet xiInfoSet);

  /**
   * Evaluate the resolution of hidden information.
   *
   * @param xiInfoSet - the information set with undetermined hidden information.
   *
   * @return the belief over hidden values, the value of the information set and one seed value per hidden value.  The
   *         belief and the child values are indexed by hidden value.
   */
  public Evaluation evaluateHidden(InfoSet xiInfoSet);
}
