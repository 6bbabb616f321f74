package org.ggp.ismcts.infoset;

/**
 * A game state as perceived by the player to act, abstracting away information hidden from them.
 *
 * Implementations are immutable.  The search never modifies an information set - every transition returns a new
 * instance.
 */
public interface InfoSet
{
  /**
   * @return whether this information set still carries hidden information that has not been instantiated.
   */
  public boolean hasHiddenInfo();

  /**
   * @return the index of the player to act.
   */
  public int getCurrentPlayer();

  /**
   * @return the outcome of the game, one value per player, or null if the game has not ended.
   */
  public double[] getGameOutcome();

  /**
   * @return the legal actions, in a fixed order.  Evaluations of this information set are indexed by position in this
   *         array.
   */
  public int[] getActions();

  /**
   * @return the legality mask over hidden values, indexed by hidden value.
   */
  public boolean[] getHiddenValueMask();

  /**
   * Apply a public action.
   *
   * @param xiAction - the action, one of {@link #getActions()}.
   *
   * @return the resulting information set.
   */
  public InfoSet apply(int xiAction);

  /**
   * Resolve the hidden information to a concrete value.
   *
   * @param xiHiddenValue - the hidden value, legal according to {@link #getHiddenValueMask()}.
   *
   * @return the resulting information set.
   */
  public InfoSet instantiateHiddenState(int xiHiddenValue);
}
