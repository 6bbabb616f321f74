package org.ggp.ismcts.search;

import static com.google.common.base.Preconditions.checkArgument;

import org.ggp.ismcts.util.cfg.MachineSpecificConfiguration;
import org.ggp.ismcts.util.cfg.MachineSpecificConfiguration.CfgItem;

/**
 * Tunable constants of a search tree.
 */
public class SearchParameters
{
  private final double mExplorationConstant;
  private final double mPhiEpsilon;
  private final double mBeliefMassThreshold;
  private final boolean mComputePhi;

  /**
   * @param xiExplorationConstant - exploration constant C of the interval PUCT rule.
   * @param xiPhiEpsilon          - belief perturbation budget for robustness bounds.
   * @param xiBeliefMassThreshold - masked belief mass below which the belief falls back to uniform.
   * @param xiComputePhi          - whether sampling nodes compute robustness bounds on each visit.
   */
  public SearchParameters(double xiExplorationConstant,
                          double xiPhiEpsilon,
                          double xiBeliefMassThreshold,
                          boolean xiComputePhi)
  {
    checkArgument(xiExplorationConstant >= 0, "Negative exploration constant: %s", xiExplorationConstant);
    checkArgument(xiPhiEpsilon >= 0, "Negative perturbation budget: %s", xiPhiEpsilon);
    checkArgument(xiBeliefMassThreshold >= 0, "Negative belief mass threshold: %s", xiBeliefMassThreshold);

    mExplorationConstant = xiExplorationConstant;
    mPhiEpsilon = xiPhiEpsilon;
    mBeliefMassThreshold = xiBeliefMassThreshold;
    mComputePhi = xiComputePhi;
  }

  /**
   * @return parameters read from the machine-specific configuration.
   */
  public static SearchParameters fromConfiguration()
  {
    MachineSpecificConfiguration.logConfig();
    return new SearchParameters(MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORATION_CONSTANT),
                                MachineSpecificConfiguration.getCfgDouble(CfgItem.PHI_EPSILON),
                                MachineSpecificConfiguration.getCfgDouble(CfgItem.BELIEF_MASS_THRESHOLD),
                                MachineSpecificConfiguration.getCfgBool(CfgItem.COMPUTE_PHI));
  }

  public double getExplorationConstant()
  {
    return mExplorationConstant;
  }

  public double getPhiEpsilon()
  {
    return mPhiEpsilon;
  }

  public double getBeliefMassThreshold()
  {
    return mBeliefMassThreshold;
  }

  public boolean isComputePhi()
  {
    return mComputePhi;
  }

  @Override
  public String toString()
  {
    return "C = " + mExplorationConstant + ", eps = " + mPhiEpsilon + ", mass threshold = " + mBeliefMassThreshold +
           (mComputePhi ? "" : ", Phi disabled");
  }
}
