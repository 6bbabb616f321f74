package org.ggp.ismcts.util.cfg;

import org.ggp.ismcts.search.SearchParameters;
import org.ggp.ismcts.util.cfg.MachineSpecificConfiguration.CfgItem;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class MachineSpecificConfigurationTest extends Assert
{
  @After
  public void tearDown()
  {
    for (CfgItem lItem : CfgItem.values())
    {
      MachineSpecificConfiguration.utClearCfgVal(lItem);
    }
  }

  @Test
  public void testDefaults()
  {
    assertEquals(1.0, MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORATION_CONSTANT), 0);
    assertEquals(0.05, MachineSpecificConfiguration.getCfgDouble(CfgItem.PHI_EPSILON), 0);
    assertEquals(1e-6, MachineSpecificConfiguration.getCfgDouble(CfgItem.BELIEF_MASS_THRESHOLD), 0);
    assertTrue(MachineSpecificConfiguration.getCfgBool(CfgItem.COMPUTE_PHI));
    assertEquals(-1, MachineSpecificConfiguration.getCfgInt(CfgItem.RANDOM_SEED));
  }

  @Test
  public void testOverrideReachesParameters()
  {
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.EXPLORATION_CONSTANT, "2.5");
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.PHI_EPSILON, " 0.1 ");
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.COMPUTE_PHI, "false");

    SearchParameters lParameters = SearchParameters.fromConfiguration();

    assertEquals(2.5, lParameters.getExplorationConstant(), 0);
    assertEquals(0.1, lParameters.getPhiEpsilon(), 0);
    assertEquals(1e-6, lParameters.getBeliefMassThreshold(), 0);
    assertFalse(lParameters.isComputePhi());

    MachineSpecificConfiguration.logConfig();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeExplorationRejected()
  {
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.EXPLORATION_CONSTANT, "-1");
    SearchParameters.fromConfiguration();
  }
}
