package org.ggp.ismcts.util.cfg;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 */
public class MachineSpecificConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Exploration constant in the interval PUCT formula.
     */
    EXPLORATION_CONSTANT(1.0),

    /**
     * Probability mass an adversary may move when computing belief robustness bounds.
     */
    PHI_EPSILON(0.05),

    /**
     * Belief mass below which a masked belief is replaced by the uniform distribution over legal hidden values.
     */
    BELIEF_MASS_THRESHOLD(1e-6),

    /**
     * Whether to compute belief robustness bounds when visiting sampling nodes.
     */
    COMPUTE_PHI(true),

    /**
     * Seed for the search's random source.  Negative for a time-based seed.
     */
    RANDOM_SEED(-1);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(double xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      try (InputStream lPropStream = new FileInputStream("data/cfg/" + lComputerName + ".properties"))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration for " + lComputerName + " - using defaults");
      }
    }
    else
    {
      LOGGER.debug("Failed to identify computer name - no environment variable COMPUTERNAME or HOSTNAME");
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
    {
      // Get the key.
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for reverting an override.
   *
   * @param xiKey - the property to revert to its default.
   */
  public static void utClearCfgVal(CfgItem xiKey)
  {
    MACHINE_PROPERTIES.remove(xiKey.toString());
  }
}
