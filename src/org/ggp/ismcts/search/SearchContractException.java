package org.ggp.ismcts.search;

/**
 * Thrown when a collaborator of the search (information set or model) breaks its contract.
 *
 * These failures indicate a bug in the collaborator, or an inconsistency between priors and values, and are never
 * retried.
 */
public class SearchContractException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final String mNodeDescription;
  private final String mOperation;

  /**
   * @param xiNodeDescription - description of the node that detected the violation.
   * @param xiOperation       - the operation being performed.
   * @param xiDetail          - what was wrong.
   */
  public SearchContractException(String xiNodeDescription, String xiOperation, String xiDetail)
  {
    super(xiOperation + " at " + xiNodeDescription + ": " + xiDetail);
    mNodeDescription = xiNodeDescription;
    mOperation = xiOperation;
  }

  /**
   * @return a description of the node that detected the violation.
   */
  public String getNodeDescription()
  {
    return mNodeDescription;
  }

  /**
   * @return the operation during which the violation was detected.
   */
  public String getOperation()
  {
    return mOperation;
  }
}
