/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This exception indicates a structural problem with a cohort that prevents the analysis of its stratum.
 * It is fatal for the stratum only.
 *
 * @author Bruce Parrello
 *
 */
public class CohortException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 2970342159468215717L;

    public CohortException(String message) {
        super(message);
    }

}
