/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This exception is thrown when a cohort filter yields no samples, or when the cohort contains only one
 * level of the sex covariate, making the comparison impossible.
 *
 * @author Bruce Parrello
 *
 */
public class EmptyCohortException extends CohortException {

    /** serialization version ID */
    private static final long serialVersionUID = -1153027961305877440L;

    public EmptyCohortException(String message) {
        super(message);
    }

}
