/**
 *
 */
package org.theseed.sexdiff.rna;

/**
 * This exception is thrown when a dispersion trend cannot be fitted.
 *
 * @author Bruce Parrello
 *
 */
public class TrendFitException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 6421985314209733516L;

    public TrendFitException(String message) {
        super(message);
    }

}
