/**
 *
 */
package org.theseed.sexdiff.utils;

/**
 * This exception is thrown when a command-line parameter is invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -4318237845120294472L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
