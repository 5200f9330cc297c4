/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This enumeration describes the two levels of the sex covariate.  FEMALE is the reference level, so a
 * positive fold change means higher expression in males.
 *
 * @author Bruce Parrello
 *
 */
public enum Sex {
    FEMALE("female"), MALE("male");

    /** name used in the metadata files */
    private final String label;

    private Sex(String label) {
        this.label = label;
    }

    /**
     * @return the sex level for a metadata string, or NULL if the string is not a recognized level
     *
     * @param value		string to parse (case-insensitive)
     */
    public static Sex parse(String value) {
        Sex retVal = null;
        if (value != null) {
            String normal = value.trim();
            for (Sex sex : Sex.values()) {
                if (sex.label.equalsIgnoreCase(normal))
                    retVal = sex;
            }
        }
        return retVal;
    }

    /**
     * @return the metadata label for this level
     */
    public String getLabel() {
        return this.label;
    }

}
