/**
 *
 */
package org.theseed.sexdiff.stats;

/**
 * This enumeration describes the differential-expression classification of a gene.
 *
 * @author Bruce Parrello
 *
 */
public enum DiffLabel {
    /** significantly higher in males */
    MALE("Male"),
    /** significantly higher in females */
    FEMALE("Female"),
    /** not significant */
    NO("NO");

    /** label used in the output */
    private final String label;

    private DiffLabel(String label) {
        this.label = label;
    }

    /**
     * @return the output label
     */
    public String getLabel() {
        return this.label;
    }

    @Override
    public String toString() {
        return this.label;
    }

}
