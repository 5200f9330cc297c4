/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This enumeration describes the age strata.  Each stratum is analyzed independently.
 *
 * @author Bruce Parrello
 *
 */
public enum AgeStratum {
    YOUNG("young") {
        @Override
        public boolean contains(double age, double threshold) {
            return age <= threshold;
        }

        @Override
        public String describe(double threshold) {
            return String.format("age <= %s", formatAge(threshold));
        }
    }, OLDER("older") {
        @Override
        public boolean contains(double age, double threshold) {
            return age > threshold;
        }

        @Override
        public String describe(double threshold) {
            return String.format("age > %s", formatAge(threshold));
        }
    };

    /** label used in output file names */
    private final String label;

    private AgeStratum(String label) {
        this.label = label;
    }

    /**
     * @return TRUE if the specified age belongs in this stratum
     *
     * @param age			age to check
     * @param threshold		age threshold separating the strata
     */
    public abstract boolean contains(double age, double threshold);

    /**
     * @return a description of this stratum for log messages
     *
     * @param threshold		age threshold separating the strata
     */
    public abstract String describe(double threshold);

    /**
     * @return the file-name label for this stratum
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return an age formatted without a useless fraction
     *
     * @param age	age to format
     */
    private static String formatAge(double age) {
        String retVal;
        if (age == Math.rint(age))
            retVal = String.format("%d", (long) age);
        else
            retVal = Double.toString(age);
        return retVal;
    }

}
