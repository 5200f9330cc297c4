/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This object describes the model design for a cohort:  an intercept plus an indicator for the male level of
 * the sex covariate.  FEMALE is the reference level.
 *
 * @author Bruce Parrello
 *
 */
public class Design {

    // FIELDS
    /** TRUE for each male sample, in column order */
    private final boolean[] male;
    /** number of male samples */
    private final int maleCount;
    /** number of coefficients in the model */
    public static final int NUM_COEFFS = 2;

    /**
     * Construct a design from an array of male indicators.
     *
     * @param male	array containing TRUE for each male sample
     */
    private Design(boolean[] male) {
        this.male = male;
        int count = 0;
        for (boolean flag : male) {
            if (flag) count++;
        }
        this.maleCount = count;
    }

    /**
     * Create the design for a cohort.
     *
     * @param cohort	cohort of interest
     *
     * @return the model design
     *
     * @throws EmptyCohortException	if the cohort does not contain both sexes or is too small to estimate dispersion
     */
    public static Design create(Cohort cohort) throws EmptyCohortException {
        SampleMetadata metadata = cohort.getMetadata();
        boolean[] male = new boolean[metadata.size()];
        for (int j = 0; j < male.length; j++)
            male[j] = (metadata.get(j).getSex() == Sex.MALE);
        return of(male, cohort.getName());
    }

    /**
     * Create a design from an array of male indicators.
     *
     * @param male		array containing TRUE for each male sample
     * @param name		name of the cohort, for error messages
     *
     * @return the model design
     *
     * @throws EmptyCohortException	if the array does not contain both sexes or leaves no residual degrees of freedom
     */
    public static Design of(boolean[] male, String name) throws EmptyCohortException {
        Design retVal = new Design(male.clone());
        if (retVal.maleCount == 0 || retVal.maleCount == male.length)
            throw new EmptyCohortException("Cohort " + name + " contains only one sex:  the sex covariate cannot be tested.");
        if (retVal.getResidualDf() < 1)
            throw new EmptyCohortException("Cohort " + name + " has only " + male.length
                    + " samples:  no residual degrees of freedom remain for dispersion estimation.");
        return retVal;
    }

    /**
     * @return TRUE if the specified sample is male
     *
     * @param col	column index of the sample
     */
    public boolean isMale(int col) {
        return this.male[col];
    }

    /**
     * @return the level index (0 for female, 1 for male) of the specified sample
     *
     * @param col	column index of the sample
     */
    public int getLevel(int col) {
        return (this.male[col] ? 1 : 0);
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.male.length;
    }

    /**
     * @return the number of male samples
     */
    public int getMaleCount() {
        return this.maleCount;
    }

    /**
     * @return the number of female samples
     */
    public int getFemaleCount() {
        return this.male.length - this.maleCount;
    }

    /**
     * @return the residual degrees of freedom
     */
    public int getResidualDf() {
        return this.male.length - NUM_COEFFS;
    }

}
