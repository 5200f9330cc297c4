/**
 *
 */
package org.theseed.sexdiff.rna;

/**
 * This object tracks the model fit for a single gene.  The fit starts in the FITTING state and moves exactly once
 * to one of the terminal states.  Only a CONVERGED fit has valid statistics; the others report NaN.
 *
 * @author Bruce Parrello
 *
 */
public class GeneFit {

    // FIELDS
    /** ID of the gene */
    private final String geneId;
    /** mean normalized count */
    private final double baseMean;
    /** current state */
    private Status status;
    /** number of IRLS iterations performed */
    private int iterations;
    /** log2 fold change of male versus female */
    private double log2FoldChange;
    /** standard error of the log2 fold change */
    private double lfcSE;
    /** Wald statistic */
    private double stat;
    /** two-sided p-value */
    private double pvalue;
    /** explanation for a non-tested gene */
    private String reason;

    /**
     * Enumeration of the fit states.
     */
    public static enum Status {
        /** fit in progress */
        FITTING,
        /** fit converged and statistics are valid */
        CONVERGED,
        /** fit did not converge; statistics are NA */
        NON_CONVERGED,
        /** gene was not tested; statistics are NA */
        EXCLUDED;
    }

    /**
     * Start the fit for a gene.
     *
     * @param geneId		ID of the gene
     * @param baseMean		mean normalized count
     */
    public GeneFit(String geneId, double baseMean) {
        this.geneId = geneId;
        this.baseMean = baseMean;
        this.status = Status.FITTING;
        this.iterations = 0;
        this.log2FoldChange = Double.NaN;
        this.lfcSE = Double.NaN;
        this.stat = Double.NaN;
        this.pvalue = Double.NaN;
        this.reason = "";
    }

    /**
     * Insure the fit is still in progress.
     */
    private void checkFitting() {
        if (this.status != Status.FITTING)
            throw new IllegalStateException("Fit for gene " + this.geneId + " is already " + this.status + ".");
    }

    /**
     * Record an IRLS iteration.
     */
    public void iterate() {
        this.checkFitting();
        this.iterations++;
    }

    /**
     * Mark this gene as excluded from testing.
     *
     * @param reason	explanation for the exclusion
     */
    public void exclude(String reason) {
        this.checkFitting();
        this.status = Status.EXCLUDED;
        this.reason = reason;
    }

    /**
     * Mark this fit as failed.
     *
     * @param reason	explanation for the failure
     */
    public void fail(String reason) {
        this.checkFitting();
        this.status = Status.NON_CONVERGED;
        this.reason = reason;
    }

    /**
     * Mark this fit as converged and store the statistics.
     *
     * @param lfc		log2 fold change
     * @param se		standard error of the log2 fold change
     * @param stat		Wald statistic
     * @param pvalue	two-sided p-value
     */
    public void converge(double lfc, double se, double stat, double pvalue) {
        this.checkFitting();
        this.status = Status.CONVERGED;
        this.log2FoldChange = lfc;
        this.lfcSE = se;
        this.stat = stat;
        this.pvalue = pvalue;
    }

    /**
     * @return the gene ID
     */
    public String getGeneId() {
        return this.geneId;
    }

    /**
     * @return the mean normalized count
     */
    public double getBaseMean() {
        return this.baseMean;
    }

    /**
     * @return the fit state
     */
    public Status getStatus() {
        return this.status;
    }

    /**
     * @return the number of IRLS iterations performed
     */
    public int getIterations() {
        return this.iterations;
    }

    /**
     * @return the log2 fold change, or NaN if the gene was not tested
     */
    public double getLog2FoldChange() {
        return this.log2FoldChange;
    }

    /**
     * @return the standard error of the log2 fold change, or NaN if the gene was not tested
     */
    public double getLfcSE() {
        return this.lfcSE;
    }

    /**
     * @return the Wald statistic, or NaN if the gene was not tested
     */
    public double getStat() {
        return this.stat;
    }

    /**
     * @return the two-sided p-value, or NaN if the gene was not tested
     */
    public double getPvalue() {
        return this.pvalue;
    }

    /**
     * @return the reason the gene has no statistics, or an empty string if it converged
     */
    public String getReason() {
        return this.reason;
    }

}
