/**
 *
 */
package org.theseed.sexdiff.rna;

/**
 * This object contains the dispersion estimates for every gene in a count matrix.  For each gene, we keep the
 * mean and variance of the normalized counts, the gene-wise estimate, the trend value, and the final (shrunken)
 * estimate.  Genes excluded from testing have NaN estimates.
 *
 * @author Bruce Parrello
 *
 */
public class DispersionEstimate {

    // FIELDS
    /** mean normalized count for each gene */
    private final double[] baseMeans;
    /** variance of the normalized counts for each gene */
    private final double[] baseVars;
    /** gene-wise dispersion estimate */
    private final double[] geneWise;
    /** trend dispersion for each gene */
    private final double[] trendValues;
    /** final dispersion for each gene */
    private final double[] finals;
    /** TRUE for each gene whose gene-wise estimate was kept as an outlier */
    private final boolean[] outliers;
    /** TRUE for each gene whose MAP optimization failed */
    private final boolean[] mapFailures;
    /** fitted trend */
    private DispersionTrend trend;
    /** TRUE if the parametric trend failed and the constant fallback was used */
    private boolean trendFallback;
    /** prior variance of the log dispersion */
    private double priorVar;
    /** observed variance of the log dispersion residuals */
    private double logResidualVar;

    /**
     * Create an empty dispersion estimate.
     *
     * @param nGenes	number of genes to hold
     */
    public DispersionEstimate(int nGenes) {
        this.baseMeans = new double[nGenes];
        this.baseVars = new double[nGenes];
        this.geneWise = new double[nGenes];
        this.trendValues = new double[nGenes];
        this.finals = new double[nGenes];
        this.outliers = new boolean[nGenes];
        this.mapFailures = new boolean[nGenes];
        this.trendFallback = false;
        this.priorVar = Double.NaN;
        this.logResidualVar = Double.NaN;
    }

    /**
     * @return TRUE if the specified gene is excluded from testing (all-zero counts or zero variance)
     *
     * @param i		row index of the gene
     */
    public boolean isExcluded(int i) {
        return ! (this.baseMeans[i] > 0.0 && this.baseVars[i] > 0.0);
    }

    /**
     * @return the number of excluded genes
     */
    public int getExcludedCount() {
        int retVal = 0;
        for (int i = 0; i < this.baseMeans.length; i++) {
            if (this.isExcluded(i)) retVal++;
        }
        return retVal;
    }

    /**
     * @return the number of genes whose gene-wise estimate was kept as an outlier
     */
    public int getOutlierCount() {
        return countTrue(this.outliers);
    }

    /**
     * @return the number of genes whose MAP optimization failed
     */
    public int getMapFailureCount() {
        return countTrue(this.mapFailures);
    }

    /**
     * @return the number of TRUE values in a flag array
     *
     * @param flags		array to count
     */
    private static int countTrue(boolean[] flags) {
        int retVal = 0;
        for (boolean flag : flags) {
            if (flag) retVal++;
        }
        return retVal;
    }

    /**
     * @return the number of genes
     */
    public int size() {
        return this.finals.length;
    }

    /**
     * Store the normalized-count statistics for a gene.
     *
     * @param i			row index of the gene
     * @param mean		mean normalized count
     * @param var		variance of the normalized counts
     */
    protected void setBaseStats(int i, double mean, double var) {
        this.baseMeans[i] = mean;
        this.baseVars[i] = var;
    }

    /**
     * Store the gene-wise estimate for a gene.
     *
     * @param i			row index of the gene
     * @param disp		gene-wise dispersion estimate
     */
    protected void setGeneWise(int i, double disp) {
        this.geneWise[i] = disp;
    }

    /**
     * Store the final estimate for a gene.
     *
     * @param i				row index of the gene
     * @param trendValue	trend dispersion for the gene
     * @param disp			final dispersion
     * @param outlier		TRUE if the gene-wise value was kept because the gene is an outlier
     * @param mapFailure	TRUE if the MAP optimization failed
     */
    protected void setFinal(int i, double trendValue, double disp, boolean outlier, boolean mapFailure) {
        this.trendValues[i] = trendValue;
        this.finals[i] = disp;
        this.outliers[i] = outlier;
        this.mapFailures[i] = mapFailure;
    }

    /**
     * Store the trend information.
     *
     * @param trend				fitted trend
     * @param fallback			TRUE if the trend is the constant fallback
     */
    protected void setTrend(DispersionTrend trend, boolean fallback) {
        this.trend = trend;
        this.trendFallback = fallback;
    }

    /**
     * Store the prior information.
     *
     * @param logResidualVar	observed variance of the log residuals around the trend
     * @param priorVar			prior variance used for shrinkage
     */
    protected void setPrior(double logResidualVar, double priorVar) {
        this.logResidualVar = logResidualVar;
        this.priorVar = priorVar;
    }

    /**
     * @return the mean normalized count for a gene
     *
     * @param i		row index of the gene
     */
    public double getBaseMean(int i) {
        return this.baseMeans[i];
    }

    /**
     * @return the variance of the normalized counts for a gene
     *
     * @param i		row index of the gene
     */
    public double getBaseVar(int i) {
        return this.baseVars[i];
    }

    /**
     * @return the gene-wise dispersion estimate for a gene
     *
     * @param i		row index of the gene
     */
    public double getGeneWise(int i) {
        return this.geneWise[i];
    }

    /**
     * @return the trend dispersion for a gene
     *
     * @param i		row index of the gene
     */
    public double getTrendValue(int i) {
        return this.trendValues[i];
    }

    /**
     * @return the final dispersion for a gene
     *
     * @param i		row index of the gene
     */
    public double get(int i) {
        return this.finals[i];
    }

    /**
     * @return TRUE if the gene-wise estimate was kept because the gene is a dispersion outlier
     *
     * @param i		row index of the gene
     */
    public boolean isOutlier(int i) {
        return this.outliers[i];
    }

    /**
     * @return the fitted trend
     */
    public DispersionTrend getTrend() {
        return this.trend;
    }

    /**
     * @return TRUE if the trend fit failed and the constant fallback was used
     */
    public boolean isTrendFallback() {
        return this.trendFallback;
    }

    /**
     * @return the prior variance of the log dispersion
     */
    public double getPriorVar() {
        return this.priorVar;
    }

    /**
     * @return the observed variance of the log dispersion residuals
     */
    public double getLogResidualVar() {
        return this.logResidualVar;
    }

}
