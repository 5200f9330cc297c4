/**
 *
 */
package org.theseed.sexdiff.rna;

import java.util.Objects;

import org.theseed.sexdiff.stats.DiffLabel;

/**
 * This object contains the differential-expression result for a single gene.  Statistics that could not be
 * computed are NaN.
 *
 * @author Bruce Parrello
 *
 */
public class TestResult {

    // FIELDS
    /** ID of the gene */
    private final String geneId;
    /** mean normalized count */
    private final double baseMean;
    /** log2 fold change, male versus female */
    private final double log2FoldChange;
    /** standard error of the log2 fold change */
    private final double lfcSE;
    /** Wald statistic */
    private final double stat;
    /** raw p-value */
    private final double pvalue;
    /** adjusted p-value */
    private final double padj;
    /** classification */
    private final DiffLabel label;
    /** fit status */
    private final GeneFit.Status status;

    /**
     * Construct a test result from a gene fit.
     *
     * @param fit		fit for the gene
     * @param padj		adjusted p-value
     * @param label		classification
     */
    public TestResult(GeneFit fit, double padj, DiffLabel label) {
        this(fit.getGeneId(), fit.getBaseMean(), fit.getLog2FoldChange(), fit.getLfcSE(), fit.getStat(),
                fit.getPvalue(), padj, label, fit.getStatus());
    }

    /**
     * Construct a test result from its fields.
     *
     * @param geneId			ID of the gene
     * @param baseMean			mean normalized count
     * @param log2FoldChange	log2 fold change
     * @param lfcSE				standard error of the log2 fold change
     * @param stat				Wald statistic
     * @param pvalue			raw p-value
     * @param padj				adjusted p-value
     * @param label				classification
     * @param status			fit status
     */
    public TestResult(String geneId, double baseMean, double log2FoldChange, double lfcSE, double stat,
            double pvalue, double padj, DiffLabel label, GeneFit.Status status) {
        this.geneId = geneId;
        this.baseMean = baseMean;
        this.log2FoldChange = log2FoldChange;
        this.lfcSE = lfcSE;
        this.stat = stat;
        this.pvalue = pvalue;
        this.padj = padj;
        this.label = label;
        this.status = status;
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
     * @return the log2 fold change
     */
    public double getLog2FoldChange() {
        return this.log2FoldChange;
    }

    /**
     * @return the standard error of the log2 fold change
     */
    public double getLfcSE() {
        return this.lfcSE;
    }

    /**
     * @return the Wald statistic
     */
    public double getStat() {
        return this.stat;
    }

    /**
     * @return the raw p-value
     */
    public double getPvalue() {
        return this.pvalue;
    }

    /**
     * @return the adjusted p-value
     */
    public double getPadj() {
        return this.padj;
    }

    /**
     * @return the classification label
     */
    public DiffLabel getLabel() {
        return this.label;
    }

    /**
     * @return the fit status
     */
    public GeneFit.Status getStatus() {
        return this.status;
    }

    /**
     * @return TRUE if this gene was tested and has a p-value
     */
    public boolean isTested() {
        return ! Double.isNaN(this.pvalue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.geneId, this.baseMean, this.log2FoldChange, this.lfcSE, this.stat, this.pvalue,
                this.padj, this.label, this.status);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof TestResult))
            return false;
        TestResult other = (TestResult) obj;
        return Objects.equals(this.geneId, other.geneId)
                && Double.compare(this.baseMean, other.baseMean) == 0
                && Double.compare(this.log2FoldChange, other.log2FoldChange) == 0
                && Double.compare(this.lfcSE, other.lfcSE) == 0
                && Double.compare(this.stat, other.stat) == 0
                && Double.compare(this.pvalue, other.pvalue) == 0
                && Double.compare(this.padj, other.padj) == 0
                && this.label == other.label && this.status == other.status;
    }

    @Override
    public String toString() {
        return this.geneId + " (" + this.label + ")";
    }

}
