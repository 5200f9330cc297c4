/**
 *
 */
package org.theseed.sexdiff.stats;

/**
 * This object classifies genes as significantly up in males, significantly up in females, or not significant.
 * The thresholds are fixed when the object is built and do not depend on the data.
 *
 * @author Bruce Parrello
 *
 */
public class SignificanceClassifier {

    // FIELDS
    /** minimum absolute log2 fold change for significance */
    private final double lfcThreshold;
    /** adjusted p-value must be below this level for significance */
    private final double padjThreshold;
    /** default fold-change threshold */
    public static final double DEFAULT_LFC = 1.0;
    /** default adjusted p-value threshold */
    public static final double DEFAULT_PADJ = 0.05;

    /**
     * Construct a classifier with the default thresholds.
     */
    public SignificanceClassifier() {
        this(DEFAULT_LFC, DEFAULT_PADJ);
    }

    /**
     * Construct a classifier with specified thresholds.
     *
     * @param lfcThreshold		minimum absolute log2 fold change
     * @param padjThreshold		adjusted p-value limit
     */
    public SignificanceClassifier(double lfcThreshold, double padjThreshold) {
        this.lfcThreshold = lfcThreshold;
        this.padjThreshold = padjThreshold;
    }

    /**
     * @return the classification of a gene
     *
     * @param lfc		log2 fold change (male versus female)
     * @param padj		adjusted p-value (NaN if untested)
     */
    public DiffLabel classify(double lfc, double padj) {
        DiffLabel retVal = DiffLabel.NO;
        if (padj < this.padjThreshold) {
            if (lfc > this.lfcThreshold)
                retVal = DiffLabel.MALE;
            else if (lfc < -this.lfcThreshold)
                retVal = DiffLabel.FEMALE;
        }
        return retVal;
    }

    /**
     * @return the adjusted p-value threshold
     */
    public double getPadjThreshold() {
        return this.padjThreshold;
    }

    /**
     * @return the fold-change threshold
     */
    public double getLfcThreshold() {
        return this.lfcThreshold;
    }

}
