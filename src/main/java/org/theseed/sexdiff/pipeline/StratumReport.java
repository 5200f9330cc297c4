/**
 *
 */
package org.theseed.sexdiff.pipeline;

import java.util.Collections;
import java.util.List;

import org.theseed.sexdiff.enrich.EnrichmentResult;
import org.theseed.sexdiff.genes.AnnotatedResult;
import org.theseed.sexdiff.rna.SizeFactors;
import org.theseed.sexdiff.stats.DiffLabel;

/**
 * This object contains the output of a single stratum run:  the annotated gene results, the enrichment
 * results for the up and down lists, and the counts that show how much data was lost along the way.
 *
 * @author Bruce Parrello
 *
 */
public class StratumReport {

    // FIELDS
    /** name of the stratum */
    private final String name;
    /** number of samples in the stratum */
    private int sampleCount;
    /** number of male samples */
    private int maleCount;
    /** size factors of the samples */
    private SizeFactors sizeFactors;
    /** annotated gene results, in count-matrix row order */
    private List<AnnotatedResult> results;
    /** enrichment results for the male-higher genes */
    private List<EnrichmentResult> upEnrichment;
    /** enrichment results for the female-higher genes */
    private List<EnrichmentResult> downEnrichment;
    /** number of genes excluded from testing */
    private int excludedCount;
    /** number of genes whose fit did not converge */
    private int naCount;
    /** number of genes with outlier dispersions */
    private int outlierCount;
    /** number of genes whose MAP dispersion search failed */
    private int mapFailureCount;
    /** number of genes without an annotation */
    private int missingAnnotationCount;
    /** number of genes in the up list */
    private int upCount;
    /** number of genes in the down list */
    private int downCount;
    /** TRUE if the dispersion trend fell back to a constant */
    private boolean trendFallback;
    /** description of the dispersion trend */
    private String trendDescription;

    /**
     * Create an empty report for a stratum.
     *
     * @param name		name of the stratum
     */
    public StratumReport(String name) {
        this.name = name;
        this.results = Collections.emptyList();
        this.upEnrichment = Collections.emptyList();
        this.downEnrichment = Collections.emptyList();
        this.trendDescription = "";
    }

    /**
     * @return the number of genes classified with the specified label
     *
     * @param label		label of interest
     */
    public int count(DiffLabel label) {
        int retVal = 0;
        for (AnnotatedResult result : this.results) {
            if (result.getResult().getLabel() == label)
                retVal++;
        }
        return retVal;
    }

    /**
     * @return the number of significant genes
     */
    public int getSignificantCount() {
        return this.count(DiffLabel.MALE) + this.count(DiffLabel.FEMALE);
    }

    /**
     * @return a one-line summary of the counts
     */
    public String summarize() {
        return String.format("%s: %d samples (%d male), %d genes, %d excluded, %d NA, %d outlier dispersions, "
                + "%d MAP failures, %d unannotated, %d up (%d Male), %d down (%d Female), trend %s%s.",
                this.name, this.sampleCount, this.maleCount, this.results.size(), this.excludedCount, this.naCount,
                this.outlierCount, this.mapFailureCount, this.missingAnnotationCount, this.upCount,
                this.count(DiffLabel.MALE), this.downCount, this.count(DiffLabel.FEMALE), this.trendDescription,
                (this.trendFallback ? " (fallback)" : ""));
    }

    /**
     * @return the stratum name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the number of samples
     */
    public int getSampleCount() {
        return this.sampleCount;
    }

    /**
     * @return the number of male samples
     */
    public int getMaleCount() {
        return this.maleCount;
    }

    /**
     * Store the sample counts.
     *
     * @param sampleCount	number of samples
     * @param maleCount		number of male samples
     */
    protected void setSampleCounts(int sampleCount, int maleCount) {
        this.sampleCount = sampleCount;
        this.maleCount = maleCount;
    }

    /**
     * @return the size factors
     */
    public SizeFactors getSizeFactors() {
        return this.sizeFactors;
    }

    /**
     * @param sizeFactors 	the size factors to store
     */
    protected void setSizeFactors(SizeFactors sizeFactors) {
        this.sizeFactors = sizeFactors;
    }

    /**
     * @return the annotated gene results
     */
    public List<AnnotatedResult> getResults() {
        return this.results;
    }

    /**
     * @param results 	the annotated gene results to store
     */
    protected void setResults(List<AnnotatedResult> results) {
        this.results = results;
    }

    /**
     * @return the enrichment of the male-higher genes
     */
    public List<EnrichmentResult> getUpEnrichment() {
        return this.upEnrichment;
    }

    /**
     * @return the enrichment of the female-higher genes
     */
    public List<EnrichmentResult> getDownEnrichment() {
        return this.downEnrichment;
    }

    /**
     * Store the enrichment results.
     *
     * @param up		enrichment of the male-higher genes
     * @param down		enrichment of the female-higher genes
     */
    protected void setEnrichment(List<EnrichmentResult> up, List<EnrichmentResult> down) {
        this.upEnrichment = up;
        this.downEnrichment = down;
    }

    /**
     * @return the number of genes excluded from testing
     */
    public int getExcludedCount() {
        return this.excludedCount;
    }

    /**
     * @return the number of genes whose fit did not converge
     */
    public int getNaCount() {
        return this.naCount;
    }

    /**
     * Store the gene loss counts.
     *
     * @param excluded		number of genes excluded from testing
     * @param na			number of genes whose fit did not converge
     */
    protected void setGeneCounts(int excluded, int na) {
        this.excludedCount = excluded;
        this.naCount = na;
    }

    /**
     * @return the number of outlier dispersions
     */
    public int getOutlierCount() {
        return this.outlierCount;
    }

    /**
     * @return the number of MAP search failures
     */
    public int getMapFailureCount() {
        return this.mapFailureCount;
    }

    /**
     * @return TRUE if the dispersion trend fell back to a constant
     */
    public boolean isTrendFallback() {
        return this.trendFallback;
    }

    /**
     * @return a description of the dispersion trend
     */
    public String getTrendDescription() {
        return this.trendDescription;
    }

    /**
     * Store the dispersion statistics.
     *
     * @param outliers		number of outlier dispersions
     * @param mapFailures	number of MAP search failures
     * @param fallback		TRUE if the trend fell back to a constant
     * @param trend			description of the trend
     */
    protected void setDispersionCounts(int outliers, int mapFailures, boolean fallback, String trend) {
        this.outlierCount = outliers;
        this.mapFailureCount = mapFailures;
        this.trendFallback = fallback;
        this.trendDescription = trend;
    }

    /**
     * @return the number of genes without an annotation
     */
    public int getMissingAnnotationCount() {
        return this.missingAnnotationCount;
    }

    /**
     * @param missingAnnotationCount 	the number of unannotated genes to store
     */
    protected void setMissingAnnotationCount(int missingAnnotationCount) {
        this.missingAnnotationCount = missingAnnotationCount;
    }

    /**
     * @return the number of genes in the up list
     */
    public int getUpCount() {
        return this.upCount;
    }

    /**
     * @return the number of genes in the down list
     */
    public int getDownCount() {
        return this.downCount;
    }

    /**
     * Store the enrichment list sizes.
     *
     * @param up		number of genes in the up list
     * @param down		number of genes in the down list
     */
    protected void setListCounts(int up, int down) {
        this.upCount = up;
        this.downCount = down;
    }

}
