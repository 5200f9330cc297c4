/**
 *
 */
package org.theseed.sexdiff.pipeline;

import org.theseed.sexdiff.enrich.EnrichmentEngine;
import org.theseed.sexdiff.rna.DispersionEstimator;
import org.theseed.sexdiff.rna.DispersionTrend;
import org.theseed.sexdiff.rna.GlmFitter;
import org.theseed.sexdiff.samples.CohortFilter;
import org.theseed.sexdiff.stats.SignificanceClassifier;

/**
 * This object contains the tuning parameters for a differential-expression run.  It is built once by the
 * command processor and passed into the pipeline, so that every stratum sees the same settings.
 *
 * @author Bruce Parrello
 *
 */
public class PipelineConfig implements CohortFilter.IParms, EnrichmentEngine.IParms {

    // FIELDS
    /** age threshold for the strata (young is at or below, older is above) */
    private double ageThreshold;
    /** sample type to keep */
    private String sampleType;
    /** minimum absolute log2 fold change for significance */
    private double lfcThreshold;
    /** maximum adjusted p-value for significance */
    private double padjThreshold;
    /** minimum term size for enrichment */
    private int minGeneSetSize;
    /** maximum term size for enrichment */
    private int maxGeneSetSize;
    /** gene-wise dispersion method */
    private DispersionEstimator.Method dispMethod;
    /** dispersion trend type */
    private DispersionTrend.Type trendType;
    /** maximum IRLS iterations */
    private int maxIter;
    /** IRLS convergence tolerance */
    private double tolerance;
    /** number of worker threads per stratum */
    private int threads;
    /** default age threshold */
    public static final double DEFAULT_AGE_THRESHOLD = 50.0;
    /** default sample type */
    public static final String DEFAULT_SAMPLE_TYPE = "Metastatic";

    /**
     * Construct a configuration with the default settings.
     */
    public PipelineConfig() {
        this.ageThreshold = DEFAULT_AGE_THRESHOLD;
        this.sampleType = DEFAULT_SAMPLE_TYPE;
        this.lfcThreshold = SignificanceClassifier.DEFAULT_LFC;
        this.padjThreshold = SignificanceClassifier.DEFAULT_PADJ;
        this.minGeneSetSize = EnrichmentEngine.DEFAULT_MIN_SIZE;
        this.maxGeneSetSize = EnrichmentEngine.DEFAULT_MAX_SIZE;
        this.dispMethod = DispersionEstimator.Method.LIKELIHOOD;
        this.trendType = DispersionTrend.Type.PARAMETRIC;
        this.maxIter = GlmFitter.DEFAULT_MAX_ITER;
        this.tolerance = GlmFitter.DEFAULT_TOLERANCE;
        this.threads = Runtime.getRuntime().availableProcessors();
    }

    @Override
    public double getAgeThreshold() {
        return this.ageThreshold;
    }

    /**
     * @param ageThreshold 	the age threshold to set
     */
    public PipelineConfig setAgeThreshold(double ageThreshold) {
        this.ageThreshold = ageThreshold;
        return this;
    }

    @Override
    public String getSampleType() {
        return this.sampleType;
    }

    /**
     * @param sampleType 	the sample type to set
     */
    public PipelineConfig setSampleType(String sampleType) {
        this.sampleType = sampleType;
        return this;
    }

    /**
     * @return the minimum absolute log2 fold change for significance
     */
    public double getLfcThreshold() {
        return this.lfcThreshold;
    }

    /**
     * @param lfcThreshold 	the log2 fold change threshold to set
     */
    public PipelineConfig setLfcThreshold(double lfcThreshold) {
        this.lfcThreshold = lfcThreshold;
        return this;
    }

    /**
     * @return the maximum adjusted p-value for significance
     */
    public double getPadjThreshold() {
        return this.padjThreshold;
    }

    /**
     * @param padjThreshold 	the adjusted p-value threshold to set
     */
    public PipelineConfig setPadjThreshold(double padjThreshold) {
        this.padjThreshold = padjThreshold;
        return this;
    }

    @Override
    public int getMinGeneSetSize() {
        return this.minGeneSetSize;
    }

    /**
     * @param minGeneSetSize 	the minimum term size to set
     */
    public PipelineConfig setMinGeneSetSize(int minGeneSetSize) {
        this.minGeneSetSize = minGeneSetSize;
        return this;
    }

    @Override
    public int getMaxGeneSetSize() {
        return this.maxGeneSetSize;
    }

    /**
     * @param maxGeneSetSize 	the maximum term size to set
     */
    public PipelineConfig setMaxGeneSetSize(int maxGeneSetSize) {
        this.maxGeneSetSize = maxGeneSetSize;
        return this;
    }

    /**
     * @return the gene-wise dispersion method
     */
    public DispersionEstimator.Method getDispMethod() {
        return this.dispMethod;
    }

    /**
     * @param dispMethod 	the gene-wise dispersion method to set
     */
    public PipelineConfig setDispMethod(DispersionEstimator.Method dispMethod) {
        this.dispMethod = dispMethod;
        return this;
    }

    /**
     * @return the dispersion trend type
     */
    public DispersionTrend.Type getTrendType() {
        return this.trendType;
    }

    /**
     * @param trendType 	the dispersion trend type to set
     */
    public PipelineConfig setTrendType(DispersionTrend.Type trendType) {
        this.trendType = trendType;
        return this;
    }

    /**
     * @return the maximum number of IRLS iterations
     */
    public int getMaxIter() {
        return this.maxIter;
    }

    /**
     * @param maxIter 	the maximum number of IRLS iterations to set
     */
    public PipelineConfig setMaxIter(int maxIter) {
        this.maxIter = maxIter;
        return this;
    }

    /**
     * @return the IRLS convergence tolerance
     */
    public double getTolerance() {
        return this.tolerance;
    }

    /**
     * @param tolerance 	the IRLS convergence tolerance to set
     */
    public PipelineConfig setTolerance(double tolerance) {
        this.tolerance = tolerance;
        return this;
    }

    /**
     * @return the number of worker threads per stratum
     */
    public int getThreads() {
        return this.threads;
    }

    /**
     * @param threads 	the number of worker threads to set
     */
    public PipelineConfig setThreads(int threads) {
        this.threads = threads;
        return this;
    }

}
