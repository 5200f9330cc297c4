/**
 *
 */
package org.theseed.sexdiff.pipeline;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.enrich.OntologyGeneSets;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.rna.CountMatrix;
import org.theseed.sexdiff.samples.AgeStratum;
import org.theseed.sexdiff.samples.Cohort;
import org.theseed.sexdiff.samples.CohortException;
import org.theseed.sexdiff.samples.CohortFilter;
import org.theseed.sexdiff.samples.SampleMetadata;

/**
 * This object runs the analysis for both age strata.  The strata are independent:  a failure in one, whether a
 * cohort problem or an unexpected runtime error from its worker threads, is logged and recorded, and the other
 * proceeds normally.
 *
 * @author Bruce Parrello
 *
 */
public class DiffExpressionPipeline {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DiffExpressionPipeline.class);
    /** run configuration */
    private final PipelineConfig config;
    /** gene annotation */
    private final GeneAnnotation annotation;
    /** ontology gene sets, or NULL to skip enrichment */
    private final OntologyGeneSets geneSets;
    /** reports for the successful strata */
    private final Map<AgeStratum, StratumReport> reports;
    /** error messages for the failed strata */
    private final Map<AgeStratum, String> failures;

    /**
     * Construct a two-stratum pipeline.
     *
     * @param config		run configuration
     * @param annotation	gene annotation (may be empty)
     * @param geneSets		ontology gene sets, or NULL to skip enrichment
     */
    public DiffExpressionPipeline(PipelineConfig config, GeneAnnotation annotation, OntologyGeneSets geneSets) {
        this.config = config;
        this.annotation = annotation;
        this.geneSets = geneSets;
        this.reports = new EnumMap<AgeStratum, StratumReport>(AgeStratum.class);
        this.failures = new EnumMap<AgeStratum, String>(AgeStratum.class);
    }

    /**
     * Analyze both strata of a data set.
     *
     * @param matrix		full count matrix
     * @param metadata		sample metadata
     *
     * @return a map from each successful stratum to its report
     *
     * @throws CohortException	if the metadata cannot be aligned with the count matrix
     */
    public Map<AgeStratum, StratumReport> run(CountMatrix matrix, SampleMetadata metadata) throws CohortException {
        this.reports.clear();
        this.failures.clear();
        SampleMetadata aligned = metadata.alignTo(matrix);
        for (AgeStratum stratum : AgeStratum.values()) {
            CohortFilter filter = new CohortFilter(this.config, stratum);
            try {
                Cohort cohort = filter.apply(matrix, aligned);
                StratumPipeline pipeline = new StratumPipeline(this.config, this.annotation, this.geneSets);
                this.reports.put(stratum, pipeline.run(cohort));
            } catch (CohortException e) {
                log.error("Analysis failed for {}: {}", filter.describe(), e.getMessage());
                this.failures.put(stratum, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error analyzing {}.", filter.describe(), e);
                this.failures.put(stratum, e.toString());
            }
        }
        log.info("{} strata analyzed, {} failed.", this.reports.size(), this.failures.size());
        return this.reports;
    }

    /**
     * @return the reports for the successful strata
     */
    public Map<AgeStratum, StratumReport> getReports() {
        return this.reports;
    }

    /**
     * @return the error messages for the failed strata
     */
    public Map<AgeStratum, String> getFailures() {
        return this.failures;
    }

}
