/**
 *
 */
package org.theseed.sexdiff.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.enrich.EnrichmentEngine;
import org.theseed.sexdiff.enrich.EnrichmentResult;
import org.theseed.sexdiff.enrich.OntologyGeneSets;
import org.theseed.sexdiff.genes.AnnotatedResult;
import org.theseed.sexdiff.genes.AnnotationJoiner;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.rna.CountMatrix;
import org.theseed.sexdiff.rna.DispersionEstimate;
import org.theseed.sexdiff.rna.DispersionEstimator;
import org.theseed.sexdiff.rna.GeneFit;
import org.theseed.sexdiff.rna.GlmFitter;
import org.theseed.sexdiff.rna.SizeFactorEstimator;
import org.theseed.sexdiff.rna.SizeFactors;
import org.theseed.sexdiff.rna.TestResult;
import org.theseed.sexdiff.samples.Cohort;
import org.theseed.sexdiff.samples.CohortException;
import org.theseed.sexdiff.samples.Design;
import org.theseed.sexdiff.samples.Sex;
import org.theseed.sexdiff.stats.BenjaminiHochberg;
import org.theseed.sexdiff.stats.DiffLabel;
import org.theseed.sexdiff.stats.SignificanceClassifier;

/**
 * This object runs the differential-expression analysis for a single cohort.  Every run creates its own
 * estimators and its own thread pool, so nothing is shared between strata.  The phases are size factors,
 * dispersions, the per-gene GLM, multiple-testing correction, classification, the annotation join, and finally
 * the enrichment of the up and down lists.
 *
 * @author Bruce Parrello
 *
 */
public class StratumPipeline {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StratumPipeline.class);
    /** run configuration */
    private final PipelineConfig config;
    /** gene annotation */
    private final GeneAnnotation annotation;
    /** ontology gene sets, or NULL to skip enrichment */
    private final OntologyGeneSets geneSets;

    /**
     * Construct a stratum pipeline.
     *
     * @param config		run configuration
     * @param annotation	gene annotation (may be empty)
     * @param geneSets		ontology gene sets, or NULL to skip enrichment
     */
    public StratumPipeline(PipelineConfig config, GeneAnnotation annotation, OntologyGeneSets geneSets) {
        this.config = config;
        this.annotation = annotation;
        this.geneSets = geneSets;
    }

    /**
     * Analyze a cohort.
     *
     * @param cohort	cohort to analyze
     *
     * @return the report for the cohort
     *
     * @throws CohortException	if the cohort cannot be analyzed
     */
    public StratumReport run(Cohort cohort) throws CohortException {
        StratumReport retVal = new StratumReport(cohort.getName());
        retVal.setSampleCounts(cohort.size(), cohort.count(Sex.MALE));
        log.info("Analyzing cohort {} with {} samples ({} male, {} female).", cohort.getName(), cohort.size(),
                cohort.count(Sex.MALE), cohort.count(Sex.FEMALE));
        Design design = Design.create(cohort);
        CountMatrix matrix = cohort.getCounts();
        SizeFactors sizes = new SizeFactorEstimator().estimate(matrix);
        retVal.setSizeFactors(sizes);
        ExecutorService pool = Executors.newFixedThreadPool(this.config.getThreads());
        GeneFit[] fits;
        try {
            DispersionEstimator dispEstimator = new DispersionEstimator(this.config.getDispMethod(),
                    this.config.getTrendType());
            DispersionEstimate disps = dispEstimator.estimate(matrix, sizes, design, pool);
            retVal.setDispersionCounts(disps.getOutlierCount(), disps.getMapFailureCount(), disps.isTrendFallback(),
                    disps.getTrend().describe());
            GlmFitter fitter = new GlmFitter(this.config.getMaxIter(), this.config.getTolerance());
            fits = fitter.fit(matrix, sizes, disps, design, pool);
        } finally {
            pool.shutdown();
        }
        // Correct the p-values and classify the genes.
        double[] pvalues = new double[fits.length];
        int excluded = 0;
        int na = 0;
        for (int i = 0; i < fits.length; i++) {
            pvalues[i] = fits[i].getPvalue();
            switch (fits[i].getStatus()) {
            case EXCLUDED :
                excluded++;
                break;
            case NON_CONVERGED :
                na++;
                break;
            default :
                break;
            }
        }
        retVal.setGeneCounts(excluded, na);
        double[] padjs = BenjaminiHochberg.adjust(pvalues);
        SignificanceClassifier classifier = new SignificanceClassifier(this.config.getLfcThreshold(),
                this.config.getPadjThreshold());
        List<TestResult> results = new ArrayList<TestResult>(fits.length);
        for (int i = 0; i < fits.length; i++) {
            DiffLabel label = classifier.classify(fits[i].getLog2FoldChange(), padjs[i]);
            results.add(new TestResult(fits[i], padjs[i], label));
        }
        // Attach the gene names.
        AnnotationJoiner joiner = new AnnotationJoiner(this.annotation);
        List<AnnotatedResult> annotated = joiner.join(results);
        retVal.setResults(annotated);
        retVal.setMissingAnnotationCount(joiner.getMissingCount());
        // Build the enrichment lists.
        List<String> universe = new ArrayList<String>(results.size());
        List<String> upList = new ArrayList<String>();
        List<String> downList = new ArrayList<String>();
        final double alpha = classifier.getPadjThreshold();
        for (TestResult result : results) {
            if (result.isTested()) {
                universe.add(result.getGeneId());
                if (result.getPadj() < alpha) {
                    if (result.getLog2FoldChange() > 0.0)
                        upList.add(result.getGeneId());
                    else if (result.getLog2FoldChange() < 0.0)
                        downList.add(result.getGeneId());
                }
            }
        }
        retVal.setListCounts(upList.size(), downList.size());
        if (this.geneSets == null)
            log.info("No ontology gene sets specified:  enrichment skipped for {}.", cohort.getName());
        else {
            EnrichmentEngine engine = new EnrichmentEngine(this.geneSets, this.config);
            log.info("Computing enrichment for {} up genes in {}.", upList.size(), cohort.getName());
            List<EnrichmentResult> up = engine.enrich(upList, universe, this.annotation);
            log.info("Computing enrichment for {} down genes in {}.", downList.size(), cohort.getName());
            List<EnrichmentResult> down = engine.enrich(downList, universe, this.annotation);
            retVal.setEnrichment(up, down);
        }
        if (retVal.isTrendFallback())
            log.warn("Cohort {} used a constant dispersion trend.", cohort.getName());
        log.info(retVal.summarize());
        return retVal;
    }

}
