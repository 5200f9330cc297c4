/**
 *
 */
package org.theseed.sexdiff;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.enrich.OntologyGeneSets;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.pipeline.DiffExpressionPipeline;
import org.theseed.sexdiff.pipeline.PipelineConfig;
import org.theseed.sexdiff.pipeline.StratumReport;
import org.theseed.sexdiff.reports.EnrichmentReporter;
import org.theseed.sexdiff.reports.TestResultReporter;
import org.theseed.sexdiff.rna.CountMatrix;
import org.theseed.sexdiff.rna.DispersionEstimator;
import org.theseed.sexdiff.rna.DispersionTrend;
import org.theseed.sexdiff.samples.AgeStratum;
import org.theseed.sexdiff.samples.SampleMetadata;
import org.theseed.sexdiff.utils.ParseFailureException;

/**
 * This command computes the genes differentially expressed between the sexes in each age stratum of a tumor
 * cohort, and tests the up and down gene lists for over-represented ontology terms.
 *
 * The positional parameters are the name of the count matrix file, the name of the sample metadata file, and the
 * name of the output directory.  The count matrix is tab-delimited, with the gene ID in the first column and one
 * column of raw counts per sample.  The metadata file is tab-delimited with headers; it must contain "sample_id",
 * "age_at_index", "gender", and "sample_type".
 *
 * For each stratum, the output directory will receive "XXXX.results.tsv" containing the per-gene results, and,
 * if ontology gene sets are specified, "XXXX.up.tsv" and "XXXX.down.tsv" containing the enrichment results,
 * where "XXXX" is the stratum label.  A summary of the run is written to "summary.tsv".
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --annot		tab-delimited file of gene names, with columns "gene_id" and "gene_name"
 * --go			tab-delimited file of ontology gene sets, with columns "term_id", "term_name", and "gene_id"
 * --age		age threshold separating the young stratum (at or below) from the older stratum (default 50)
 * --type		sample type to analyze (default "Metastatic")
 * --lfc		minimum absolute log2 fold change for a significant gene (default 1.0)
 * --padj		maximum adjusted p-value for a significant gene (default 0.05)
 * --minGS		minimum number of background genes in a tested term (default 10)
 * --maxGS		maximum number of background genes in a tested term (default 500)
 * --method		gene-wise dispersion method (default LIKELIHOOD)
 * --trend		dispersion trend type (default PARAMETRIC)
 * --maxIter	maximum number of GLM iterations per gene (default 100)
 * --tol		GLM convergence tolerance (default 1e-6)
 * --threads	number of worker threads (default is the number of processors)
 * --clear		erase the output directory before starting
 *
 * @author Bruce Parrello
 *
 */
public class DiffExpressionProcessor extends BaseDiffProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DiffExpressionProcessor.class);
    /** count matrix */
    private CountMatrix matrix;
    /** sample metadata */
    private SampleMetadata metadata;
    /** ontology gene sets, or NULL if there are none */
    private OntologyGeneSets geneSets;
    /** run configuration */
    private PipelineConfig config;

    // COMMAND-LINE OPTIONS

    /** ontology gene set file */
    @Option(name = "--go", metaVar = "go_sets.tsv", usage = "ontology gene set file (if omitted, no enrichment is performed)")
    private File goFile;

    /** age threshold */
    @Option(name = "--age", metaVar = "50", usage = "age threshold between the young and older strata")
    private double ageThreshold;

    /** sample type */
    @Option(name = "--type", metaVar = "Primary Tumor", usage = "sample type to analyze")
    private String sampleType;

    /** log2 fold change threshold */
    @Option(name = "--lfc", metaVar = "1.5", usage = "minimum absolute log2 fold change for a significant gene")
    private double lfcThreshold;

    /** adjusted p-value threshold */
    @Option(name = "--padj", metaVar = "0.01", usage = "maximum adjusted p-value for a significant gene")
    private double padjThreshold;

    /** dispersion method */
    @Option(name = "--method", usage = "gene-wise dispersion estimation method")
    private DispersionEstimator.Method dispMethod;

    /** trend type */
    @Option(name = "--trend", usage = "dispersion trend type")
    private DispersionTrend.Type trendType;

    /** maximum GLM iterations */
    @Option(name = "--maxIter", metaVar = "200", usage = "maximum number of GLM iterations per gene")
    private int maxIter;

    /** GLM tolerance */
    @Option(name = "--tol", metaVar = "1e-8", usage = "GLM convergence tolerance")
    private double tolerance;

    /** number of worker threads */
    @Option(name = "--threads", metaVar = "4", usage = "number of worker threads")
    private int threads;

    /** TRUE to erase the output directory before starting */
    @Option(name = "--clear", usage = "if specified, the output directory will be erased before processing")
    private boolean clearFlag;

    /** count matrix file */
    @Argument(index = 0, metaVar = "counts.tsv", usage = "raw count matrix file", required = true)
    private File countFile;

    /** sample metadata file */
    @Argument(index = 1, metaVar = "samples.tsv", usage = "sample metadata file", required = true)
    private File metaFile;

    /** output directory */
    @Argument(index = 2, metaVar = "outDir", usage = "output directory", required = true)
    private File outDir;

    @Override
    protected void setDiffDefaults() {
        this.goFile = null;
        this.ageThreshold = PipelineConfig.DEFAULT_AGE_THRESHOLD;
        this.sampleType = PipelineConfig.DEFAULT_SAMPLE_TYPE;
        PipelineConfig defaults = new PipelineConfig();
        this.lfcThreshold = defaults.getLfcThreshold();
        this.padjThreshold = defaults.getPadjThreshold();
        this.dispMethod = defaults.getDispMethod();
        this.trendType = defaults.getTrendType();
        this.maxIter = defaults.getMaxIter();
        this.tolerance = defaults.getTolerance();
        this.threads = defaults.getThreads();
        this.clearFlag = false;
    }

    @Override
    protected boolean validateDiffParms() throws IOException, ParseFailureException {
        if (this.lfcThreshold < 0.0)
            throw new ParseFailureException("Log2 fold change threshold cannot be negative.");
        if (this.padjThreshold <= 0.0 || this.padjThreshold > 1.0)
            throw new ParseFailureException("Adjusted p-value threshold must be between 0 and 1.");
        if (this.maxIter < 1)
            throw new ParseFailureException("Maximum GLM iterations must be at least 1.");
        if (this.tolerance <= 0.0)
            throw new ParseFailureException("GLM tolerance must be positive.");
        if (this.threads < 1)
            throw new ParseFailureException("Thread count must be at least 1.");
        // Load the input files.
        this.matrix = CountMatrix.load(checkFile(this.countFile, "Count matrix"));
        log.info("{} genes and {} samples read from {}.", this.matrix.height(), this.matrix.width(), this.countFile);
        this.metadata = SampleMetadata.load(checkFile(this.metaFile, "Sample metadata"));
        log.info("{} sample records read from {}.", this.metadata.size(), this.metaFile);
        if (this.goFile == null)
            this.geneSets = null;
        else {
            this.geneSets = OntologyGeneSets.load(checkFile(this.goFile, "Ontology gene set"));
            log.info("{} ontology terms read from {}.", this.geneSets.size(), this.goFile);
        }
        // Set up the output directory.
        if (! this.outDir.isDirectory()) {
            log.info("Creating output directory {}.", this.outDir);
            FileUtils.forceMkdir(this.outDir);
        } else if (this.clearFlag) {
            log.info("Erasing output directory {}.", this.outDir);
            FileUtils.cleanDirectory(this.outDir);
        } else
            log.info("Output will be written to {}.", this.outDir);
        // Build the configuration.
        this.config = new PipelineConfig().setAgeThreshold(this.ageThreshold).setSampleType(this.sampleType)
                .setLfcThreshold(this.lfcThreshold).setPadjThreshold(this.padjThreshold)
                .setMinGeneSetSize(this.getMinGeneSetSize()).setMaxGeneSetSize(this.getMaxGeneSetSize())
                .setDispMethod(this.dispMethod).setTrendType(this.trendType).setMaxIter(this.maxIter)
                .setTolerance(this.tolerance).setThreads(this.threads);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        DiffExpressionPipeline pipeline = new DiffExpressionPipeline(this.config, this.getAnnotation(), this.geneSets);
        Map<AgeStratum, StratumReport> reports = pipeline.run(this.matrix, this.metadata);
        for (Map.Entry<AgeStratum, StratumReport> reportEntry : reports.entrySet()) {
            String label = reportEntry.getKey().getLabel();
            StratumReport report = reportEntry.getValue();
            File resultFile = new File(this.outDir, label + ".results.tsv");
            log.info("Writing {} gene results to {}.", report.getResults().size(), resultFile);
            try (TestResultReporter reporter = new TestResultReporter(resultFile)) {
                reporter.writeAll(report.getResults());
            }
            if (this.geneSets != null) {
                writeEnrichment(new File(this.outDir, label + ".up.tsv"), report, true);
                writeEnrichment(new File(this.outDir, label + ".down.tsv"), report, false);
            }
        }
        // Write the run summary.
        File summaryFile = new File(this.outDir, "summary.tsv");
        try (PrintWriter writer = new PrintWriter(summaryFile, StandardCharsets.UTF_8)) {
            writer.println("stratum\tstatus\tsamples\tmale\tgenes\texcluded\tna\toutliers\tmap_failures\tunannotated\tup\tdown\tsignificant\ttrend");
            for (AgeStratum stratum : AgeStratum.values()) {
                StratumReport report = reports.get(stratum);
                if (report != null)
                    writer.format("%s\tOK\t%d\t%d\t%d\t%d\t%d\t%d\t%d\t%d\t%d\t%d\t%d\t%s%n", stratum.getLabel(),
                            report.getSampleCount(), report.getMaleCount(), report.getResults().size(),
                            report.getExcludedCount(), report.getNaCount(), report.getOutlierCount(),
                            report.getMapFailureCount(), report.getMissingAnnotationCount(), report.getUpCount(),
                            report.getDownCount(), report.getSignificantCount(),
                            report.getTrendDescription() + (report.isTrendFallback() ? " (fallback)" : ""));
                else
                    writer.format("%s\tFAILED: %s%n", stratum.getLabel(), pipeline.getFailures().get(stratum));
            }
        }
    }

    /**
     * Write an enrichment report.
     *
     * @param outFile	output file
     * @param report	stratum report containing the enrichment
     * @param up		TRUE for the up list, FALSE for the down list
     *
     * @throws FileNotFoundException
     */
    private static void writeEnrichment(File outFile, StratumReport report, boolean up) throws FileNotFoundException {
        try (EnrichmentReporter reporter = new EnrichmentReporter(outFile)) {
            reporter.writeAll(up ? report.getUpEnrichment() : report.getDownEnrichment());
        }
        log.info("Enrichment written to {}.", outFile);
    }

}
