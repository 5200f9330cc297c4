/**
 *
 */
package org.theseed.sexdiff;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.enrich.EnrichmentEngine;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.utils.BaseProcessor;
import org.theseed.sexdiff.utils.ParseFailureException;

/**
 * This is the base class for commands that annotate gene results and test gene lists for enrichment.  It
 * manages the gene annotation and the term-size limits.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseDiffProcessor extends BaseProcessor implements EnrichmentEngine.IParms {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseDiffProcessor.class);
    /** gene annotation */
    private GeneAnnotation annotation;

    // COMMAND-LINE OPTIONS

    /** gene annotation file */
    @Option(name = "--annot", metaVar = "genes.tsv", usage = "gene annotation file with gene IDs and names")
    private File annotFile;

    /** minimum term size */
    @Option(name = "--minGS", metaVar = "5", usage = "minimum number of background genes in a tested term")
    private int minGeneSetSize;

    /** maximum term size */
    @Option(name = "--maxGS", metaVar = "1000", usage = "maximum number of background genes in a tested term")
    private int maxGeneSetSize;

    @Override
    protected final void setDefaults() {
        this.annotFile = null;
        this.minGeneSetSize = EnrichmentEngine.DEFAULT_MIN_SIZE;
        this.maxGeneSetSize = EnrichmentEngine.DEFAULT_MAX_SIZE;
        this.setDiffDefaults();
    }

    /**
     * Set the defaults for the subclass options.
     */
    protected abstract void setDiffDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (this.minGeneSetSize < 1)
            throw new ParseFailureException("Minimum term size must be at least 1.");
        if (this.maxGeneSetSize < this.minGeneSetSize)
            throw new ParseFailureException("Maximum term size cannot be less than the minimum.");
        if (this.annotFile == null) {
            log.info("No gene annotation file specified:  gene IDs will be used as names.");
            this.annotation = new GeneAnnotation();
        } else {
            this.annotation = GeneAnnotation.load(checkFile(this.annotFile, "Gene annotation"));
            log.info("{} gene names read from {}.", this.annotation.size(), this.annotFile);
        }
        return this.validateDiffParms();
    }

    /**
     * Validate the subclass options and load the input.
     *
     * @return TRUE if processing should proceed, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateDiffParms() throws IOException, ParseFailureException;

    /**
     * Verify that an input file is readable.
     *
     * @param inFile	file to check
     * @param type		description of the file, for the error message
     *
     * @return the file
     *
     * @throws FileNotFoundException	if the file cannot be read
     */
    public static File checkFile(File inFile, String type) throws FileNotFoundException {
        if (! inFile.canRead())
            throw new FileNotFoundException(type + " file " + inFile + " is not found or unreadable.");
        return inFile;
    }

    /**
     * @return the gene annotation
     */
    public GeneAnnotation getAnnotation() {
        return this.annotation;
    }

    @Override
    public int getMinGeneSetSize() {
        return this.minGeneSetSize;
    }

    @Override
    public int getMaxGeneSetSize() {
        return this.maxGeneSetSize;
    }

}
