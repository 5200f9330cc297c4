/**
 *
 */
package org.theseed.sexdiff;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.rna.CountMatrix;
import org.theseed.sexdiff.rna.SizeFactorEstimator;
import org.theseed.sexdiff.rna.SizeFactors;
import org.theseed.sexdiff.utils.BaseProcessor;
import org.theseed.sexdiff.utils.ParseFailureException;

/**
 * This command computes the median-of-ratios size factors for the samples in a count matrix.  The report has
 * one line per sample, containing the sample ID and its size factor.
 *
 * The positional parameter is the name of the count matrix file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for the report (if not STDOUT)
 *
 * @author Bruce Parrello
 *
 */
public class SizeFactorProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SizeFactorProcessor.class);
    /** count matrix */
    private CountMatrix matrix;
    /** output stream */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file, if not STDOUT */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "sizes.tsv", usage = "output file name (if not STDOUT)")
    private File outFile;

    /** count matrix file */
    @Argument(index = 0, metaVar = "counts.tsv", usage = "raw count matrix file", required = true)
    private File countFile;

    @Override
    protected void setDefaults() {
        this.outFile = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        this.matrix = CountMatrix.load(BaseDiffProcessor.checkFile(this.countFile, "Count matrix"));
        log.info("{} genes and {} samples read from {}.", this.matrix.height(), this.matrix.width(), this.countFile);
        if (this.outFile == null) {
            log.info("Report will be written to standard output.");
            this.outStream = System.out;
        } else {
            log.info("Report will be written to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        SizeFactors sizes = new SizeFactorEstimator().estimate(this.matrix);
        try (PrintWriter writer = new PrintWriter(this.outStream)) {
            writer.println("sample_id\tsize_factor");
            for (int j = 0; j < sizes.size(); j++)
                writer.format("%s\t%s%n", sizes.getSampleId(j), sizes.get(j));
        }
    }

}
