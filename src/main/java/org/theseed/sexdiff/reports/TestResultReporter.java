/**
 *
 */
package org.theseed.sexdiff.reports;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.OutputStream;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sexdiff.genes.AnnotatedResult;
import org.theseed.sexdiff.rna.TestResult;

/**
 * This report writes the per-gene differential-expression results for a stratum, one line per gene in
 * count-matrix order.
 *
 * @author Bruce Parrello
 *
 */
public class TestResultReporter extends TableReporter {

    /** column headers */
    private static final String[] HEADERS = new String[] { "gene_id", "gene_name", "baseMean", "log2FoldChange",
            "lfcSE", "stat", "pvalue", "padj", "diffexpressed" };

    public TestResultReporter(File outFile) throws FileNotFoundException {
        super(outFile);
    }

    public TestResultReporter(OutputStream oStream) {
        super(oStream);
    }

    @Override
    protected String[] getHeaders() {
        return HEADERS;
    }

    /**
     * Write a single gene result.
     *
     * @param annotated		annotated result to write
     */
    public void write(AnnotatedResult annotated) {
        TestResult result = annotated.getResult();
        this.writeLine(result.getGeneId(), StringUtils.defaultString(annotated.getGeneName(), MISSING),
                format(result.getBaseMean()), format(result.getLog2FoldChange()), format(result.getLfcSE()),
                format(result.getStat()), format(result.getPvalue()), format(result.getPadj()),
                result.getLabel().getLabel());
    }

    /**
     * Write a list of gene results.
     *
     * @param results		annotated results to write
     */
    public void writeAll(List<AnnotatedResult> results) {
        for (AnnotatedResult result : results)
            this.write(result);
    }

}
