/**
 *
 */
package org.theseed.sexdiff.reports;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.OutputStream;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sexdiff.enrich.EnrichmentResult;

/**
 * This report writes the over-representation results for a gene list, one line per term.  The contributing
 * genes are joined with slashes.
 *
 * @author Bruce Parrello
 *
 */
public class EnrichmentReporter extends TableReporter {

    /** column headers */
    private static final String[] HEADERS = new String[] { "term_id", "term_name", "list_count", "background_count",
            "gene_ratio", "bg_ratio", "pvalue", "padj", "genes" };

    public EnrichmentReporter(File outFile) throws FileNotFoundException {
        super(outFile);
    }

    public EnrichmentReporter(OutputStream oStream) {
        super(oStream);
    }

    @Override
    protected String[] getHeaders() {
        return HEADERS;
    }

    /**
     * Write the enrichment results for a gene list.
     *
     * @param results	enrichment results to write, in order
     */
    public void writeAll(List<EnrichmentResult> results) {
        for (EnrichmentResult result : results)
            this.writeLine(result.getTermId(), result.getTermName(), Integer.toString(result.getListCount()),
                    Integer.toString(result.getBackgroundCount()), result.getGeneRatio(), result.getBgRatio(),
                    format(result.getPvalue()), format(result.getPadj()), StringUtils.join(result.getGenes(), '/'));
    }

}
