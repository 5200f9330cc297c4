/**
 *
 */
package org.theseed.sexdiff.enrich;

import java.util.Collections;
import java.util.List;

/**
 * This object contains the over-representation result for a single ontology term.
 *
 * @author Bruce Parrello
 *
 */
public class EnrichmentResult {

    // FIELDS
    /** term ID */
    private final String termId;
    /** term name */
    private final String termName;
    /** number of list genes in the term */
    private final int listCount;
    /** number of background genes in the term */
    private final int backgroundCount;
    /** number of list genes in the background */
    private final int listSize;
    /** number of background genes */
    private final int backgroundSize;
    /** hypergeometric upper-tail p-value */
    private final double pvalue;
    /** adjusted p-value */
    private double padj;
    /** names of the list genes in the term */
    private final List<String> genes;

    /**
     * Construct an enrichment result.
     *
     * @param term				ontology term
     * @param listCount			number of list genes in the term
     * @param backgroundCount	number of background genes in the term
     * @param listSize			number of list genes in the background
     * @param backgroundSize	number of background genes
     * @param pvalue			upper-tail p-value
     * @param genes				names of the list genes in the term
     */
    public EnrichmentResult(OntologyTerm term, int listCount, int backgroundCount, int listSize, int backgroundSize,
            double pvalue, List<String> genes) {
        this.termId = term.getTermId();
        this.termName = term.getTermName();
        this.listCount = listCount;
        this.backgroundCount = backgroundCount;
        this.listSize = listSize;
        this.backgroundSize = backgroundSize;
        this.pvalue = pvalue;
        this.padj = Double.NaN;
        this.genes = genes;
    }

    /**
     * Store the adjusted p-value.
     *
     * @param padj	adjusted p-value
     */
    protected void setPadj(double padj) {
        this.padj = padj;
    }

    /**
     * @return the term ID
     */
    public String getTermId() {
        return this.termId;
    }

    /**
     * @return the term name
     */
    public String getTermName() {
        return this.termName;
    }

    /**
     * @return the number of list genes in the term
     */
    public int getListCount() {
        return this.listCount;
    }

    /**
     * @return the number of background genes in the term
     */
    public int getBackgroundCount() {
        return this.backgroundCount;
    }

    /**
     * @return the gene ratio string (list genes in term / list genes)
     */
    public String getGeneRatio() {
        return this.listCount + "/" + this.listSize;
    }

    /**
     * @return the background ratio string (background genes in term / background genes)
     */
    public String getBgRatio() {
        return this.backgroundCount + "/" + this.backgroundSize;
    }

    /**
     * @return the fold enrichment of the term in the list
     */
    public double getFoldEnrichment() {
        return ((double) this.listCount / this.listSize) / ((double) this.backgroundCount / this.backgroundSize);
    }

    /**
     * @return the upper-tail p-value
     */
    public double getPvalue() {
        return this.pvalue;
    }

    /**
     * @return the adjusted p-value
     */
    public double getPadj() {
        return this.padj;
    }

    /**
     * @return the names of the contributing list genes, in list order
     */
    public List<String> getGenes() {
        return Collections.unmodifiableList(this.genes);
    }

}
