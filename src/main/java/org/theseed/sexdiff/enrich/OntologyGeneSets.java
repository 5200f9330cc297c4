/**
 *
 */
package org.theseed.sexdiff.enrich;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.genes.GeneIds;
import org.theseed.sexdiff.io.TabbedLineReader;

/**
 * This object contains the gene sets for a collection of ontology terms.  The gene IDs are stored without
 * version suffixes.
 *
 * @author Bruce Parrello
 *
 */
public class OntologyGeneSets {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OntologyGeneSets.class);
    /** map of term IDs to terms, in input order */
    private final Map<String, OntologyTerm> termMap;

    /**
     * Create an empty gene-set collection.
     */
    public OntologyGeneSets() {
        this.termMap = new LinkedHashMap<String, OntologyTerm>();
    }

    /**
     * Load the gene sets from a tab-delimited file with the columns "term_id", "term_name", and "gene_id".  Each
     * line assigns one gene to one term.
     *
     * @param inFile	file to load
     *
     * @return the gene-set collection
     *
     * @throws IOException
     */
    public static OntologyGeneSets load(File inFile) throws IOException {
        OntologyGeneSets retVal = new OntologyGeneSets();
        int count = 0;
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int termCol = inStream.findField("term_id");
            int nameCol = inStream.findField("term_name");
            int geneCol = inStream.findField("gene_id");
            for (TabbedLineReader.Line line : inStream) {
                retVal.add(line.get(termCol), line.get(nameCol), line.get(geneCol));
                count++;
            }
        }
        log.info("{} gene assignments for {} terms read from {}.", count, retVal.size(), inFile);
        return retVal;
    }

    /**
     * Assign a gene to a term.  The term is created if it is new.
     *
     * @param termId		ID of the term
     * @param termName		name of the term
     * @param geneId		ID of the gene (the version suffix is removed)
     */
    public void add(String termId, String termName, String geneId) {
        OntologyTerm term = this.termMap.computeIfAbsent(termId, x -> new OntologyTerm(termId, termName));
        term.addGene(GeneIds.strip(geneId));
    }

    /**
     * @return the term with the specified ID, or NULL if there is none
     *
     * @param termId	ID of the desired term
     */
    public OntologyTerm get(String termId) {
        return this.termMap.get(termId);
    }

    /**
     * @return the terms in this collection
     */
    public Collection<OntologyTerm> getTerms() {
        return Collections.unmodifiableCollection(new ArrayList<OntologyTerm>(this.termMap.values()));
    }

    /**
     * @return the number of terms
     */
    public int size() {
        return this.termMap.size();
    }

}
