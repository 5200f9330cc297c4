/**
 *
 */
package org.theseed.sexdiff.enrich;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * This object describes an ontology term and the set of genes annotated to it.
 *
 * @author Bruce Parrello
 *
 */
public class OntologyTerm {

    // FIELDS
    /** term ID */
    private final String termId;
    /** term name */
    private final String termName;
    /** IDs of the genes in the term (without version suffixes) */
    private final Set<String> genes;

    /**
     * Construct an ontology term.
     *
     * @param termId	ID of the term
     * @param termName	name of the term
     */
    public OntologyTerm(String termId, String termName) {
        this.termId = termId;
        this.termName = termName;
        this.genes = new HashSet<String>();
    }

    /**
     * Add a gene to this term.
     *
     * @param geneId	stripped ID of the gene to add
     */
    protected void addGene(String geneId) {
        this.genes.add(geneId);
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
     * @return the set of gene IDs in this term
     */
    public Set<String> getGenes() {
        return Collections.unmodifiableSet(this.genes);
    }

    /**
     * @return the number of genes in this term
     */
    public int size() {
        return this.genes.size();
    }

}
