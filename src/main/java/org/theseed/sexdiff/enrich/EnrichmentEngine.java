/**
 *
 */
package org.theseed.sexdiff.enrich;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.distribution.HypergeometricDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.genes.GeneIds;
import org.theseed.sexdiff.stats.BenjaminiHochberg;

/**
 * This object performs an over-representation test of a gene list against ontology terms.  For each term, the
 * p-value is the probability of finding at least as many list genes in the term as were observed, under the
 * hypergeometric distribution defined by the background universe.  Terms with no list genes are skipped, and
 * the p-values of the remaining terms are adjusted with Benjamini-Hochberg.
 *
 * @author Bruce Parrello
 *
 */
public class EnrichmentEngine {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(EnrichmentEngine.class);
    /** gene sets to test */
    private final OntologyGeneSets geneSets;
    /** minimum number of background genes for a term to be tested */
    private final int minSize;
    /** maximum number of background genes for a term to be tested */
    private final int maxSize;
    /** default minimum term size */
    public static final int DEFAULT_MIN_SIZE = 10;
    /** default maximum term size */
    public static final int DEFAULT_MAX_SIZE = 500;

    /**
     * This interface is used to specify parameters the engine needs from the client.
     */
    public interface IParms {

        /**
         * @return the minimum number of background genes for a term to be tested
         */
        public int getMinGeneSetSize();

        /**
         * @return the maximum number of background genes for a term to be tested
         */
        public int getMaxGeneSetSize();

    }

    /**
     * Construct an enrichment engine.
     *
     * @param geneSets		ontology gene sets to test
     * @param processor		controlling parameter object
     */
    public EnrichmentEngine(OntologyGeneSets geneSets, IParms processor) {
        this(geneSets, processor.getMinGeneSetSize(), processor.getMaxGeneSetSize());
    }

    /**
     * Construct an enrichment engine with explicit size limits.
     *
     * @param geneSets		ontology gene sets to test
     * @param minSize		minimum number of background genes for a term to be tested
     * @param maxSize		maximum number of background genes for a term to be tested
     */
    public EnrichmentEngine(OntologyGeneSets geneSets, int minSize, int maxSize) {
        this.geneSets = geneSets;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * Test the gene list for over-representation in each term.
     *
     * @param listGenes		IDs of the genes in the list, in display order
     * @param universe		IDs of all the background genes
     * @param annotation	gene annotation for display names
     *
     * @return the results for terms containing list genes, sorted by p-value
     */
    public List<EnrichmentResult> enrich(List<String> listGenes, Collection<String> universe, GeneAnnotation annotation) {
        List<EnrichmentResult> retVal = new ArrayList<EnrichmentResult>();
        Set<String> background = new HashSet<String>(universe.size() * 4 / 3 + 1);
        for (String geneId : universe)
            background.add(GeneIds.strip(geneId));
        // Only list genes in the background count.
        Set<String> list = new LinkedHashSet<String>(listGenes.size() * 4 / 3 + 1);
        for (String geneId : listGenes) {
            String stripped = GeneIds.strip(geneId);
            if (background.contains(stripped))
                list.add(stripped);
        }
        if (list.isEmpty()) {
            log.info("Gene list is empty:  no enrichment performed.");
        } else {
            final int bigN = background.size();
            final int bigK = list.size();
            int skipped = 0;
            for (OntologyTerm term : this.geneSets.getTerms()) {
                // Count the background genes in the term.
                int n = 0;
                for (String geneId : term.getGenes()) {
                    if (background.contains(geneId))
                        n++;
                }
                if (n < this.minSize || n > this.maxSize)
                    skipped++;
                else {
                    // Find the list genes in the term.
                    List<String> hits = new ArrayList<String>();
                    for (String geneId : list) {
                        if (term.getGenes().contains(geneId))
                            hits.add(annotation.getNameOrId(geneId));
                    }
                    final int k = hits.size();
                    if (k > 0) {
                        HypergeometricDistribution dist = new HypergeometricDistribution(null, bigN, bigK, n);
                        double pvalue = dist.upperCumulativeProbability(k);
                        retVal.add(new EnrichmentResult(term, k, n, bigK, bigN, pvalue, hits));
                    }
                }
            }
            log.info("{} terms with list genes found for {} list genes in {} background genes.  {} terms outside the size limits.",
                    retVal.size(), bigK, bigN, skipped);
            // Adjust the p-values.
            double[] pvalues = retVal.stream().mapToDouble(x -> x.getPvalue()).toArray();
            double[] padjs = BenjaminiHochberg.adjust(pvalues);
            for (int i = 0; i < padjs.length; i++)
                retVal.get(i).setPadj(padjs[i]);
            Collections.sort(retVal, Comparator.comparingDouble(EnrichmentResult::getPvalue)
                    .thenComparing(EnrichmentResult::getTermId));
        }
        return retVal;
    }

    /**
     * @return the upper-tail hypergeometric probability P(X >= k)
     *
     * @param bigN		number of background genes
     * @param bigK		number of list genes
     * @param n			number of term genes
     * @param k			number of list genes in the term
     */
    public static double upperTail(int bigN, int bigK, int n, int k) {
        return new HypergeometricDistribution(null, bigN, bigK, n).upperCumulativeProbability(k);
    }

}
