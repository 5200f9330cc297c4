/**
 *
 */
package org.theseed.sexdiff.enrich;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.util.CombinatoricsUtils;
import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.genes.GeneAnnotation;

/**
 * @author Bruce Parrello
 *
 */
public class EnrichmentEngineTest {

    /**
     * @return a list of gene IDs in a numbered range
     *
     * @param lo	first number
     * @param hi	last number
     */
    private static List<String> range(int lo, int hi) {
        List<String> retVal = new ArrayList<String>(hi - lo + 1);
        for (int i = lo; i <= hi; i++)
            retVal.add(String.format("G%03d", i));
        return retVal;
    }

    /**
     * Add a term to a gene set collection.
     *
     * @param sets		target collection
     * @param termId	term ID
     * @param genes		genes in the term
     */
    private static void addTerm(OntologyGeneSets sets, String termId, List<String> genes) {
        for (String gene : genes)
            sets.add(termId, "process " + termId, gene);
    }

    @Test
    public void testHypergeometric() {
        // Compare against the sum of the exact probabilities computed from binomial coefficients.
        final int bigN = 20000, bigK = 100, n = 50, k = 5;
        double expected = 0.0;
        double denom = CombinatoricsUtils.binomialCoefficientLog(bigN, n);
        for (int x = k; x <= n; x++)
            expected += Math.exp(CombinatoricsUtils.binomialCoefficientLog(bigK, x)
                    + CombinatoricsUtils.binomialCoefficientLog(bigN - bigK, n - x) - denom);
        double actual = EnrichmentEngine.upperTail(bigN, bigK, n, k);
        assertThat(actual, closeTo(expected, expected * 1e-6));
        // Observing at least zero is certain.
        assertThat(EnrichmentEngine.upperTail(bigN, bigK, n, 0), closeTo(1.0, 1e-12));
    }

    @Test
    public void testEnrichment() {
        OntologyGeneSets sets = new OntologyGeneSets();
        addTerm(sets, "T1", range(1, 20));
        addTerm(sets, "T2", range(50, 64));
        addTerm(sets, "T3", range(100, 119));
        addTerm(sets, "T4", range(1, 5));
        List<String> t5 = range(195, 200);
        t5.addAll(Arrays.asList("X001", "X002", "X003", "X004", "X005", "X006"));
        addTerm(sets, "T5", t5);
        List<String> t6 = range(140, 159);
        t6.addAll(Arrays.asList("Z1", "Z2", "Z3"));
        addTerm(sets, "T6", t6);
        assertThat(sets.size(), equalTo(6));
        assertThat(sets.get("T6").size(), equalTo(23));
        List<String> universe = range(1, 200);
        List<String> list = Arrays.asList("G005", "G001", "G002", "G003", "G004", "G006", "G007", "G008", "G100.2",
                "G150", "G999");
        GeneAnnotation annotation = new GeneAnnotation();
        annotation.put("G001", "ALPHA");
        EnrichmentEngine engine = new EnrichmentEngine(sets, EnrichmentEngine.DEFAULT_MIN_SIZE,
                EnrichmentEngine.DEFAULT_MAX_SIZE);
        List<EnrichmentResult> results = engine.enrich(list, universe, annotation);
        assertThat(results.size(), equalTo(3));
        EnrichmentResult top = results.get(0);
        assertThat(top.getTermId(), equalTo("T1"));
        assertThat(top.getTermName(), equalTo("process T1"));
        assertThat(top.getListCount(), equalTo(8));
        assertThat(top.getBackgroundCount(), equalTo(20));
        assertThat(top.getGeneRatio(), equalTo("8/10"));
        assertThat(top.getBgRatio(), equalTo("20/200"));
        assertThat(top.getFoldEnrichment(), closeTo(8.0, 1e-10));
        assertThat(top.getGenes(), contains("G005", "ALPHA", "G002", "G003", "G004", "G006", "G007", "G008"));
        assertThat(top.getPvalue(), closeTo(EnrichmentEngine.upperTail(200, 10, 20, 8), 1e-15));
        assertThat(top.getPadj(), closeTo(top.getPvalue() * 3, 1e-15));
        // Ties are broken by term ID.  T6 has three genes outside the background.
        assertThat(results.get(1).getTermId(), equalTo("T3"));
        assertThat(results.get(2).getTermId(), equalTo("T6"));
        assertThat(results.get(2).getBackgroundCount(), equalTo(20));
        assertThat(results.get(1).getGenes(), contains("G100"));
        assertThat(results.get(2).getGenes(), contains("G150"));
        double p = EnrichmentEngine.upperTail(200, 10, 20, 1);
        assertThat(results.get(1).getPvalue(), closeTo(p, 1e-12));
        assertThat(results.get(1).getPadj(), closeTo(p, 1e-12));
        for (EnrichmentResult result : results)
            assertThat(result.getPadj(), greaterThanOrEqualTo(result.getPvalue()));
        // Relaxing the size limit lets the small term in.
        EnrichmentEngine loose = new EnrichmentEngine(sets, 5, 500);
        results = loose.enrich(list, universe, annotation);
        assertThat(results.size(), equalTo(4));
        assertThat(results.get(0).getTermId(), equalTo("T1"));
        assertThat(results.get(1).getTermId(), equalTo("T4"));
        assertThat(results.get(1).getGenes(), contains("G005", "ALPHA", "G002", "G003", "G004"));
        // Tightening the upper limit keeps the big terms out.
        EnrichmentEngine tight = new EnrichmentEngine(sets, 1, 19);
        results = tight.enrich(list, universe, annotation);
        assertThat(results.size(), equalTo(1));
        assertThat(results.get(0).getTermId(), equalTo("T4"));
    }

    @Test
    public void testEmptyList() {
        OntologyGeneSets sets = new OntologyGeneSets();
        addTerm(sets, "T1", range(1, 20));
        EnrichmentEngine engine = new EnrichmentEngine(sets, 1, 500);
        GeneAnnotation annotation = new GeneAnnotation();
        assertThat(engine.enrich(Collections.emptyList(), range(1, 100), annotation), empty());
        assertThat(engine.enrich(Arrays.asList("Q1", "Q2"), range(1, 100), annotation), empty());
        // A list with no genes in any term gives no results either.
        assertThat(engine.enrich(Arrays.asList("G050"), range(1, 100), annotation), empty());
    }

    @Test
    public void testLoad() throws IOException {
        OntologyGeneSets sets = OntologyGeneSets.load(new File("data", "go_sets.tsv"));
        assertThat(sets.size(), equalTo(4));
        OntologyTerm term = sets.get("GO:0000001");
        assertThat(term.getTermName(), equalTo("male-biased process"));
        assertThat(term.size(), equalTo(12));
        // Gene IDs are stored without version suffixes.
        assertThat(term.getGenes(), hasItem("ENSG00000000001"));
        assertThat(sets.get("GO:0000004").size(), equalTo(3));
        assertThat(sets.get("GO:9999999"), nullValue());
    }

}
