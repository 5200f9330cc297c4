/**
 *
 */
package org.theseed.sexdiff.genes;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.rna.GeneFit;
import org.theseed.sexdiff.rna.TestResult;
import org.theseed.sexdiff.stats.DiffLabel;

/**
 * @author Bruce Parrello
 *
 */
public class AnnotationJoinerTest {

    @Test
    public void testStrip() {
        assertThat(GeneIds.strip("ENSG00000123.4"), equalTo("ENSG00000123"));
        assertThat(GeneIds.strip("ENSG00000123"), equalTo("ENSG00000123"));
        assertThat(GeneIds.strip("ENSG00000123.4_PAR_Y"), equalTo("ENSG00000123.4_PAR_Y"));
        for (String id : Arrays.asList("ENSG00000123.4", "ENSG00000123.4.1", "XIST", "ENSG00000229807.11")) {
            String once = GeneIds.strip(id);
            assertThat(id, GeneIds.strip(once), equalTo(once));
            assertThat(id, once, not(matchesPattern(".*\\.\\d+$")));
        }
    }

    @Test
    public void testAnnotationFile() throws IOException {
        GeneAnnotation annotation = GeneAnnotation.load(new File("data", "genes.tsv"));
        assertThat(annotation.size(), equalTo(70));
        assertThat(annotation.getDuplicateCount(), equalTo(1));
        // The file has different version suffixes from the count matrix.
        assertThat(annotation.getName("ENSG00000000001.2"), equalTo("GENE1"));
        assertThat(annotation.getName("ENSG00000000001"), equalTo("GENE1"));
        assertThat(annotation.getName("ENSG00000000071.4"), nullValue());
        assertThat(annotation.getNameOrId("ENSG00000000071.4"), equalTo("ENSG00000000071"));
        assertThat(annotation.asMap().get("ENSG00000000012"), equalTo("GENE12"));
    }

    @Test
    public void testFirstRecordWins() {
        GeneAnnotation annotation = new GeneAnnotation();
        annotation.put("ENSG00000000005.1", "");
        annotation.put("ENSG00000000005.2", "LATER");
        annotation.put("ENSG00000000006", "FIRST");
        annotation.put("ENSG00000000006.3", "SECOND");
        assertThat(annotation.getName("ENSG00000000005"), nullValue());
        assertThat(annotation.getNameOrId("ENSG00000000005.2"), equalTo("ENSG00000000005"));
        assertThat(annotation.getName("ENSG00000000006.1"), equalTo("FIRST"));
        assertThat(annotation.size(), equalTo(1));
        assertThat(annotation.getDuplicateCount(), equalTo(2));
    }

    @Test
    public void testJoin() {
        GeneAnnotation annotation = new GeneAnnotation();
        annotation.put("ENSG00000000001.1", "XIST");
        annotation.put("ENSG00000000002", "KDM5D");
        annotation.put("ENSG00000000002.7", "OTHER");
        annotation.put("ENSG00000000003", "");
        assertThat(annotation.size(), equalTo(2));
        assertThat(annotation.getName("ENSG00000000002.3"), equalTo("KDM5D"));
        List<TestResult> results = Arrays.asList(
                new TestResult("ENSG00000000002.3", 120.0, 5.2, 0.4, 13.0, 1e-20, 1e-18, DiffLabel.MALE,
                        GeneFit.Status.CONVERGED),
                new TestResult("ENSG00000000003.1", 50.0, 0.1, 0.3, 0.33, 0.74, 0.9, DiffLabel.NO,
                        GeneFit.Status.CONVERGED),
                new TestResult("ENSG00000000001.9", 800.0, -7.5, 0.5, -15.0, 1e-30, 1e-28, DiffLabel.FEMALE,
                        GeneFit.Status.CONVERGED),
                new TestResult("ENSG00000000004.1", 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                        Double.NaN, DiffLabel.NO, GeneFit.Status.EXCLUDED));
        AnnotationJoiner joiner = new AnnotationJoiner(annotation);
        List<AnnotatedResult> joined = joiner.join(results);
        assertThat(joined.size(), equalTo(results.size()));
        assertThat(joiner.getMissingCount(), equalTo(2));
        assertThat(joined.get(0).getGeneName(), equalTo("KDM5D"));
        assertThat(joined.get(0).getBaseId(), equalTo("ENSG00000000002"));
        assertThat(joined.get(1).getGeneName(), nullValue());
        assertThat(joined.get(1).getDisplayName(), equalTo("ENSG00000000003"));
        assertThat(joined.get(2).getDisplayName(), equalTo("XIST"));
        // Dropping the annotation recovers the input exactly.
        assertThat(AnnotationJoiner.unjoin(joined), equalTo(results));
        for (int i = 0; i < results.size(); i++)
            assertThat(joined.get(i).getResult(), sameInstance(results.get(i)));
    }

}
