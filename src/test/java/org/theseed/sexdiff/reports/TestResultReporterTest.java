/**
 *
 */
package org.theseed.sexdiff.reports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.enrich.EnrichmentEngine;
import org.theseed.sexdiff.enrich.EnrichmentResult;
import org.theseed.sexdiff.enrich.OntologyGeneSets;
import org.theseed.sexdiff.genes.AnnotatedResult;
import org.theseed.sexdiff.genes.AnnotationJoiner;
import org.theseed.sexdiff.genes.GeneAnnotation;
import org.theseed.sexdiff.io.TabbedLineReader;
import org.theseed.sexdiff.rna.GeneFit;
import org.theseed.sexdiff.rna.TestResult;
import org.theseed.sexdiff.stats.DiffLabel;

/**
 * @author Bruce Parrello
 *
 */
public class TestResultReporterTest {

    @Test
    public void testGeneReport() throws IOException {
        GeneAnnotation annotation = new GeneAnnotation();
        annotation.put("ENSG00000000001", "XIST");
        List<TestResult> results = Arrays.asList(
                new TestResult("ENSG00000000001.4", 812.5, -7.25, 0.5, -14.5, 1e-30, 2e-28, DiffLabel.FEMALE,
                        GeneFit.Status.CONVERGED),
                new TestResult("ENSG00000000002.1", 0.0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                        Double.NaN, DiffLabel.NO, GeneFit.Status.EXCLUDED));
        List<AnnotatedResult> joined = new AnnotationJoiner(annotation).join(results);
        ByteArrayOutputStream outStream = new ByteArrayOutputStream();
        try (TestResultReporter reporter = new TestResultReporter(outStream)) {
            reporter.writeAll(joined);
        }
        try (TabbedLineReader reader = new TabbedLineReader(new ByteArrayInputStream(outStream.toByteArray()))) {
            assertThat(reader.getLabels(), arrayContaining("gene_id", "gene_name", "baseMean", "log2FoldChange",
                    "lfcSE", "stat", "pvalue", "padj", "diffexpressed"));
            TabbedLineReader.Line line = reader.next();
            assertThat(line.get(0), equalTo("ENSG00000000001.4"));
            assertThat(line.get(1), equalTo("XIST"));
            assertThat(line.getDouble(2), closeTo(812.5, 1e-10));
            assertThat(line.getDouble(3), closeTo(-7.25, 1e-10));
            assertThat(line.getDouble(7), closeTo(2e-28, 1e-40));
            assertThat(line.get(8), equalTo("Female"));
            line = reader.next();
            assertThat(line.get(1), equalTo("NA"));
            for (int i = 3; i <= 7; i++)
                assertThat(line.get(i), equalTo("NA"));
            assertThat(line.get(8), equalTo("NO"));
            assertThat(reader.hasNext(), equalTo(false));
        }
    }

    @Test
    public void testEnrichmentReport() throws IOException {
        OntologyGeneSets sets = new OntologyGeneSets();
        List<String> universe = new ArrayList<String>();
        for (int i = 1; i <= 50; i++) {
            String gene = "G" + i;
            universe.add(gene);
            if (i <= 12)
                sets.add("GO:1", "sex determination", gene);
        }
        GeneAnnotation annotation = new GeneAnnotation();
        annotation.put("G2", "SRY");
        List<EnrichmentResult> results = new EnrichmentEngine(sets, 10, 500).enrich(Arrays.asList("G2", "G1", "G40"),
                universe, annotation);
        ByteArrayOutputStream outStream = new ByteArrayOutputStream();
        try (EnrichmentReporter reporter = new EnrichmentReporter(outStream)) {
            reporter.writeAll(results);
        }
        try (TabbedLineReader reader = new TabbedLineReader(new ByteArrayInputStream(outStream.toByteArray()))) {
            int genesCol = reader.findField("genes");
            TabbedLineReader.Line line = reader.next();
            assertThat(line.get(reader.findField("term_id")), equalTo("GO:1"));
            assertThat(line.getInt(reader.findField("list_count")), equalTo(2));
            assertThat(line.getInt(reader.findField("background_count")), equalTo(12));
            assertThat(line.get(genesCol), equalTo("SRY/G1"));
            assertThat(reader.hasNext(), equalTo(false));
        }
        // An empty report still has its header.
        outStream = new ByteArrayOutputStream();
        try (EnrichmentReporter reporter = new EnrichmentReporter(outStream)) {
            reporter.writeAll(new ArrayList<EnrichmentResult>());
        }
        String text = outStream.toString("UTF-8");
        assertThat(text, startsWith("term_id\tterm_name"));
        assertThat(text.trim().split("\n").length, equalTo(1));
    }

}
