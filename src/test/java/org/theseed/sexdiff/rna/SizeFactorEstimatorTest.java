/**
 *
 */
package org.theseed.sexdiff.rna;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.samples.CohortException;

/**
 * @author Bruce Parrello
 *
 */
public class SizeFactorEstimatorTest {

    @Test
    public void testKnownFactors() throws CohortException {
        CountMatrix matrix = new CountMatrix(new String[] { "g1", "g2", "g3", "g4" }, new String[] { "A", "B", "C" },
                new int[][] { { 10, 20, 40 }, { 5, 10, 20 }, { 100, 200, 400 }, { 0, 5, 6 } });
        SizeFactors sizes = new SizeFactorEstimator().estimate(matrix);
        assertThat(sizes.size(), equalTo(3));
        assertThat(sizes.getSampleId(1), equalTo("B"));
        assertThat(sizes.get(0), closeTo(0.5, 1e-10));
        assertThat(sizes.get(1), closeTo(1.0, 1e-10));
        assertThat(sizes.get(2), closeTo(2.0, 1e-10));
        assertThat(sizes.geometricMean(), closeTo(1.0, 1e-10));
        assertThat(sizes.normalize(40, 2), closeTo(20.0, 1e-10));
        assertThat(sizes.meanReciprocal(), closeTo(3.5 / 3.0, 1e-10));
        double[] factors = sizes.toArray();
        factors[0] = 100.0;
        assertThat(sizes.get(0), closeTo(0.5, 1e-10));
    }

    @Test
    public void testScaling() throws IOException, CohortException {
        CountMatrix matrix = CountMatrix.load(new File("data", "counts.tsv"));
        SizeFactorEstimator estimator = new SizeFactorEstimator();
        SizeFactors sizes = estimator.estimate(matrix);
        for (int j = 0; j < sizes.size(); j++)
            assertThat(sizes.getSampleId(j), sizes.get(j), greaterThan(0.0));
        // Double every count in the first sample.
        final int nGenes = matrix.height();
        final int nSamples = matrix.width();
        int[][] counts = new int[nGenes][];
        String[] genes = new String[nGenes];
        for (int i = 0; i < nGenes; i++) {
            counts[i] = matrix.getRow(i);
            counts[i][0] *= 2;
            genes[i] = matrix.getGeneId(i);
        }
        CountMatrix scaled = new CountMatrix(genes, matrix.getSampleIds().toArray(new String[nSamples]), counts);
        SizeFactors scaledSizes = estimator.estimate(scaled);
        for (int j = 1; j < nSamples; j++) {
            double oldRatio = sizes.get(0) / sizes.get(j);
            double newRatio = scaledSizes.get(0) / scaledSizes.get(j);
            assertThat(matrix.getSampleId(j), newRatio, closeTo(2.0 * oldRatio, 1e-8));
        }
        // The original matrix is not modified.
        assertThat(scaled.getCount(0, 0), equalTo(2 * matrix.getCount(0, 0)));
    }

    @Test
    public void testNoUsableGenes() {
        CountMatrix matrix = new CountMatrix(new String[] { "g1", "g2" }, new String[] { "A", "B" },
                new int[][] { { 0, 20 }, { 5, 0 } });
        assertThrows(CohortException.class, () -> new SizeFactorEstimator().estimate(matrix));
    }

    @Test
    public void testMatrixErrors() {
        assertThrows(IllegalArgumentException.class, () -> new CountMatrix(new String[] { "g1", "g1" },
                new String[] { "A" }, new int[][] { { 1 }, { 2 } }));
        assertThrows(IllegalArgumentException.class, () -> new CountMatrix(new String[] { "g1" },
                new String[] { "A", "B" }, new int[][] { { 1, -2 } }));
        assertThrows(IllegalArgumentException.class, () -> new CountMatrix(new String[] { "g1" },
                new String[] { "A", "B" }, new int[][] { { 1 } }));
        assertThrows(IllegalArgumentException.class, () -> new SizeFactors(new String[] { "A" }, new double[] { 0.0 }));
    }

}
