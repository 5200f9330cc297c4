/**
 *
 */
package org.theseed.sexdiff.rna;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.pipeline.PipelineConfig;
import org.theseed.sexdiff.samples.AgeStratum;
import org.theseed.sexdiff.samples.Cohort;
import org.theseed.sexdiff.samples.CohortException;
import org.theseed.sexdiff.samples.CohortFilter;
import org.theseed.sexdiff.samples.Design;
import org.theseed.sexdiff.samples.SampleMetadata;

/**
 * @author Bruce Parrello
 *
 */
public class DispersionEstimatorTest {

    @Test
    public void testMoments() throws CohortException {
        CountMatrix matrix = new CountMatrix(new String[] { "g1", "g2", "g3", "g4" },
                new String[] { "A", "B", "C", "D" },
                new int[][] { { 10, 20, 30, 40 }, { 100, 120, 90, 110 }, { 5, 5, 5, 5 }, { 0, 0, 0, 0 } });
        SizeFactors sizes = new SizeFactors(new String[] { "A", "B", "C", "D" }, new double[] { 1.0, 1.0, 1.0, 1.0 });
        Design design = Design.of(new boolean[] { true, false, true, false }, "test");
        DispersionEstimator estimator = new DispersionEstimator(DispersionEstimator.Method.MOMENTS,
                DispersionTrend.Type.PARAMETRIC);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        DispersionEstimate disps;
        try {
            disps = estimator.estimate(matrix, sizes, design, pool);
        } finally {
            pool.shutdown();
        }
        assertThat(disps.size(), equalTo(4));
        assertThat(disps.getBaseMean(0), closeTo(25.0, 1e-10));
        assertThat(disps.getBaseVar(0), closeTo(500.0 / 3.0, 1e-8));
        assertThat(disps.getGeneWise(0), closeTo((500.0 / 3.0 - 25.0) / 625.0, 1e-10));
        assertThat(disps.getGeneWise(1), closeTo((500.0 / 3.0 - 105.0) / 11025.0, 1e-10));
        // Constant and all-zero genes are excluded.
        assertThat(disps.isExcluded(0), equalTo(false));
        assertThat(disps.isExcluded(2), equalTo(true));
        assertThat(disps.isExcluded(3), equalTo(true));
        assertThat(disps.getExcludedCount(), equalTo(2));
        assertThat(Double.isNaN(disps.get(2)), equalTo(true));
        assertThat(Double.isNaN(disps.get(3)), equalTo(true));
        // Two genes are not enough for a parametric trend.
        assertThat(disps.isTrendFallback(), equalTo(true));
        assertThat(disps.getTrend(), instanceOf(DispersionTrend.Constant.class));
        for (int i = 0; i < 2; i++) {
            assertThat(disps.get(i), greaterThan(0.0));
            assertThat(disps.getTrendValue(i), greaterThan(0.0));
        }
        assertThat(disps.getPriorVar(), greaterThanOrEqualTo(DispersionEstimator.MIN_PRIOR_VAR));
    }

    @Test
    public void testNothingTestable() throws CohortException {
        CountMatrix matrix = new CountMatrix(new String[] { "g1", "g2" }, new String[] { "A", "B", "C" },
                new int[][] { { 0, 0, 0 }, { 7, 7, 7 } });
        SizeFactors sizes = new SizeFactors(new String[] { "A", "B", "C" }, new double[] { 1.0, 1.0, 1.0 });
        Design design = Design.of(new boolean[] { true, false, false }, "test");
        DispersionEstimator estimator = new DispersionEstimator(DispersionEstimator.Method.LIKELIHOOD,
                DispersionTrend.Type.PARAMETRIC);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        DispersionEstimate disps;
        try {
            disps = estimator.estimate(matrix, sizes, design, pool);
        } finally {
            pool.shutdown();
        }
        assertThat(disps.getExcludedCount(), equalTo(2));
        assertThat(disps.isTrendFallback(), equalTo(true));
        assertThat(Double.isNaN(disps.get(0)), equalTo(true));
        assertThat(Double.isNaN(disps.get(1)), equalTo(true));
    }

    @Test
    public void testCohort() throws IOException, CohortException {
        CountMatrix matrix = CountMatrix.load(new File("data", "counts.tsv"));
        SampleMetadata metadata = SampleMetadata.load(new File("data", "samples.tsv")).alignTo(matrix);
        Cohort cohort = new CohortFilter(new PipelineConfig(), AgeStratum.OLDER).apply(matrix, metadata);
        CountMatrix counts = cohort.getCounts();
        SizeFactors sizes = new SizeFactorEstimator().estimate(counts);
        Design design = Design.create(cohort);
        DispersionEstimator estimator = new DispersionEstimator(DispersionEstimator.Method.LIKELIHOOD,
                DispersionTrend.Type.PARAMETRIC);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        DispersionEstimate disps;
        try {
            disps = estimator.estimate(counts, sizes, design, pool);
        } finally {
            pool.shutdown();
        }
        final int last = counts.height() - 1;
        assertThat(counts.isAllZero(last), equalTo(true));
        assertThat(disps.isExcluded(last), equalTo(true));
        assertThat(disps.getExcludedCount(), equalTo(1));
        int outliers = 0;
        for (int i = 0; i < last; i++) {
            double disp = disps.get(i);
            assertThat(counts.getGeneId(i), disp, greaterThanOrEqualTo(DispersionEstimator.MIN_DISP));
            assertThat(counts.getGeneId(i), disp, lessThanOrEqualTo(10.0));
            assertThat(counts.getGeneId(i), disps.getTrendValue(i), greaterThan(0.0));
            if (disps.isOutlier(i)) {
                outliers++;
                assertThat(disp, equalTo(disps.getGeneWise(i)));
            }
        }
        assertThat(disps.getOutlierCount(), equalTo(outliers));
        assertThat(disps.getPriorVar(), greaterThanOrEqualTo(DispersionEstimator.MIN_PRIOR_VAR));
    }

    @Test
    public void testShrinkage() throws CohortException {
        final int nGenes = 300;
        final int nSamples = 12;
        final int outlierRow = nGenes;
        RandomGenerator rng = new Well19937c(20240611L);
        String[] geneIds = new String[nGenes + 1];
        String[] sampleIds = new String[nSamples];
        boolean[] male = new boolean[nSamples];
        for (int j = 0; j < nSamples; j++) {
            sampleIds[j] = "S" + j;
            male[j] = (j % 2 == 0);
        }
        int[][] counts = new int[nGenes + 1][];
        for (int i = 0; i < nGenes; i++) {
            geneIds[i] = "g" + i;
            double mean = Math.exp(rng.nextDouble() * Math.log(5000.0));
            counts[i] = simulate(rng, mean, 0.05 + 1.0 / mean, nSamples);
        }
        // One well-measured gene with a dispersion far above the trend.
        geneIds[outlierRow] = "wild";
        counts[outlierRow] = simulate(rng, 2000.0, 3.0, nSamples);
        CountMatrix matrix = new CountMatrix(geneIds, sampleIds, counts);
        double[] ones = new double[nSamples];
        Arrays.fill(ones, 1.0);
        SizeFactors sizes = new SizeFactors(sampleIds, ones);
        Design design = Design.of(male, "simulated");
        DispersionEstimator estimator = new DispersionEstimator(DispersionEstimator.Method.LIKELIHOOD,
                DispersionTrend.Type.PARAMETRIC);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        DispersionEstimate disps;
        try {
            disps = estimator.estimate(matrix, sizes, design, pool);
        } finally {
            pool.shutdown();
        }
        assertThat(disps.isTrendFallback(), equalTo(false));
        // The wild gene keeps its own estimate.
        assertThat(disps.isOutlier(outlierRow), equalTo(true));
        assertThat(disps.get(outlierRow), equalTo(disps.getGeneWise(outlierRow)));
        assertThat(disps.get(outlierRow), greaterThan(10.0 * disps.getTrendValue(outlierRow)));
        // Low-count genes move further toward the trend than high-count genes.
        double lowTotal = 0.0;
        int lowCount = 0;
        double highTotal = 0.0;
        int highCount = 0;
        for (int i = 0; i < nGenes; i++) {
            if (! disps.isExcluded(i) && ! disps.isOutlier(i)) {
                double logTrend = Math.log(disps.getTrendValue(i));
                double distance = Math.log(disps.getGeneWise(i)) - logTrend;
                if (Math.abs(distance) > 0.05) {
                    double fraction = 1.0 - (Math.log(disps.get(i)) - logTrend) / distance;
                    double baseMean = disps.getBaseMean(i);
                    if (baseMean < 10.0) {
                        lowTotal += fraction;
                        lowCount++;
                    } else if (baseMean > 500.0) {
                        highTotal += fraction;
                        highCount++;
                    }
                }
            }
        }
        assertThat(lowCount, greaterThan(20));
        assertThat(highCount, greaterThan(20));
        assertThat(lowTotal / lowCount, greaterThan(highTotal / highCount));
    }

    /**
     * @return simulated negative binomial counts for one gene
     *
     * @param rng		random number generator
     * @param mean		expected count
     * @param disp		dispersion
     * @param n			number of samples
     */
    private static int[] simulate(RandomGenerator rng, double mean, double disp, int n) {
        GammaDistribution gamma = new GammaDistribution(rng, 1.0 / disp, mean * disp);
        int[] retVal = new int[n];
        for (int j = 0; j < n; j++) {
            double lambda = gamma.sample();
            retVal[j] = (lambda <= 0.0 ? 0 : new PoissonDistribution(rng, lambda,
                    PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample());
        }
        return retVal;
    }

}
