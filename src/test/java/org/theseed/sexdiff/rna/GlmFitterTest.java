/**
 *
 */
package org.theseed.sexdiff.rna;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;
import org.theseed.sexdiff.samples.Design;
import org.theseed.sexdiff.samples.EmptyCohortException;

/**
 * @author Bruce Parrello
 *
 */
public class GlmFitterTest {

    /** sample IDs for the test matrix */
    private static final String[] SAMPLES = new String[] { "M1", "F1", "M2", "F2", "M3", "F3" };
    /** sex of each test sample */
    private static final boolean[] MALE = new boolean[] { true, false, true, false, true, false };

    /**
     * @return a dispersion estimate with the specified values for each gene
     *
     * @param matrix	count matrix
     * @param sizes		size factors
     * @param disp		dispersion to use for every gene
     */
    private static DispersionEstimate fixedDisps(CountMatrix matrix, SizeFactors sizes, double disp) {
        DispersionEstimate retVal = new DispersionEstimate(matrix.height());
        for (int i = 0; i < matrix.height(); i++) {
            double total = 0.0;
            double sq = 0.0;
            for (int j = 0; j < matrix.width(); j++) {
                double norm = sizes.normalize(matrix.getCount(i, j), j);
                total += norm;
                sq += norm * norm;
            }
            final int n = matrix.width();
            double mean = total / n;
            double var = (sq - n * mean * mean) / (n - 1);
            retVal.setBaseStats(i, mean, var);
            if (retVal.isExcluded(i))
                retVal.setFinal(i, Double.NaN, Double.NaN, false, false);
            else
                retVal.setFinal(i, disp, disp, false, false);
        }
        return retVal;
    }

    @Test
    public void testWaldTest() throws EmptyCohortException {
        CountMatrix matrix = new CountMatrix(new String[] { "up", "none", "zero", "maleless" }, SAMPLES,
                new int[][] { { 100, 20, 120, 25, 80, 15 }, { 50, 50, 55, 45, 50, 50 }, { 0, 0, 0, 0, 0, 0 },
                        { 0, 20, 0, 25, 0, 15 } });
        SizeFactors sizes = new SizeFactors(SAMPLES, new double[] { 1.0, 1.0, 1.0, 1.0, 1.0, 1.0 });
        Design design = Design.of(MALE, "test");
        DispersionEstimate disps = fixedDisps(matrix, sizes, 0.1);
        GlmFitter fitter = new GlmFitter(GlmFitter.DEFAULT_MAX_ITER, GlmFitter.DEFAULT_TOLERANCE);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        GeneFit[] fits;
        try {
            fits = fitter.fit(matrix, sizes, disps, design, pool);
        } finally {
            pool.shutdown();
        }
        assertThat(fits.length, equalTo(4));
        // The male-high gene matches the closed-form answer for a two-group design.
        GeneFit fit = fits[0];
        assertThat(fit.getGeneId(), equalTo("up"));
        assertThat(fit.getStatus(), equalTo(GeneFit.Status.CONVERGED));
        assertThat(fit.getLog2FoldChange(), closeTo(2.321928, 1e-4));
        assertThat(fit.getLfcSE(), closeTo(0.424718, 1e-4));
        assertThat(fit.getStat(), closeTo(5.46699, 1e-3));
        assertThat(fit.getPvalue(), closeTo(4.5775e-8, 1e-9));
        assertThat(fit.getIterations(), lessThanOrEqualTo(GlmFitter.DEFAULT_MAX_ITER));
        // The flat gene has no effect.
        fit = fits[1];
        assertThat(fit.getStatus(), equalTo(GeneFit.Status.CONVERGED));
        assertThat(Math.abs(fit.getLog2FoldChange()), lessThan(0.2));
        assertThat(fit.getPvalue(), greaterThan(0.5));
        // The all-zero gene is not tested.
        fit = fits[2];
        assertThat(fit.getStatus(), equalTo(GeneFit.Status.EXCLUDED));
        assertThat(fit.getReason(), equalTo("all-zero counts"));
        assertThat(Double.isNaN(fit.getLog2FoldChange()), equalTo(true));
        assertThat(Double.isNaN(fit.getPvalue()), equalTo(true));
        // A gene with no male counts still gets a finite estimate.
        fit = fits[3];
        assertThat(fit.getStatus(), equalTo(GeneFit.Status.CONVERGED));
        assertThat(Double.isFinite(fit.getLog2FoldChange()), equalTo(true));
        assertThat(fit.getLog2FoldChange(), lessThan(-3.0));
        assertThat(Double.isFinite(fit.getLfcSE()), equalTo(true));
    }

    @Test
    public void testSizeFactorOffset() throws EmptyCohortException {
        // Doubling both the counts and the size factor of a sample leaves the result unchanged.
        CountMatrix base = new CountMatrix(new String[] { "g" }, SAMPLES, new int[][] { { 100, 20, 120, 25, 80, 15 } });
        CountMatrix doubled = new CountMatrix(new String[] { "g" }, SAMPLES, new int[][] { { 200, 20, 120, 25, 80, 15 } });
        SizeFactors baseSizes = new SizeFactors(SAMPLES, new double[] { 1.0, 1.0, 1.0, 1.0, 1.0, 1.0 });
        SizeFactors doubledSizes = new SizeFactors(SAMPLES, new double[] { 2.0, 1.0, 1.0, 1.0, 1.0, 1.0 });
        Design design = Design.of(MALE, "test");
        GlmFitter fitter = new GlmFitter(GlmFitter.DEFAULT_MAX_ITER, GlmFitter.DEFAULT_TOLERANCE);
        GeneFit fit1 = fitter.fitGene(base, 0, baseSizes, fixedDisps(base, baseSizes, 0.1), design);
        GeneFit fit2 = fitter.fitGene(doubled, 0, doubledSizes, fixedDisps(doubled, doubledSizes, 0.1), design);
        assertThat(fit2.getLog2FoldChange(), closeTo(fit1.getLog2FoldChange(), 0.05));
    }

    @Test
    public void testNonConvergence() throws EmptyCohortException {
        CountMatrix matrix = new CountMatrix(new String[] { "up" }, SAMPLES, new int[][] { { 100, 20, 120, 25, 80, 15 } });
        SizeFactors sizes = new SizeFactors(SAMPLES, new double[] { 1.0, 1.0, 1.0, 1.0, 1.0, 1.0 });
        Design design = Design.of(MALE, "test");
        GlmFitter fitter = new GlmFitter(1, GlmFitter.DEFAULT_TOLERANCE);
        GeneFit fit = fitter.fitGene(matrix, 0, sizes, fixedDisps(matrix, sizes, 0.1), design);
        assertThat(fit.getStatus(), equalTo(GeneFit.Status.NON_CONVERGED));
        assertThat(fit.getIterations(), equalTo(1));
        assertThat(Double.isNaN(fit.getPvalue()), equalTo(true));
        assertThat(Double.isNaN(fit.getStat()), equalTo(true));
        // A finished fit cannot change state.
        assertThrows(IllegalStateException.class, () -> fit.converge(1.0, 1.0, 1.0, 0.5));
        assertThrows(IllegalStateException.class, () -> fit.iterate());
    }

}
