/**
 *
 */
package org.theseed.sexdiff.rna;

import java.util.concurrent.ExecutorService;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.samples.Design;

/**
 * This object fits a negative binomial GLM with a log link to each gene and performs the Wald test on the sex
 * coefficient.  The design has an intercept and a male indicator, the size factors enter as an offset, and the
 * dispersion is held fixed at its final estimate.  The fit uses iteratively reweighted least squares with a very
 * small ridge penalty so that genes with no counts in one sex still get finite coefficients.
 *
 * @author Bruce Parrello
 *
 */
public class GlmFitter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(GlmFitter.class);
    /** maximum number of IRLS iterations */
    private final int maxIter;
    /** convergence tolerance for the coefficient change, on the log2 scale */
    private final double tolerance;
    /** standard normal distribution for p-values */
    private final NormalDistribution normal;
    /** ridge penalty on the log2-scale coefficients */
    public static final double RIDGE = 1e-6;
    /** natural log of 2 */
    public static final double LN2 = Math.log(2.0);
    /** default maximum iterations */
    public static final int DEFAULT_MAX_ITER = 100;
    /** default tolerance */
    public static final double DEFAULT_TOLERANCE = 1e-6;

    /**
     * Construct a GLM fitter.
     *
     * @param maxIter		maximum number of IRLS iterations
     * @param tolerance		convergence limit for the largest coefficient change (log2 scale)
     */
    public GlmFitter(int maxIter, double tolerance) {
        this.maxIter = maxIter;
        this.tolerance = tolerance;
        this.normal = new NormalDistribution(null, 0.0, 1.0);
    }

    /**
     * Fit the model for every gene.
     *
     * @param matrix	count matrix
     * @param sizes		size factors
     * @param disps		dispersion estimates
     * @param design	model design
     * @param pool		thread pool for the gene batches
     *
     * @return an array of gene fits, in row order
     */
    public GeneFit[] fit(CountMatrix matrix, SizeFactors sizes, DispersionEstimate disps, Design design,
            ExecutorService pool) {
        final int nGenes = matrix.height();
        GeneFit[] retVal = new GeneFit[nGenes];
        log.info("Fitting models for {} genes.", nGenes);
        GeneBatches.run(pool, nGenes, i -> retVal[i] = this.fitGene(matrix, i, sizes, disps, design));
        int failed = 0;
        for (GeneFit fit : retVal) {
            if (fit.getStatus() == GeneFit.Status.NON_CONVERGED) {
                failed++;
                log.debug("Gene {} not converged: {}", fit.getGeneId(), fit.getReason());
            }
        }
        if (failed > 0)
            log.warn("{} gene fits did not converge and will have NA results.", failed);
        return retVal;
    }

    /**
     * Fit the model for a single gene.
     *
     * @param matrix	count matrix
     * @param i			row index of the gene
     * @param sizes		size factors
     * @param disps		dispersion estimates
     * @param design	model design
     *
     * @return the fit for the gene
     */
    public GeneFit fitGene(CountMatrix matrix, int i, SizeFactors sizes, DispersionEstimate disps, Design design) {
        GeneFit retVal = new GeneFit(matrix.getGeneId(i), disps.getBaseMean(i));
        if (! (disps.getBaseMean(i) > 0.0))
            retVal.exclude("all-zero counts");
        else if (disps.isExcluded(i))
            retVal.exclude("zero variance");
        else if (! Double.isFinite(disps.get(i)))
            retVal.exclude("no dispersion estimate");
        else
            this.irls(retVal, matrix.getRow(i), sizes, disps.get(i), design);
        return retVal;
    }

    /**
     * Perform the IRLS fit and the Wald test.
     *
     * @param fit		fit tracker for the gene
     * @param y			counts for the gene
     * @param sizes		size factors
     * @param alpha		dispersion for the gene
     * @param design	model design
     */
    private void irls(GeneFit fit, int[] y, SizeFactors sizes, double alpha, Design design) {
        final int n = y.length;
        final double lambda = RIDGE / (LN2 * LN2);
        // Initialize the coefficients from the group means.
        double[] groupTotals = new double[Design.NUM_COEFFS];
        for (int j = 0; j < n; j++)
            groupTotals[design.getLevel(j)] += y[j] / sizes.get(j);
        double femaleMean = groupTotals[0] / design.getFemaleCount();
        double maleMean = groupTotals[1] / design.getMaleCount();
        double[] beta = new double[] { Math.log(femaleMean + 0.1), Math.log(maleMean + 0.1) - Math.log(femaleMean + 0.1) };
        double[] mu = new double[n];
        boolean converged = false;
        try {
            while (! converged && fit.getIterations() < this.maxIter) {
                fit.iterate();
                this.computeMu(beta, sizes, design, mu);
                double sw = 0.0, swm = 0.0, swz = 0.0, swzm = 0.0;
                for (int j = 0; j < n; j++) {
                    double w = NegBinomial.weight(mu[j], alpha);
                    double z = Math.log(mu[j] / sizes.get(j)) + (y[j] - mu[j]) / mu[j];
                    sw += w;
                    swz += w * z;
                    if (design.isMale(j)) {
                        swm += w;
                        swzm += w * z;
                    }
                }
                RealMatrix lhs = new Array2DRowRealMatrix(new double[][] { { sw + lambda, swm }, { swm, swm + lambda } });
                double[] next = new LUDecomposition(lhs).getSolver().solve(new ArrayRealVector(new double[] { swz, swzm }))
                        .toArray();
                if (! Double.isFinite(next[0]) || ! Double.isFinite(next[1]))
                    throw new SingularMatrixException();
                double change = Math.max(Math.abs(next[0] - beta[0]), Math.abs(next[1] - beta[1])) / LN2;
                beta = next;
                converged = (change < this.tolerance);
            }
        } catch (SingularMatrixException e) {
            fit.fail("singular weighted design matrix");
            return;
        }
        if (! converged) {
            fit.fail("no convergence after " + this.maxIter + " iterations");
        } else {
            // Compute the sandwich covariance of the ridge estimate.
            this.computeMu(beta, sizes, design, mu);
            double sw = 0.0, swm = 0.0;
            for (int j = 0; j < n; j++) {
                double w = NegBinomial.weight(mu[j], alpha);
                sw += w;
                if (design.isMale(j))
                    swm += w;
            }
            RealMatrix info = new Array2DRowRealMatrix(new double[][] { { sw, swm }, { swm, swm } });
            RealMatrix ridged = new Array2DRowRealMatrix(new double[][] { { sw + lambda, swm }, { swm, swm + lambda } });
            double variance;
            try {
                RealMatrix inverse = new LUDecomposition(ridged).getSolver().getInverse();
                variance = inverse.multiply(info).multiply(inverse).getEntry(1, 1);
            } catch (SingularMatrixException e) {
                variance = Double.NaN;
            }
            double se = Math.sqrt(variance);
            if (! (se > 0.0) || Double.isInfinite(se)) {
                fit.fail("invalid standard error");
            } else {
                double stat = beta[1] / se;
                double pvalue = 2.0 * this.normal.cumulativeProbability(-Math.abs(stat));
                fit.converge(beta[1] / LN2, se / LN2, stat, pvalue);
            }
        }
    }

    /**
     * Compute the fitted means for a coefficient vector.
     *
     * @param beta		intercept and male coefficient (natural log scale)
     * @param sizes		size factors
     * @param design	model design
     * @param mu		array to receive the fitted means
     */
    private void computeMu(double[] beta, SizeFactors sizes, Design design, double[] mu) {
        for (int j = 0; j < mu.length; j++) {
            double eta = beta[0] + (design.isMale(j) ? beta[1] : 0.0);
            mu[j] = Math.max(NegBinomial.MIN_MU, sizes.get(j) * Math.exp(eta));
        }
    }

}
