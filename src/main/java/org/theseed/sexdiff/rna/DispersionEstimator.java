/**
 *
 */
package org.theseed.sexdiff.rna;

import java.util.Arrays;
import java.util.concurrent.ExecutorService;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.samples.Design;

/**
 * This object estimates the negative binomial dispersion for each gene in a cohort.  The estimation has three
 * phases.  First, a gene-wise estimate is computed for each gene independently.  Second, a trend of dispersion
 * against mean normalized count is fitted across all genes.  Third, each gene's dispersion is shrunk toward the
 * trend by maximizing the Cox-Reid adjusted likelihood plus a log-normal prior centered on the trend.  Genes
 * whose gene-wise estimate lies far above the trend keep the gene-wise estimate.
 *
 * The first and third phases run in parallel batches.  The trend fit is a barrier between them.
 *
 * @author Bruce Parrello
 *
 */
public class DispersionEstimator {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DispersionEstimator.class);
    /** method for gene-wise estimates */
    private final Method method;
    /** type of trend to fit */
    private final DispersionTrend.Type trendType;
    /** minimum dispersion */
    public static final double MIN_DISP = 1e-8;
    /** minimum prior variance of the log dispersion */
    public static final double MIN_PRIOR_VAR = 0.25;
    /** number of residual standard deviations (log scale) above the trend for a gene to be considered an outlier */
    public static final double OUTLIER_SD = 2.0;
    /** scale factor to convert a median absolute deviation into a standard deviation estimate */
    public static final double MAD_SCALE = 1.4826;
    /** number of grid points used to bracket a likelihood maximum */
    private static final int GRID_SIZE = 20;
    /** maximum number of optimizer evaluations */
    private static final int MAX_EVAL = 200;

    /**
     * Enumeration of the gene-wise estimation methods.
     */
    public static enum Method {
        /** method of moments from the mean and variance of the normalized counts */
        MOMENTS,
        /** method-of-moments start refined by maximizing the Cox-Reid adjusted likelihood */
        LIKELIHOOD;
    }

    /**
     * Construct a dispersion estimator.
     *
     * @param method		gene-wise estimation method
     * @param trendType		type of trend to fit
     */
    public DispersionEstimator(Method method, DispersionTrend.Type trendType) {
        this.method = method;
        this.trendType = trendType;
    }

    /**
     * Compute the dispersion estimates for a cohort.
     *
     * @param matrix	count matrix for the cohort
     * @param sizes		size factors for the cohort samples
     * @param design	model design for the cohort
     * @param pool		thread pool for the per-gene phases
     *
     * @return the dispersion estimates
     */
    public DispersionEstimate estimate(CountMatrix matrix, SizeFactors sizes, Design design, ExecutorService pool) {
        final int nGenes = matrix.height();
        final int nSamples = matrix.width();
        final double maxDisp = Math.max(10.0, nSamples);
        final double meanRecip = sizes.meanReciprocal();
        DispersionEstimate retVal = new DispersionEstimate(nGenes);
        // Phase 1:  gene-wise estimates.
        log.info("Computing gene-wise dispersions for {} genes using {} method.", nGenes, this.method);
        GeneBatches.run(pool, nGenes, i -> this.estimateGeneWise(matrix, i, sizes, design, meanRecip, maxDisp, retVal));
        int excluded = retVal.getExcludedCount();
        if (excluded > 0)
            log.info("{} genes with all-zero counts or zero variance excluded from testing.", excluded);
        if (excluded == nGenes) {
            log.warn("No testable genes found in cohort.");
            retVal.setTrend(new DispersionTrend.Constant(Double.NaN), true);
            GeneBatches.run(pool, nGenes, i -> retVal.setFinal(i, Double.NaN, Double.NaN, false, false));
            return retVal;
        }
        // Phase 2:  the trend.  This needs all the gene-wise estimates.
        this.fitTrend(retVal);
        final DispersionTrend trend = retVal.getTrend();
        // Compute the prior variance from the residuals around the trend.
        this.computePrior(retVal, design);
        final double outlierLimit = OUTLIER_SD * Math.sqrt(retVal.getLogResidualVar());
        final double priorVar = retVal.getPriorVar();
        // Phase 3:  shrink toward the trend.
        log.info("Computing final dispersions with prior variance {}.", priorVar);
        GeneBatches.run(pool, nGenes, i -> this.shrink(matrix, i, sizes, design, trend, priorVar, outlierLimit,
                maxDisp, retVal));
        log.info("{} dispersion outliers retained gene-wise estimates.  {} MAP failures.", retVal.getOutlierCount(),
                retVal.getMapFailureCount());
        return retVal;
    }

    /**
     * Compute the normalized-count statistics and gene-wise dispersion for one gene.
     *
     * @param matrix		count matrix
     * @param i				row index of the gene
     * @param sizes			size factors
     * @param design		model design
     * @param meanRecip		mean of the reciprocal size factors
     * @param maxDisp		maximum dispersion
     * @param result		estimate object to update
     */
    private void estimateGeneWise(CountMatrix matrix, int i, SizeFactors sizes, Design design, double meanRecip,
            double maxDisp, DispersionEstimate result) {
        double[] y = toDoubles(matrix.getRow(i));
        final int n = y.length;
        double total = 0.0;
        for (int j = 0; j < n; j++)
            total += y[j] / sizes.get(j);
        double mean = total / n;
        double sq = 0.0;
        for (int j = 0; j < n; j++) {
            double diff = y[j] / sizes.get(j) - mean;
            sq += diff * diff;
        }
        double var = (n > 1 ? sq / (n - 1) : 0.0);
        result.setBaseStats(i, mean, var);
        if (result.isExcluded(i)) {
            result.setGeneWise(i, Double.NaN);
        } else {
            double disp = clamp((var - meanRecip * mean) / (mean * mean), maxDisp);
            if (this.method == Method.LIKELIHOOD) {
                final double[] mu = NegBinomial.groupMeans(y, sizes, design);
                UnivariateFunction f = a -> {
                    double alpha = Math.exp(a);
                    return NegBinomial.logLikelihood(y, mu, alpha) + NegBinomial.coxReid(mu, alpha, design);
                };
                double refined = maximize(f, Math.log(disp), maxDisp);
                if (Double.isFinite(refined))
                    disp = clamp(refined, maxDisp);
            }
            result.setGeneWise(i, disp);
        }
    }

    /**
     * Fit the dispersion trend.  If the fit fails, a constant trend at the median gene-wise dispersion is used
     * instead.
     *
     * @param result	estimate object containing the gene-wise estimates
     */
    private void fitTrend(DispersionEstimate result) {
        final int nGenes = result.size();
        double[] allDisps = new double[nGenes];
        double[] means = new double[nGenes];
        double[] disps = new double[nGenes];
        int nAll = 0;
        int n = 0;
        for (int i = 0; i < nGenes; i++) {
            if (! result.isExcluded(i)) {
                double disp = result.getGeneWise(i);
                allDisps[nAll] = disp;
                nAll++;
                if (disp >= 100 * MIN_DISP) {
                    means[n] = result.getBaseMean(i);
                    disps[n] = disp;
                    n++;
                }
            }
        }
        DispersionTrend trend;
        boolean fallback = false;
        try {
            if (n == 0)
                throw new TrendFitException("No genes have a gene-wise dispersion large enough for trend fitting.");
            trend = this.trendType.fit(Arrays.copyOf(means, n), Arrays.copyOf(disps, n));
        } catch (TrendFitException e) {
            log.warn("Dispersion trend fit failed: {}  Using the median gene-wise dispersion instead.", e.getMessage());
            trend = DispersionTrend.Constant.median(Arrays.copyOf(allDisps, nAll));
            fallback = true;
        }
        log.info("Dispersion trend is {}.", trend.describe());
        result.setTrend(trend, fallback);
    }

    /**
     * Compute the prior variance of the log dispersion.  This is the observed variance of the log residuals around
     * the trend, less the variance expected from sampling alone.
     *
     * @param result	estimate object containing the gene-wise estimates and trend
     * @param design	model design
     */
    private void computePrior(DispersionEstimate result, Design design) {
        final int nGenes = result.size();
        DispersionTrend trend = result.getTrend();
        double[] residuals = new double[nGenes];
        int n = 0;
        for (int i = 0; i < nGenes; i++) {
            if (! result.isExcluded(i) && result.getGeneWise(i) >= 100 * MIN_DISP) {
                residuals[n] = Math.log(result.getGeneWise(i)) - Math.log(trend.getValue(result.getBaseMean(i)));
                n++;
            }
        }
        double residVar = Double.NaN;
        if (n > 1) {
            double[] resids = Arrays.copyOf(residuals, n);
            Median median = new Median();
            double center = median.evaluate(resids);
            for (int k = 0; k < n; k++)
                resids[k] = Math.abs(resids[k] - center);
            double mad = MAD_SCALE * median.evaluate(resids);
            residVar = mad * mad;
        }
        int df = design.getResidualDf();
        double expected = (df > 0 ? Gamma.trigamma(df / 2.0) : Double.POSITIVE_INFINITY);
        double priorVar = MIN_PRIOR_VAR;
        if (Double.isFinite(residVar))
            priorVar = Math.max(residVar - expected, MIN_PRIOR_VAR);
        result.setPrior(residVar, priorVar);
    }

    /**
     * Compute the final dispersion for a gene.
     *
     * @param matrix		count matrix
     * @param i				row index of the gene
     * @param sizes			size factors
     * @param design		model design
     * @param trend			fitted trend
     * @param priorVar		prior variance of the log dispersion
     * @param outlierLimit	log distance above the trend at which a gene is an outlier
     * @param maxDisp		maximum dispersion
     * @param result		estimate object to update
     */
    private void shrink(CountMatrix matrix, int i, SizeFactors sizes, Design design, DispersionTrend trend,
            double priorVar, double outlierLimit, double maxDisp, DispersionEstimate result) {
        if (result.isExcluded(i)) {
            result.setFinal(i, Double.NaN, Double.NaN, false, false);
        } else {
            double trendValue = trend.getValue(result.getBaseMean(i));
            double geneWise = result.getGeneWise(i);
            if (Math.log(geneWise) > Math.log(trendValue) + outlierLimit) {
                result.setFinal(i, trendValue, geneWise, true, false);
            } else {
                final double[] y = toDoubles(matrix.getRow(i));
                final double[] mu = NegBinomial.groupMeans(y, sizes, design);
                final double logTrend = Math.log(trendValue);
                UnivariateFunction f = a -> {
                    double alpha = Math.exp(a);
                    double dev = a - logTrend;
                    return NegBinomial.logLikelihood(y, mu, alpha) + NegBinomial.coxReid(mu, alpha, design)
                            - dev * dev / (2.0 * priorVar);
                };
                double map = maximize(f, logTrend, maxDisp);
                if (Double.isFinite(map))
                    result.setFinal(i, trendValue, clamp(map, maxDisp), false, false);
                else
                    result.setFinal(i, trendValue, clamp(trendValue, maxDisp), false, true);
            }
        }
    }

    /**
     * Find the dispersion that maximizes a function of the log dispersion.  A coarse grid is used to bracket
     * the maximum, and then Brent's method refines it.
     *
     * @param f			function of the log dispersion to maximize
     * @param start		log of the starting dispersion
     * @param maxDisp	maximum dispersion
     *
     * @return the optimal dispersion, or NaN if the optimization failed
     */
    private static double maximize(UnivariateFunction f, double start, double maxDisp) {
        double retVal = Double.NaN;
        final double lo = Math.log(MIN_DISP / 10.0);
        final double hi = Math.log(maxDisp);
        final double step = (hi - lo) / (GRID_SIZE - 1);
        double bestX = Math.min(hi, Math.max(lo, start));
        double bestY = f.value(bestX);
        for (int k = 0; k < GRID_SIZE; k++) {
            double x = lo + k * step;
            double y = f.value(x);
            if (! Double.isNaN(y) && (y > bestY || Double.isNaN(bestY))) {
                bestX = x;
                bestY = y;
            }
        }
        if (Double.isFinite(bestY)) {
            double a = Math.max(lo, bestX - step);
            double b = Math.min(hi, bestX + step);
            try {
                BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-12);
                UnivariatePointValuePair best = optimizer.optimize(new MaxEval(MAX_EVAL),
                        new UnivariateObjectiveFunction(f), GoalType.MAXIMIZE, new SearchInterval(a, b, bestX));
                double x = (best.getValue() >= bestY ? best.getPoint() : bestX);
                retVal = Math.exp(x);
            } catch (MathIllegalStateException e) {
                log.debug("Dispersion optimization failed: {}", e.getMessage());
            }
        }
        return retVal;
    }

    /**
     * @return a dispersion clamped to the legal range
     *
     * @param disp		dispersion to clamp
     * @param maxDisp	maximum dispersion
     */
    private static double clamp(double disp, double maxDisp) {
        double retVal = disp;
        if (! (retVal >= MIN_DISP))
            retVal = MIN_DISP;
        else if (retVal > maxDisp)
            retVal = maxDisp;
        return retVal;
    }

    /**
     * @return a count array converted to floating-point
     *
     * @param counts	array to convert
     */
    protected static double[] toDoubles(int[] counts) {
        double[] retVal = new double[counts.length];
        for (int j = 0; j < counts.length; j++)
            retVal[j] = counts[j];
        return retVal;
    }

}
