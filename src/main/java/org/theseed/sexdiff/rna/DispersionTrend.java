/**
 *
 */
package org.theseed.sexdiff.rna;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * This is the base class for a dispersion trend.  The trend gives the expected dispersion for a gene as a
 * function of its mean normalized count.
 *
 * @author Bruce Parrello
 *
 */
public abstract class DispersionTrend {

    /**
     * @return the trend dispersion for a mean normalized count
     *
     * @param mean	mean normalized count of the gene
     */
    public abstract double getValue(double mean);

    /**
     * @return a description of the trend for the log
     */
    public abstract String describe();

    /**
     * Enumeration of the trend types.
     */
    public static enum Type {
        PARAMETRIC {
            @Override
            public DispersionTrend fit(double[] means, double[] disps) throws TrendFitException {
                return Parametric.fit(means, disps);
            }
        }, MEDIAN {
            @Override
            public DispersionTrend fit(double[] means, double[] disps) {
                return Constant.median(disps);
            }
        };

        /**
         * Fit a trend of this type.
         *
         * @param means		mean normalized count for each gene
         * @param disps		gene-wise dispersion for each gene
         *
         * @return the fitted trend
         *
         * @throws TrendFitException	if the fit fails
         */
        public abstract DispersionTrend fit(double[] means, double[] disps) throws TrendFitException;

    }

    /**
     * This trend has the form asymptDisp + extraPois / mean.  It is fitted with a gamma-family GLM using the
     * identity link, and the fit is repeated with genes whose dispersion is far from the curve removed until the
     * coefficients settle.
     */
    public static class Parametric extends DispersionTrend {

        /** asymptotic dispersion for high counts */
        private final double asymptDisp;
        /** extra-Poisson coefficient */
        private final double extraPois;
        /** minimum ratio of gene-wise dispersion to trend for a gene to be used in the fit */
        public static final double MIN_RESIDUAL = 1e-4;
        /** maximum ratio of gene-wise dispersion to trend for a gene to be used in the fit */
        public static final double MAX_RESIDUAL = 15.0;
        /** maximum number of outlier-removal rounds */
        public static final int MAX_ROUNDS = 10;
        /** maximum number of IRLS iterations in a single GLM fit */
        public static final int MAX_GLM_ITER = 50;
        /** number of trend coefficients */
        public static final int NUM_COEFFS = 2;
        /** convergence limit for the coefficient change between rounds */
        public static final double ROUND_TOL = 1e-6;

        public Parametric(double asymptDisp, double extraPois) {
            this.asymptDisp = asymptDisp;
            this.extraPois = extraPois;
        }

        /**
         * Fit a parametric trend to gene-wise dispersions.
         *
         * @param means		mean normalized count for each gene
         * @param disps		gene-wise dispersion for each gene
         *
         * @return the fitted trend
         *
         * @throws TrendFitException	if the fit fails to produce positive coefficients or does not converge
         */
        public static Parametric fit(double[] means, double[] disps) throws TrendFitException {
            double[] coeffs = new double[] { 0.1, 1.0 };
            double[] goodMeans = new double[means.length];
            double[] goodDisps = new double[means.length];
            int round = 0;
            boolean done = false;
            while (! done) {
                round++;
                // Select the genes close enough to the current curve.
                int n = 0;
                for (int i = 0; i < means.length; i++) {
                    double ratio = disps[i] / (coeffs[0] + coeffs[1] / means[i]);
                    if (ratio > MIN_RESIDUAL && ratio < MAX_RESIDUAL) {
                        goodMeans[n] = means[i];
                        goodDisps[n] = disps[i];
                        n++;
                    }
                }
                if (n <= NUM_COEFFS)
                    throw new TrendFitException("Too few genes (" + n + ") near the dispersion trend.");
                double[] newCoeffs = gammaFit(goodMeans, goodDisps, n, coeffs);
                if (! (newCoeffs[0] > 0.0 && newCoeffs[1] > 0.0))
                    throw new TrendFitException(String.format("Parametric dispersion fit failed:  coefficients %g and %g.",
                            newCoeffs[0], newCoeffs[1]));
                double change = Math.abs(Math.log(newCoeffs[0] / coeffs[0])) + Math.abs(Math.log(newCoeffs[1] / coeffs[1]));
                coeffs = newCoeffs;
                if (change < ROUND_TOL)
                    done = true;
                else if (round >= MAX_ROUNDS)
                    throw new TrendFitException("Parametric dispersion fit did not converge after " + round + " rounds.");
            }
            return new Parametric(coeffs[0], coeffs[1]);
        }

        /**
         * Fit a gamma-family GLM with identity link of dispersion against 1 / mean.
         *
         * @param means		array of mean counts
         * @param disps		array of dispersions
         * @param n			number of array entries to use
         * @param start		starting coefficients
         *
         * @return the fitted coefficients
         *
         * @throws TrendFitException	if the fitted values leave the valid range or the system is singular
         */
        private static double[] gammaFit(double[] means, double[] disps, int n, double[] start) throws TrendFitException {
            double[] retVal = start.clone();
            boolean converged = false;
            for (int iter = 0; ! converged && iter < MAX_GLM_ITER; iter++) {
                double sw = 0.0, swx = 0.0, swxx = 0.0, swy = 0.0, swxy = 0.0;
                for (int i = 0; i < n; i++) {
                    double x = 1.0 / means[i];
                    double mu = retVal[0] + retVal[1] * x;
                    if (! (mu > 0.0))
                        throw new TrendFitException("Dispersion trend GLM produced a nonpositive fitted value.");
                    // Gamma variance is proportional to mu squared.
                    double w = 1.0 / (mu * mu);
                    sw += w;
                    swx += w * x;
                    swxx += w * x * x;
                    swy += w * disps[i];
                    swxy += w * x * disps[i];
                }
                RealMatrix xtwx = new Array2DRowRealMatrix(new double[][] { { sw, swx }, { swx, swxx } });
                RealVector xtwy = new ArrayRealVector(new double[] { swy, swxy });
                double[] next;
                try {
                    next = new LUDecomposition(xtwx).getSolver().solve(xtwy).toArray();
                } catch (SingularMatrixException e) {
                    throw new TrendFitException("Dispersion trend GLM is singular.");
                }
                converged = true;
                for (int k = 0; k < next.length; k++) {
                    if (Math.abs(next[k] - retVal[k]) > 1e-8 * (Math.abs(retVal[k]) + 1e-8))
                        converged = false;
                }
                retVal = next;
            }
            if (! converged)
                throw new TrendFitException("Dispersion trend GLM did not converge.");
            return retVal;
        }

        @Override
        public double getValue(double mean) {
            return this.asymptDisp + this.extraPois / mean;
        }

        @Override
        public String describe() {
            return String.format("parametric trend %.6g + %.6g / mean", this.asymptDisp, this.extraPois);
        }

        /**
         * @return the asymptotic dispersion
         */
        public double getAsymptDisp() {
            return this.asymptDisp;
        }

        /**
         * @return the extra-Poisson coefficient
         */
        public double getExtraPois() {
            return this.extraPois;
        }

    }

    /**
     * This trend is a constant.  It is used when the parametric fit fails, with the median gene-wise dispersion
     * as the value.
     */
    public static class Constant extends DispersionTrend {

        /** dispersion value */
        private final double value;

        public Constant(double value) {
            this.value = value;
        }

        /**
         * @return a constant trend at the median of the specified dispersions
         *
         * @param disps		gene-wise dispersions
         */
        public static Constant median(double[] disps) {
            return new Constant(new Median().evaluate(disps));
        }

        @Override
        public double getValue(double mean) {
            return this.value;
        }

        @Override
        public String describe() {
            return String.format("constant trend %.6g", this.value);
        }

    }

}
