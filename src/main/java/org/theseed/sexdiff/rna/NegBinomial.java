/**
 *
 */
package org.theseed.sexdiff.rna;

import org.apache.commons.math3.special.Gamma;
import org.theseed.sexdiff.samples.Design;

/**
 * This class contains the negative binomial likelihood computations used for dispersion estimation.  The
 * variance model is var = mu + alpha * mu^2.
 *
 * @author Bruce Parrello
 *
 */
public class NegBinomial {

    /** minimum fitted mean used in likelihood and weight computations */
    public static final double MIN_MU = 0.5;

    /**
     * Compute the log likelihood of a set of counts, dropping terms that do not depend on the dispersion.
     *
     * @param y			observed counts
     * @param mu		fitted means
     * @param alpha		dispersion
     *
     * @return the log likelihood, up to an additive constant
     */
    public static double logLikelihood(double[] y, double[] mu, double alpha) {
        final double r = 1.0 / alpha;
        final double logR = Math.log(r);
        final double lgR = Gamma.logGamma(r);
        double retVal = 0.0;
        for (int j = 0; j < y.length; j++) {
            retVal += Gamma.logGamma(y[j] + r) - lgR - y[j] * logR - (r + y[j]) * Math.log1p(mu[j] * alpha);
        }
        return retVal;
    }

    /**
     * Compute the Cox-Reid adjustment term for a dispersion.  For the two-level design, the information matrix
     * determinant is the product of the weight totals for the two levels.
     *
     * @param mu		fitted means
     * @param alpha		dispersion
     * @param design	model design
     *
     * @return the Cox-Reid adjustment to the log likelihood
     */
    public static double coxReid(double[] mu, double alpha, Design design) {
        double[] totals = new double[Design.NUM_COEFFS];
        for (int j = 0; j < mu.length; j++)
            totals[design.getLevel(j)] += weight(mu[j], alpha);
        double logDet = 0.0;
        for (double total : totals)
            logDet += Math.log(total);
        return -0.5 * logDet;
    }

    /**
     * @return the IRLS weight for a fitted mean
     *
     * @param mu		fitted mean
     * @param alpha		dispersion
     */
    public static double weight(double mu, double alpha) {
        return mu / (1.0 + alpha * mu);
    }

    /**
     * Compute the fitted means for a gene under the design, holding the dispersion out of the picture:  each
     * sample's mean is its size factor times the mean normalized count of its sex level.
     *
     * @param y			observed counts
     * @param sizes		size factors
     * @param design	model design
     *
     * @return the fitted means, floored at the minimum
     */
    public static double[] groupMeans(double[] y, SizeFactors sizes, Design design) {
        double[] sums = new double[Design.NUM_COEFFS];
        int[] counts = new int[Design.NUM_COEFFS];
        for (int j = 0; j < y.length; j++) {
            int level = design.getLevel(j);
            sums[level] += y[j] / sizes.get(j);
            counts[level]++;
        }
        double[] retVal = new double[y.length];
        for (int j = 0; j < y.length; j++) {
            int level = design.getLevel(j);
            retVal[j] = Math.max(MIN_MU, sizes.get(j) * sums[level] / counts[level]);
        }
        return retVal;
    }

}
