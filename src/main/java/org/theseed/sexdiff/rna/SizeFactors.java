/**
 *
 */
package org.theseed.sexdiff.rna;

import java.util.Arrays;

/**
 * This object contains the size factor for each sample of a count matrix.  The size factor is used to
 * normalize a sample's counts for sequencing depth.
 *
 * @author Bruce Parrello
 *
 */
public class SizeFactors {

    // FIELDS
    /** sample IDs, in column order */
    private final String[] sampleIds;
    /** size factors, in column order */
    private final double[] factors;

    /**
     * Construct a size factor set.
     *
     * @param sampleIds		sample IDs, in column order
     * @param factors		size factors, in column order
     */
    public SizeFactors(String[] sampleIds, double[] factors) {
        if (sampleIds.length != factors.length)
            throw new IllegalArgumentException("Size factor count does not match sample count.");
        for (int j = 0; j < factors.length; j++) {
            if (! (factors[j] > 0.0) || Double.isInfinite(factors[j]))
                throw new IllegalArgumentException("Invalid size factor " + factors[j] + " for sample " + sampleIds[j] + ".");
        }
        this.sampleIds = sampleIds.clone();
        this.factors = factors.clone();
    }

    /**
     * @return the size factor for a sample
     *
     * @param col	column index of the sample
     */
    public double get(int col) {
        return this.factors[col];
    }

    /**
     * @return the ID of a sample
     *
     * @param col	column index of the sample
     */
    public String getSampleId(int col) {
        return this.sampleIds[col];
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.factors.length;
    }

    /**
     * @return the normalized count for a sample
     *
     * @param count		raw count
     * @param col		column index of the sample
     */
    public double normalize(int count, int col) {
        return count / this.factors[col];
    }

    /**
     * @return the mean of the reciprocal size factors
     */
    public double meanReciprocal() {
        double total = 0.0;
        for (double factor : this.factors)
            total += 1.0 / factor;
        return total / this.factors.length;
    }

    /**
     * @return the geometric mean of the size factors
     */
    public double geometricMean() {
        double total = 0.0;
        for (double factor : this.factors)
            total += Math.log(factor);
        return Math.exp(total / this.factors.length);
    }

    /**
     * @return a copy of the size factor array
     */
    public double[] toArray() {
        return Arrays.copyOf(this.factors, this.factors.length);
    }

}
