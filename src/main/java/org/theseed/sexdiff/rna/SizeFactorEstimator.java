/**
 *
 */
package org.theseed.sexdiff.rna;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.samples.CohortException;

/**
 * This object computes size factors using the median-of-ratios method.  For each gene with no zero counts,
 * we compute the geometric mean of its counts across the samples.  A sample's size factor is then the median
 * over those genes of the ratio between the sample's count and the gene's geometric mean.  Genes with a zero
 * count are left out of the ratio computation only.
 *
 * @author Bruce Parrello
 *
 */
public class SizeFactorEstimator {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SizeFactorEstimator.class);

    /**
     * Compute the size factors for a count matrix.
     *
     * @param matrix	count matrix to normalize
     *
     * @return the size factors for the matrix samples
     *
     * @throws CohortException	if every gene has at least one zero count
     */
    public SizeFactors estimate(CountMatrix matrix) throws CohortException {
        final int nGenes = matrix.height();
        final int nSamples = matrix.width();
        // Compute the log geometric means.  We remember the rows we can use.
        int[] usable = new int[nGenes];
        double[] logGeoMeans = new double[nGenes];
        int nUsable = 0;
        for (int i = 0; i < nGenes; i++) {
            double total = 0.0;
            boolean ok = true;
            for (int j = 0; ok && j < nSamples; j++) {
                int count = matrix.getCount(i, j);
                if (count == 0)
                    ok = false;
                else
                    total += Math.log(count);
            }
            if (ok) {
                usable[nUsable] = i;
                logGeoMeans[nUsable] = total / nSamples;
                nUsable++;
            }
        }
        if (nUsable == 0)
            throw new CohortException("Every gene contains at least one zero count:  size factors cannot be computed.");
        log.info("{} of {} genes used for size factor estimation.", nUsable, nGenes);
        // Now compute the median log ratio for each sample.
        Median median = new Median();
        double[] logRatios = new double[nUsable];
        double[] factors = new double[nSamples];
        String[] sampleIds = new String[nSamples];
        for (int j = 0; j < nSamples; j++) {
            for (int k = 0; k < nUsable; k++)
                logRatios[k] = Math.log(matrix.getCount(usable[k], j)) - logGeoMeans[k];
            factors[j] = Math.exp(median.evaluate(logRatios));
            sampleIds[j] = matrix.getSampleId(j);
        }
        SizeFactors retVal = new SizeFactors(sampleIds, factors);
        log.debug("Geometric mean of size factors is {}.", retVal.geometricMean());
        return retVal;
    }

}
