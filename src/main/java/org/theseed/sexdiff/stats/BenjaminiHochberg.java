/**
 *
 */
package org.theseed.sexdiff.stats;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * This class performs the Benjamini-Hochberg false-discovery-rate adjustment on a vector of p-values.  NaN
 * p-values are left out of the correction set and remain NaN in the output, at their original positions.
 *
 * @author Bruce Parrello
 *
 */
public class BenjaminiHochberg {

    /**
     * Compute the adjusted p-values.
     *
     * @param pvalues	array of raw p-values (NaN for untested)
     *
     * @return an array of adjusted p-values in the same order
     */
    public static double[] adjust(double[] pvalues) {
        double[] retVal = new double[pvalues.length];
        Arrays.fill(retVal, Double.NaN);
        // Sort the indices of the valid p-values in ascending order.
        Integer[] order = IntStream.range(0, pvalues.length).filter(i -> ! Double.isNaN(pvalues[i]))
                .boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> pvalues[i]));
        final int m = order.length;
        // Walk down from the largest p-value, keeping the running minimum.
        double cumMin = 1.0;
        for (int rank = m; rank >= 1; rank--) {
            int idx = order[rank - 1];
            double adjusted = pvalues[idx] * m / rank;
            if (adjusted < cumMin)
                cumMin = adjusted;
            retVal[idx] = cumMin;
        }
        return retVal;
    }

}
