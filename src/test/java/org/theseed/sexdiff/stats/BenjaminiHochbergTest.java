/**
 *
 */
package org.theseed.sexdiff.stats;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
public class BenjaminiHochbergTest {

    @Test
    public void testKnownValues() {
        double[] padj = BenjaminiHochberg.adjust(new double[] { 0.01, 0.04, 0.03, 0.005 });
        assertThat(padj[0], closeTo(0.02, 1e-12));
        assertThat(padj[1], closeTo(0.04, 1e-12));
        assertThat(padj[2], closeTo(0.04, 1e-12));
        assertThat(padj[3], closeTo(0.02, 1e-12));
    }

    @Test
    public void testMissingValues() {
        double[] pvalues = new double[] { 0.01, Double.NaN, 0.04, Double.NaN, 0.03, 0.005 };
        double[] padj = BenjaminiHochberg.adjust(pvalues);
        assertThat(padj.length, equalTo(6));
        assertThat(Double.isNaN(padj[1]), equalTo(true));
        assertThat(Double.isNaN(padj[3]), equalTo(true));
        // The untested genes do not count toward the number of tests.
        assertThat(padj[0], closeTo(0.02, 1e-12));
        assertThat(padj[2], closeTo(0.04, 1e-12));
        assertThat(padj[4], closeTo(0.04, 1e-12));
        assertThat(padj[5], closeTo(0.02, 1e-12));
        assertThat(BenjaminiHochberg.adjust(new double[0]).length, equalTo(0));
        double[] none = BenjaminiHochberg.adjust(new double[] { Double.NaN, Double.NaN });
        assertThat(Double.isNaN(none[0]) && Double.isNaN(none[1]), equalTo(true));
    }

    @Test
    public void testProperties() {
        Random rand = new Random(12345);
        double[] pvalues = new double[500];
        for (int i = 0; i < pvalues.length; i++)
            pvalues[i] = (i % 5 == 0 ? rand.nextDouble() * 1e-4 : rand.nextDouble());
        double[] padj = BenjaminiHochberg.adjust(pvalues);
        for (int i = 0; i < pvalues.length; i++) {
            assertThat(padj[i], greaterThanOrEqualTo(pvalues[i]));
            assertThat(padj[i], lessThanOrEqualTo(1.0));
        }
        // Adjusted values are monotone in the order of the raw values.
        Integer[] order = IntStream.range(0, pvalues.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> pvalues[i]));
        for (int k = 1; k < order.length; k++)
            assertThat(padj[order[k]], greaterThanOrEqualTo(padj[order[k - 1]]));
    }

}
