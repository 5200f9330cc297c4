/**
 *
 */
package org.theseed.sexdiff.samples;

import org.theseed.sexdiff.rna.CountMatrix;

/**
 * A cohort is the count matrix and aligned sample metadata for one stratum of the analysis.
 *
 * @author Bruce Parrello
 *
 */
public class Cohort {

    // FIELDS
    /** name of the cohort, for reporting */
    private final String name;
    /** counts for the cohort samples */
    private final CountMatrix counts;
    /** metadata for the cohort samples, aligned with the count columns */
    private final SampleMetadata metadata;

    /**
     * Construct a cohort.
     *
     * @param name			name of the cohort
     * @param counts		count matrix
     * @param metadata		metadata, in column order
     *
     * @throws CohortException	if the metadata is not aligned with the matrix
     */
    public Cohort(String name, CountMatrix counts, SampleMetadata metadata) throws CohortException {
        metadata.checkAlignment(counts);
        this.name = name;
        this.counts = counts;
        this.metadata = metadata;
    }

    /**
     * @return the cohort name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the count matrix
     */
    public CountMatrix getCounts() {
        return this.counts;
    }

    /**
     * @return the sample metadata
     */
    public SampleMetadata getMetadata() {
        return this.metadata;
    }

    /**
     * @return the number of samples in the cohort
     */
    public int size() {
        return this.counts.width();
    }

    /**
     * @return the number of samples of the specified sex
     *
     * @param sex	sex level to count
     */
    public int count(Sex sex) {
        int retVal = 0;
        for (SampleRecord record : this.metadata) {
            if (record.getSex() == sex)
                retVal++;
        }
        return retVal;
    }

}
