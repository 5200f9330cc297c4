/**
 *
 */
package org.theseed.sexdiff.samples;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.rna.CountMatrix;

/**
 * This object selects the samples for one stratum of the analysis.  A sample is kept if its age and sex
 * are both known, its sample type matches the configured type, its age falls in the stratum, and (if a
 * sex restriction is specified) its sex matches the restriction.
 *
 * @author Bruce Parrello
 *
 */
public class CohortFilter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CohortFilter.class);
    /** age threshold separating the strata */
    private final double threshold;
    /** required sample type */
    private final String sampleType;
    /** age stratum to select */
    private final AgeStratum stratum;
    /** required sex, or NULL to keep both */
    private final Sex sexFilter;

    /**
     * This interface is used to specify parameters the filter needs from the client.
     */
    public interface IParms {

        /**
         * @return the age threshold separating the strata
         */
        public double getAgeThreshold();

        /**
         * @return the sample type to keep
         */
        public String getSampleType();

    }

    /**
     * Construct a cohort filter for both sexes.
     *
     * @param processor		controlling parameter object
     * @param stratum		age stratum to select
     */
    public CohortFilter(IParms processor, AgeStratum stratum) {
        this(processor, stratum, null);
    }

    /**
     * Construct a cohort filter.
     *
     * @param processor		controlling parameter object
     * @param stratum		age stratum to select
     * @param sexFilter		sex to keep, or NULL to keep both
     */
    public CohortFilter(IParms processor, AgeStratum stratum, Sex sexFilter) {
        this.threshold = processor.getAgeThreshold();
        this.sampleType = processor.getSampleType();
        this.stratum = stratum;
        this.sexFilter = sexFilter;
    }

    /**
     * @return TRUE if the sample is acceptable, else FALSE
     *
     * @param sample	sample to check
     */
    public boolean acceptable(SampleRecord sample) {
        boolean retVal = (sample.getAge() != null && sample.getSex() != null);
        if (retVal)
            retVal = StringUtils.equals(this.sampleType, sample.getSampleType())
                    && this.stratum.contains(sample.getAge(), this.threshold);
        if (retVal && this.sexFilter != null)
            retVal = (sample.getSex() == this.sexFilter);
        return retVal;
    }

    /**
     * Extract the cohort for this filter.  The incoming matrix and metadata are not modified.
     *
     * @param matrix		full count matrix
     * @param metadata		metadata aligned with the count matrix columns
     *
     * @return the filtered cohort
     *
     * @throws CohortException	if the metadata is not aligned or no samples pass the filter
     */
    public Cohort apply(CountMatrix matrix, SampleMetadata metadata) throws CohortException {
        metadata.checkAlignment(matrix);
        List<SampleRecord> kept = new ArrayList<SampleRecord>(metadata.size());
        int[] cols = new int[metadata.size()];
        int n = 0;
        for (int j = 0; j < metadata.size(); j++) {
            SampleRecord record = metadata.get(j);
            if (this.acceptable(record)) {
                kept.add(record);
                cols[n] = j;
                n++;
            }
        }
        String name = this.describe();
        if (n == 0)
            throw new EmptyCohortException("No samples found for cohort " + name + ".");
        log.info("{} of {} samples selected for cohort {}.", n, metadata.size(), name);
        int[] keptCols = new int[n];
        System.arraycopy(cols, 0, keptCols, 0, n);
        return new Cohort(name, matrix.subset(keptCols), new SampleMetadata(kept));
    }

    /**
     * @return a description of the cohort selected by this filter
     */
    public String describe() {
        String retVal = this.sampleType + " " + this.stratum.describe(this.threshold);
        if (this.sexFilter != null)
            retVal += " " + this.sexFilter.getLabel();
        return retVal;
    }

}
