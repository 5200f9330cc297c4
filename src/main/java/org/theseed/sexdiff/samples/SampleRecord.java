/**
 *
 */
package org.theseed.sexdiff.samples;

/**
 * This object describes the clinical metadata for a single sample.
 *
 * @author Bruce Parrello
 *
 */
public class SampleRecord {

    // FIELDS
    /** sample ID */
    private final String sampleId;
    /** age at index, or NULL if unknown */
    private final Double age;
    /** sex, or NULL if unknown */
    private final Sex sex;
    /** sample type (e.g. "Metastatic") */
    private final String sampleType;
    /** vital status */
    private final String vitalStatus;

    /**
     * Construct a sample record.
     *
     * @param sampleId		ID of the sample
     * @param age			age at index, or NULL if unknown
     * @param sex			sex of the patient, or NULL if unknown
     * @param sampleType	type of the sample
     * @param vitalStatus	vital status of the patient
     */
    public SampleRecord(String sampleId, Double age, Sex sex, String sampleType, String vitalStatus) {
        this.sampleId = sampleId;
        this.age = age;
        this.sex = sex;
        this.sampleType = sampleType;
        this.vitalStatus = vitalStatus;
    }

    /**
     * @return the sample ID
     */
    public String getSampleId() {
        return this.sampleId;
    }

    /**
     * @return the age at index, or NULL if it is unknown
     */
    public Double getAge() {
        return this.age;
    }

    /**
     * @return the sex, or NULL if it is unknown
     */
    public Sex getSex() {
        return this.sex;
    }

    /**
     * @return the sample type
     */
    public String getSampleType() {
        return this.sampleType;
    }

    /**
     * @return the vital status
     */
    public String getVitalStatus() {
        return this.vitalStatus;
    }

    @Override
    public String toString() {
        return this.sampleId;
    }

}
