/**
 *
 */
package org.theseed.sexdiff.samples;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.io.TabbedLineReader;
import org.theseed.sexdiff.rna.CountMatrix;

/**
 * This object contains the sample metadata for a count matrix.  The records are ordered, and once the
 * metadata has been aligned to a count matrix, record N describes column N of the matrix.
 *
 * @author Bruce Parrello
 *
 */
public class SampleMetadata implements Iterable<SampleRecord> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SampleMetadata.class);
    /** list of sample records */
    private final List<SampleRecord> records;

    /**
     * Create a metadata table from a list of records.
     *
     * @param records	list of sample records, in order
     */
    public SampleMetadata(List<SampleRecord> records) {
        this.records = new ArrayList<SampleRecord>(records);
    }

    /**
     * Load sample metadata from a tab-delimited file.  The file must have the columns "sample_id", "age_at_index",
     * "gender", "sample_type", and "vital_status".  An empty or unparseable age or an unrecognized gender is
     * stored as NULL.
     *
     * @param inFile	file to load
     *
     * @return the metadata table
     *
     * @throws IOException
     */
    public static SampleMetadata load(File inFile) throws IOException {
        List<SampleRecord> records = new ArrayList<SampleRecord>();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int idCol = inStream.findField("sample_id");
            int ageCol = inStream.findField("age_at_index");
            int sexCol = inStream.findField("gender");
            int typeCol = inStream.findField("sample_type");
            int vitalCol = inStream.findField("vital_status");
            int badAges = 0;
            for (TabbedLineReader.Line line : inStream) {
                Double age = null;
                try {
                    double ageValue = line.getDouble(ageCol);
                    if (Double.isFinite(ageValue))
                        age = ageValue;
                } catch (NumberFormatException e) {
                    badAges++;
                }
                records.add(new SampleRecord(line.get(idCol), age, Sex.parse(line.get(sexCol)),
                        line.get(typeCol), line.get(vitalCol)));
            }
            if (badAges > 0)
                log.warn("{} invalid ages in {} treated as missing.", badAges, inFile);
        }
        log.info("{} sample records read from {}.", records.size(), inFile);
        return new SampleMetadata(records);
    }

    /**
     * Create a copy of this metadata aligned to the columns of a count matrix.  Records for samples not in the
     * matrix are dropped.
     *
     * @param matrix	count matrix to which the metadata should be aligned
     *
     * @return the aligned metadata
     *
     * @throws CohortException	if a matrix column has no metadata record
     */
    public SampleMetadata alignTo(CountMatrix matrix) throws CohortException {
        Map<String, SampleRecord> recordMap = new HashMap<String, SampleRecord>(this.records.size() * 4 / 3 + 1);
        for (SampleRecord record : this.records) {
            if (recordMap.put(record.getSampleId(), record) != null)
                throw new CohortException("Duplicate metadata record for sample " + record.getSampleId() + ".");
        }
        List<SampleRecord> aligned = new ArrayList<SampleRecord>(matrix.width());
        for (String sampleId : matrix.getSampleIds()) {
            SampleRecord record = recordMap.get(sampleId);
            if (record == null)
                throw new CohortException("Sample " + sampleId + " in count matrix has no metadata.");
            aligned.add(record);
        }
        int dropped = this.records.size() - aligned.size();
        if (dropped > 0)
            log.info("{} metadata records have no count data and were dropped.", dropped);
        return new SampleMetadata(aligned);
    }

    /**
     * Verify that this metadata is aligned with a count matrix.
     *
     * @param matrix	count matrix to check
     *
     * @throws CohortException	if the records do not match the matrix columns one for one
     */
    public void checkAlignment(CountMatrix matrix) throws CohortException {
        if (matrix.width() != this.records.size())
            throw new CohortException("Count matrix has " + matrix.width() + " samples but metadata has "
                    + this.records.size() + ".");
        for (int j = 0; j < this.records.size(); j++) {
            String sampleId = this.records.get(j).getSampleId();
            if (! sampleId.equals(matrix.getSampleId(j)))
                throw new CohortException("Metadata record " + j + " is for " + sampleId + " but matrix column is "
                        + matrix.getSampleId(j) + ".");
        }
    }

    /**
     * @return the record at the specified position
     *
     * @param idx	index of the desired record
     */
    public SampleRecord get(int idx) {
        return this.records.get(idx);
    }

    /**
     * @return the number of records
     */
    public int size() {
        return this.records.size();
    }

    /**
     * @return an unmodifiable view of the records
     */
    public List<SampleRecord> getRecords() {
        return Collections.unmodifiableList(this.records);
    }

    @Override
    public Iterator<SampleRecord> iterator() {
        return this.getRecords().iterator();
    }

}
