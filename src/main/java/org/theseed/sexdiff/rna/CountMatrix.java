/**
 *
 */
package org.theseed.sexdiff.rna;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.io.TabbedLineReader;

/**
 * This object contains a read-count matrix.  Each row is a gene and each column is a sample.  The
 * counts are non-negative integers.  The gene IDs must be unique, and the same is true of the sample IDs.
 * The matrix is immutable once built; subsets are created as new objects.
 *
 * @author Bruce Parrello
 *
 */
public class CountMatrix {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CountMatrix.class);
    /** gene IDs, in row order */
    private final String[] geneIds;
    /** sample IDs, in column order */
    private final String[] sampleIds;
    /** counts, indexed by row and then column */
    private final int[][] counts;
    /** map of sample IDs to column indices */
    private final Map<String, Integer> colMap;

    /**
     * Construct a count matrix.
     *
     * @param geneIds		array of gene IDs, one per row
     * @param sampleIds		array of sample IDs, one per column
     * @param counts		count array, indexed by row and then column
     */
    public CountMatrix(String[] geneIds, String[] sampleIds, int[][] counts) {
        if (counts.length != geneIds.length)
            throw new IllegalArgumentException("Count matrix has " + counts.length + " rows but "
                    + geneIds.length + " gene IDs.");
        this.geneIds = geneIds;
        this.sampleIds = sampleIds;
        this.counts = counts;
        this.colMap = new HashMap<String, Integer>(sampleIds.length * 4 / 3 + 1);
        for (int j = 0; j < sampleIds.length; j++) {
            if (this.colMap.put(sampleIds[j], j) != null)
                throw new IllegalArgumentException("Duplicate sample ID " + sampleIds[j] + " in count matrix.");
        }
        Map<String, Integer> rowCheck = new HashMap<String, Integer>(geneIds.length * 4 / 3 + 1);
        for (int i = 0; i < geneIds.length; i++) {
            if (rowCheck.put(geneIds[i], i) != null)
                throw new IllegalArgumentException("Duplicate gene ID " + geneIds[i] + " in count matrix.");
            int[] row = counts[i];
            if (row.length != sampleIds.length)
                throw new IllegalArgumentException("Row for " + geneIds[i] + " has " + row.length
                        + " columns instead of " + sampleIds.length + ".");
            for (int count : row) {
                if (count < 0)
                    throw new IllegalArgumentException("Negative count found for gene " + geneIds[i] + ".");
            }
        }
    }

    /**
     * Load a count matrix from a tab-delimited file.  The first column contains the gene IDs and the remaining
     * columns contain the counts for each sample, with the sample IDs in the header.
     *
     * @param inFile	file to load
     *
     * @return the count matrix loaded
     *
     * @throws IOException
     */
    public static CountMatrix load(File inFile) throws IOException {
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            String[] labels = inStream.getLabels();
            String[] samples = Arrays.copyOfRange(labels, 1, labels.length);
            List<String> genes = new ArrayList<String>();
            List<int[]> rows = new ArrayList<int[]>();
            for (TabbedLineReader.Line line : inStream) {
                genes.add(line.get(0));
                int[] row = new int[samples.length];
                for (int j = 0; j < samples.length; j++)
                    row[j] = parseCount(line.get(j + 1), line.get(0));
                rows.add(row);
            }
            log.info("{} genes and {} samples read from {}.", genes.size(), samples.length, inFile);
            return new CountMatrix(genes.toArray(new String[genes.size()]), samples,
                    rows.toArray(new int[rows.size()][]));
        }
    }

    /**
     * @return the integer value of a count string
     *
     * @param value		string to parse
     * @param gene		ID of the relevant gene, for error messages
     */
    private static int parseCount(String value, String gene) {
        int retVal;
        try {
            retVal = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            // Some tools write integral counts in floating-point form.
            double dValue = Double.parseDouble(value.trim());
            if (dValue != Math.rint(dValue))
                throw new IllegalArgumentException("Non-integer count \"" + value + "\" for gene " + gene + ".");
            retVal = (int) dValue;
        }
        return retVal;
    }

    /**
     * @return a new matrix containing only the specified columns
     *
     * @param cols	indices of the columns to keep, in the desired order
     */
    public CountMatrix subset(int[] cols) {
        String[] newSamples = new String[cols.length];
        for (int j = 0; j < cols.length; j++)
            newSamples[j] = this.sampleIds[cols[j]];
        int[][] newCounts = new int[this.counts.length][];
        for (int i = 0; i < this.counts.length; i++) {
            int[] oldRow = this.counts[i];
            int[] newRow = new int[cols.length];
            for (int j = 0; j < cols.length; j++)
                newRow[j] = oldRow[cols[j]];
            newCounts[i] = newRow;
        }
        return new CountMatrix(this.geneIds, newSamples, newCounts);
    }

    /**
     * @return the number of genes (rows)
     */
    public int height() {
        return this.geneIds.length;
    }

    /**
     * @return the number of samples (columns)
     */
    public int width() {
        return this.sampleIds.length;
    }

    /**
     * @return the count for a gene in a sample
     *
     * @param row	row index of the gene
     * @param col	column index of the sample
     */
    public int getCount(int row, int col) {
        return this.counts[row][col];
    }

    /**
     * @return a copy of the counts for a gene
     *
     * @param row	row index of the gene
     */
    public int[] getRow(int row) {
        return Arrays.copyOf(this.counts[row], this.sampleIds.length);
    }

    /**
     * @return TRUE if every count for the specified gene is zero
     *
     * @param row	row index of the gene
     */
    public boolean isAllZero(int row) {
        boolean retVal = true;
        int[] rowCounts = this.counts[row];
        for (int j = 0; retVal && j < rowCounts.length; j++)
            retVal = (rowCounts[j] == 0);
        return retVal;
    }

    /**
     * @return the ID of the gene in the specified row
     *
     * @param row	row index of interest
     */
    public String getGeneId(int row) {
        return this.geneIds[row];
    }

    /**
     * @return the ID of the sample in the specified column
     *
     * @param col	column index of interest
     */
    public String getSampleId(int col) {
        return this.sampleIds[col];
    }

    /**
     * @return a list of the sample IDs in column order
     */
    public List<String> getSampleIds() {
        return Collections.unmodifiableList(Arrays.asList(this.sampleIds));
    }

    /**
     * @return the column index of a sample, or NULL if the sample is not in this matrix
     *
     * @param sampleId	ID of the sample of interest
     */
    public Integer findColIdx(String sampleId) {
        return this.colMap.get(sampleId);
    }

}
