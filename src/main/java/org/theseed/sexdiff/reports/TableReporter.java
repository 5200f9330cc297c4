/**
 *
 */
package org.theseed.sexdiff.reports;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;

/**
 * This is the base class for tab-delimited report writers.  Missing numeric values are written as "NA".
 *
 * @author Bruce Parrello
 *
 */
public abstract class TableReporter implements AutoCloseable {

    // FIELDS
    /** output writer */
    private final PrintWriter writer;
    /** TRUE if the header has been written */
    private boolean headerDone;
    /** string for a missing value */
    public static final String MISSING = "NA";

    /**
     * Construct a report writer for an output file.
     *
     * @param outFile	output file
     *
     * @throws FileNotFoundException
     */
    public TableReporter(File outFile) throws FileNotFoundException {
        this(new FileOutputStream(outFile));
    }

    /**
     * Construct a report writer for an output stream.
     *
     * @param oStream	output stream for the report
     */
    public TableReporter(OutputStream oStream) {
        this.writer = new PrintWriter(new OutputStreamWriter(oStream, StandardCharsets.UTF_8));
        this.headerDone = false;
    }

    /**
     * Write the header line if it has not been written yet.
     */
    protected void checkHeader() {
        if (! this.headerDone) {
            this.writer.println(StringUtils.join(this.getHeaders(), '\t'));
            this.headerDone = true;
        }
    }

    /**
     * Write a data line.
     *
     * @param fields	field values for the line
     */
    protected void writeLine(String... fields) {
        this.checkHeader();
        this.writer.println(StringUtils.join(fields, '\t'));
    }

    /**
     * @return the column headers for this report
     */
    protected abstract String[] getHeaders();

    /**
     * @return the string form of a number, or "NA" if it is missing
     *
     * @param value		number to format
     */
    public static String format(double value) {
        return (Double.isNaN(value) ? MISSING : Double.toString(value));
    }

    @Override
    public void close() {
        // Even an empty report gets a header.
        this.checkHeader();
        this.writer.close();
    }

}
