/**
 *
 */
package org.theseed.sexdiff.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.StringUtils;

/**
 * This object reads a tab-delimited file with a header line.  The header is used to locate fields by
 * name, and each data line is returned as a {@link Line} object.  Blank lines are skipped.
 *
 * @author Bruce Parrello
 *
 */
public class TabbedLineReader implements Iterable<TabbedLineReader.Line>, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** header labels */
    private final String[] labels;
    /** next line to return, or NULL at end of file */
    private String nextLine;
    /** name of the source, for error messages */
    private final String sourceName;
    /** number of data lines read */
    private int lineCount;

    /**
     * This represents a single data line.
     */
    public class Line {

        /** fields in the line */
        private final String[] fields;

        private Line(String text) {
            this.fields = StringUtils.splitPreserveAllTokens(text, '\t');
        }

        /**
         * @return the field at the specified index, or an empty string if the line is short
         *
         * @param idx	index of the desired field
         */
        public String get(int idx) {
            String retVal = "";
            if (idx < this.fields.length)
                retVal = this.fields[idx];
            return retVal;
        }

        /**
         * @return the numeric value of the specified field, or NaN if it is empty or "NA"
         *
         * @param idx	index of the desired field
         */
        public double getDouble(int idx) {
            String value = this.get(idx).trim();
            double retVal;
            if (value.isEmpty() || value.equalsIgnoreCase("NA") || value.equals("--"))
                retVal = Double.NaN;
            else
                retVal = Double.parseDouble(value);
            return retVal;
        }

        /**
         * @return the integer value of the specified field
         *
         * @param idx	index of the desired field
         */
        public int getInt(int idx) {
            return Integer.parseInt(this.get(idx).trim());
        }

        /**
         * @return the number of fields in this line
         */
        public int size() {
            return this.fields.length;
        }

    }

    /**
     * Open a tab-delimited file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile) throws IOException {
        this(openFile(inFile), inFile.toString());
    }

    /**
     * Open a tab-delimited input stream.
     *
     * @param inStream	stream to read
     *
     * @throws IOException
     */
    public TabbedLineReader(InputStream inStream) throws IOException {
        this(new InputStreamReader(inStream, StandardCharsets.UTF_8), "input stream");
    }

    /**
     * Construct a reader and process the header line.
     *
     * @param reader	underlying character reader
     * @param name		name of the source
     *
     * @throws IOException
     */
    private TabbedLineReader(Reader reader, String name) throws IOException {
        this.reader = new BufferedReader(reader);
        this.sourceName = name;
        String header = this.reader.readLine();
        if (header == null)
            throw new IOException("File " + name + " is empty.");
        this.labels = StringUtils.splitPreserveAllTokens(header, '\t');
        this.lineCount = 0;
        this.readAhead();
    }

    /**
     * @return a reader for the specified file
     *
     * @param inFile	file to open
     *
     * @throws IOException
     */
    private static Reader openFile(File inFile) throws IOException {
        if (! inFile.canRead())
            throw new FileNotFoundException("Input file " + inFile + " is not found or unreadable.");
        return Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
    }

    /**
     * Read the next non-blank line into the buffer.
     *
     * @throws IOException
     */
    private void readAhead() throws IOException {
        this.nextLine = this.reader.readLine();
        while (this.nextLine != null && this.nextLine.isBlank())
            this.nextLine = this.reader.readLine();
    }

    /**
     * @return the index of the named field
     *
     * @param name	header label of the desired field
     *
     * @throws IOException	if the field does not exist
     */
    public int findField(String name) throws IOException {
        int retVal = this.findColumn(name);
        if (retVal < 0)
            throw new IOException("Field \"" + name + "\" not found in " + this.sourceName + ".");
        return retVal;
    }

    /**
     * @return the index of the named field, or -1 if it does not exist
     *
     * @param name	header label of the desired field
     */
    public int findColumn(String name) {
        int retVal = -1;
        for (int i = 0; i < this.labels.length && retVal < 0; i++) {
            if (this.labels[i].equals(name))
                retVal = i;
        }
        return retVal;
    }

    /**
     * @return the header labels
     */
    public String[] getLabels() {
        return this.labels;
    }

    /**
     * @return the number of header columns
     */
    public int size() {
        return this.labels.length;
    }

    /**
     * @return the number of data lines read so far
     */
    public int getLineCount() {
        return this.lineCount;
    }

    /**
     * @return TRUE if there is another data line
     */
    public boolean hasNext() {
        return this.nextLine != null;
    }

    /**
     * @return the next data line
     */
    public Line next() {
        if (this.nextLine == null)
            throw new NoSuchElementException("Attempt to read past end of " + this.sourceName + ".");
        Line retVal = new Line(this.nextLine);
        this.lineCount++;
        try {
            this.readAhead();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return retVal;
    }

    @Override
    public Iterator<Line> iterator() {
        return new Iterator<Line>() {

            @Override
            public boolean hasNext() {
                return TabbedLineReader.this.hasNext();
            }

            @Override
            public Line next() {
                return TabbedLineReader.this.next();
            }

        };
    }

    @Override
    public void close() {
        try {
            this.reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
