/**
 *
 */
package org.theseed.sexdiff.genes;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.io.TabbedLineReader;

/**
 * This object maps stripped gene IDs to gene names.  When an ID occurs more than once, the first name found is
 * kept.
 *
 * @author Bruce Parrello
 *
 */
public class GeneAnnotation {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(GeneAnnotation.class);
    /** map of stripped gene IDs to names */
    private final Map<String, String> nameMap;
    /** set of stripped gene IDs already seen, named or not */
    private final Set<String> seen;
    /** number of duplicate IDs ignored */
    private int duplicates;

    /**
     * Create an empty annotation map.
     */
    public GeneAnnotation() {
        this.nameMap = new HashMap<String, String>();
        this.seen = new HashSet<String>();
        this.duplicates = 0;
    }

    /**
     * Load an annotation map from a tab-delimited file with "gene_id" and "gene_name" columns.
     *
     * @param inFile	file to load
     *
     * @return the annotation map
     *
     * @throws IOException
     */
    public static GeneAnnotation load(File inFile) throws IOException {
        GeneAnnotation retVal = new GeneAnnotation();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int idCol = inStream.findField("gene_id");
            int nameCol = inStream.findField("gene_name");
            for (TabbedLineReader.Line line : inStream)
                retVal.put(line.get(idCol), line.get(nameCol));
        }
        log.info("{} gene names read from {}.  {} duplicate IDs ignored.", retVal.size(), inFile, retVal.duplicates);
        return retVal;
    }

    /**
     * Add a gene name.  The ID is stripped of its version suffix.  Only the first record for an ID counts:  if
     * its name is empty, the gene stays unnamed and later records for the same ID are still ignored.
     *
     * @param geneId	gene ID
     * @param name		gene name
     */
    public void put(String geneId, String name) {
        String id = GeneIds.strip(geneId);
        if (! this.seen.add(id))
            this.duplicates++;
        else if (! StringUtils.isBlank(name))
            this.nameMap.put(id, name);
    }

    /**
     * @return the name of a gene, or NULL if the gene has no name
     *
     * @param geneId	gene ID (with or without a version suffix)
     */
    public String getName(String geneId) {
        return this.nameMap.get(GeneIds.strip(geneId));
    }

    /**
     * @return the name of a gene, or the stripped ID if the gene has no name
     *
     * @param geneId	gene ID (with or without a version suffix)
     */
    public String getNameOrId(String geneId) {
        String retVal = this.getName(geneId);
        if (retVal == null)
            retVal = GeneIds.strip(geneId);
        return retVal;
    }

    /**
     * @return the number of named genes
     */
    public int size() {
        return this.nameMap.size();
    }

    /**
     * @return the number of duplicate IDs ignored
     */
    public int getDuplicateCount() {
        return this.duplicates;
    }

    /**
     * @return an unmodifiable view of the name map
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(this.nameMap);
    }

}
