/**
 *
 */
package org.theseed.sexdiff.genes;

import java.util.regex.Pattern;

import org.apache.commons.lang3.RegExUtils;

/**
 * This class normalizes gene IDs by removing the version suffix (e.g. "ENSG00000123.4" becomes "ENSG00000123").
 * Repeated suffixes are all removed, so stripping an ID twice gives the same result as stripping it once.
 *
 * @author Bruce Parrello
 *
 */
public class GeneIds {

    /** pattern for a trailing version suffix */
    private static final Pattern VERSION_SUFFIX = Pattern.compile("(\\.\\d+)+$");

    /**
     * @return the gene ID without its version suffix
     *
     * @param geneId	gene ID to normalize
     */
    public static String strip(String geneId) {
        return RegExUtils.removeFirst(geneId, VERSION_SUFFIX);
    }

}
