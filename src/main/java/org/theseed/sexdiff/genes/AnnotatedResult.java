/**
 *
 */
package org.theseed.sexdiff.genes;

import org.theseed.sexdiff.rna.TestResult;

/**
 * This object is a test result joined to its gene annotation.  The original test result is kept unchanged, so
 * the join can be undone.
 *
 * @author Bruce Parrello
 *
 */
public class AnnotatedResult {

    // FIELDS
    /** original test result */
    private final TestResult result;
    /** gene ID without version suffix */
    private final String baseId;
    /** gene name, or NULL if the gene is not annotated */
    private final String geneName;

    /**
     * Construct an annotated result.
     *
     * @param result		original test result
     * @param geneName		gene name, or NULL if none
     */
    public AnnotatedResult(TestResult result, String geneName) {
        this.result = result;
        this.baseId = GeneIds.strip(result.getGeneId());
        this.geneName = geneName;
    }

    /**
     * @return the original test result
     */
    public TestResult getResult() {
        return this.result;
    }

    /**
     * @return the gene ID without its version suffix
     */
    public String getBaseId() {
        return this.baseId;
    }

    /**
     * @return the gene name, or NULL if the gene is not annotated
     */
    public String getGeneName() {
        return this.geneName;
    }

    /**
     * @return the gene name, or the stripped gene ID if the gene is not annotated
     */
    public String getDisplayName() {
        return (this.geneName == null ? this.baseId : this.geneName);
    }

}
