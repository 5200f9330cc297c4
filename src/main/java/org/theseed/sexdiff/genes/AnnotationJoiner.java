/**
 *
 */
package org.theseed.sexdiff.genes;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.rna.TestResult;

/**
 * This object performs a left join of test results against a gene annotation.  Every result produces exactly one
 * output row, in the original order.  Results whose gene has no name get a NULL name.
 *
 * @author Bruce Parrello
 *
 */
public class AnnotationJoiner {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(AnnotationJoiner.class);
    /** annotation to join */
    private final GeneAnnotation annotation;
    /** number of genes without a name in the last join */
    private int missingCount;

    /**
     * Construct a joiner for an annotation.
     *
     * @param annotation	gene annotation
     */
    public AnnotationJoiner(GeneAnnotation annotation) {
        this.annotation = annotation;
        this.missingCount = 0;
    }

    /**
     * Join the annotation onto a list of test results.
     *
     * @param results	test results to annotate
     *
     * @return the annotated results, in the same order
     */
    public List<AnnotatedResult> join(List<TestResult> results) {
        List<AnnotatedResult> retVal = new ArrayList<AnnotatedResult>(results.size());
        int missing = 0;
        for (TestResult result : results) {
            String name = this.annotation.getName(result.getGeneId());
            if (name == null)
                missing++;
            retVal.add(new AnnotatedResult(result, name));
        }
        this.missingCount = missing;
        if (missing > 0)
            log.info("{} of {} genes have no annotation.", missing, results.size());
        return retVal;
    }

    /**
     * @return the test results underlying a list of annotated results
     *
     * @param annotated		annotated results
     */
    public static List<TestResult> unjoin(List<AnnotatedResult> annotated) {
        return annotated.stream().map(x -> x.getResult()).collect(Collectors.toList());
    }

    /**
     * @return the number of genes without a name in the last join
     */
    public int getMissingCount() {
        return this.missingCount;
    }

}
