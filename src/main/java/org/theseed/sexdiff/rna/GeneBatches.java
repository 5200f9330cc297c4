/**
 *
 */
package org.theseed.sexdiff.rna;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

/**
 * This class runs a per-gene computation in batches on a thread pool.  The computation for each gene must be
 * independent of every other gene, and must write its results only to the gene's own array slots.  The method
 * returns after every batch has finished, so it acts as a barrier between phases.
 *
 * @author Bruce Parrello
 *
 */
public class GeneBatches {

    /** number of genes per batch */
    public static final int BATCH_SIZE = 250;

    /**
     * Run a computation for each gene.
     *
     * @param pool		thread pool for the batches
     * @param nGenes	number of genes
     * @param task		computation to run on each gene index
     */
    public static void run(ExecutorService pool, int nGenes, IntConsumer task) {
        List<Future<?>> futures = new ArrayList<Future<?>>(nGenes / BATCH_SIZE + 1);
        for (int start = 0; start < nGenes; start += BATCH_SIZE) {
            final int lo = start;
            final int hi = Math.min(nGenes, start + BATCH_SIZE);
            futures.add(pool.submit(() -> {
                for (int i = lo; i < hi; i++)
                    task.accept(i);
            }));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Gene batch processing interrupted.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException)
                    throw (RuntimeException) cause;
                throw new IllegalStateException("Error in gene batch.", cause);
            }
        }
    }

}
