package org.theseed.sexdiff;

import java.util.Arrays;

import org.theseed.sexdiff.utils.BaseProcessor;

/**
 * Commands for sex-stratified differential expression
 *
 * degs		compute differential expression between the sexes for each age stratum, with enrichment
 * enrich	test a gene list for over-represented ontology terms
 * sizes	compute the size factors of a count matrix
 *
 */
public class App
{
    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "degs" :
            processor = new DiffExpressionProcessor();
            break;
        case "enrich" :
            processor = new EnrichProcessor();
            break;
        case "sizes" :
            processor = new SizeFactorProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
    }
}
