/**
 *
 */
package org.theseed.sexdiff;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sexdiff.enrich.EnrichmentEngine;
import org.theseed.sexdiff.enrich.EnrichmentResult;
import org.theseed.sexdiff.enrich.OntologyGeneSets;
import org.theseed.sexdiff.enrich.OntologyTerm;
import org.theseed.sexdiff.io.TabbedLineReader;
import org.theseed.sexdiff.reports.EnrichmentReporter;
import org.theseed.sexdiff.utils.ParseFailureException;

/**
 * This command tests a single gene list for over-represented ontology terms.  The gene list and the background
 * universe are tab-delimited files with headers; the gene IDs are taken from a named column.  If no universe is
 * specified, all the genes in the ontology gene sets are used.
 *
 * The positional parameters are the name of the ontology gene set file and the name of the gene list file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for the report (if not STDOUT)
 *
 * --annot		tab-delimited file of gene names, with columns "gene_id" and "gene_name"
 * --universe	tab-delimited file of background gene IDs
 * --col		name of the gene ID column in the list and universe files (default "gene_id")
 * --minGS		minimum number of background genes in a tested term (default 10)
 * --maxGS		maximum number of background genes in a tested term (default 500)
 *
 * @author Bruce Parrello
 *
 */
public class EnrichProcessor extends BaseDiffProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(EnrichProcessor.class);
    /** ontology gene sets */
    private OntologyGeneSets geneSets;
    /** gene list */
    private List<String> listGenes;
    /** background universe */
    private Set<String> universe;

    // COMMAND-LINE OPTIONS

    /** output file, if not STDOUT */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "report.tsv", usage = "output file name (if not STDOUT)")
    private File outFile;

    /** universe file */
    @Option(name = "--universe", metaVar = "tested.tsv", usage = "background gene file (default is all ontology genes)")
    private File universeFile;

    /** gene ID column name */
    @Option(name = "--col", metaVar = "ensembl_id", usage = "name of the gene ID column in the list and universe files")
    private String colName;

    /** ontology gene set file */
    @Argument(index = 0, metaVar = "go_sets.tsv", usage = "ontology gene set file", required = true)
    private File goFile;

    /** gene list file */
    @Argument(index = 1, metaVar = "genes.tsv", usage = "gene list file", required = true)
    private File listFile;

    @Override
    protected void setDiffDefaults() {
        this.outFile = null;
        this.universeFile = null;
        this.colName = "gene_id";
    }

    @Override
    protected boolean validateDiffParms() throws IOException, ParseFailureException {
        this.geneSets = OntologyGeneSets.load(checkFile(this.goFile, "Ontology gene set"));
        log.info("{} ontology terms read from {}.", this.geneSets.size(), this.goFile);
        this.listGenes = new ArrayList<String>(this.readGenes(checkFile(this.listFile, "Gene list")));
        log.info("{} genes read from {}.", this.listGenes.size(), this.listFile);
        if (this.universeFile != null) {
            this.universe = this.readGenes(checkFile(this.universeFile, "Universe"));
            log.info("{} background genes read from {}.", this.universe.size(), this.universeFile);
        } else {
            this.universe = new LinkedHashSet<String>();
            for (OntologyTerm term : this.geneSets.getTerms())
                this.universe.addAll(term.getGenes());
            log.info("{} ontology genes will be used as the background.", this.universe.size());
        }
        return true;
    }

    /**
     * Read the gene IDs from a file.
     *
     * @param inFile	input file
     *
     * @return the set of gene IDs, in file order
     *
     * @throws IOException
     */
    private Set<String> readGenes(File inFile) throws IOException {
        Set<String> retVal = new LinkedHashSet<String>();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int idCol = inStream.findField(this.colName);
            for (TabbedLineReader.Line line : inStream)
                retVal.add(line.get(idCol));
        }
        return retVal;
    }

    @Override
    protected void runCommand() throws Exception {
        EnrichmentEngine engine = new EnrichmentEngine(this.geneSets, this);
        List<EnrichmentResult> results = engine.enrich(this.listGenes, this.universe, this.getAnnotation());
        EnrichmentReporter reporter;
        if (this.outFile == null) {
            log.info("Report will be written to standard output.");
            reporter = new EnrichmentReporter(System.out);
        } else {
            log.info("Report will be written to {}.", this.outFile);
            reporter = new EnrichmentReporter(this.outFile);
        }
        try (reporter) {
            reporter.writeAll(results);
        }
    }

}
