/**
 *
 */
package org.theseed.sexdiff.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all command processors.  The subclass sets option defaults, validates
 * the parsed parameters, and then runs the command.  The base class handles the help and debug
 * options.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command, in milliseconds */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true)
    private boolean help;

    /** TRUE to show more detailed log messages */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command-line parameters into this object.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command can run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                this.configureLogging();
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.getMessage());
        }
        return retVal;
    }

    /**
     * Set the root logging level according to the debug option.
     */
    private void configureLogging() {
        Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) root).setLevel(this.debug ? Level.DEBUG : Level.INFO);
    }

    /**
     * Run the command.  Errors are logged and reflected in the process exit code.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed.", e);
            System.exit(1);
        }
    }

    /**
     * Set the defaults for the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and prepare for the run.
     *
     * @return TRUE if processing should proceed, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
