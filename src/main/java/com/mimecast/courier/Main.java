package com.mimecast.courier;

import com.mimecast.courier.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

import javax.naming.ConfigurationException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>This implements the commandline --server option.
 *
 * @see Server
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "courier.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Approval to mail bridge";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Runs the selected mode.
     *
     * @return True if the server was started.
     */
    boolean run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isPresent() && opt.get().hasOption("server")) {
            try {
                Server.run(opt.get().getOptionValue("server"));
                return true;
            } catch (ConfigurationException e) {
                log("Startup error: " + e.getMessage());
                System.exit(1);
            }
        }

        optionsUsage(options());
        return false;
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption(Option.builder()
                .longOpt("server")
                .hasArg()
                .argName("dir")
                .desc("Run as server with configuration directory")
                .build());
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter help = new StringWriter();
        try (PrintWriter writer = new PrintWriter(help)) {
            new HelpFormatter().printOptions(writer, 80, options, 1, 3);
        }

        log(help.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
