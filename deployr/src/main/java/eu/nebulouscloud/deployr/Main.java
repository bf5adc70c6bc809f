package eu.nebulouscloud.deployr;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

/**
 * The main class of DeployR.
 */
@Slf4j
@Command(name = "deployr",
    version = "0.1",
    mixinStandardHelpOptions = true,
    sortOptions = false,
    separator = " ",
    showAtFileInUsageHelp = true,
    description = "Match requested instances to hosts, deploy them and connect them with channels.",
    subcommands = {
        LocalExecution.class
    }
)
public class Main implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--log-dir"},
            description = "Directory where to write gathered topologies and computed deployments as files. Can also be set via the @|bold LOGDIR|@ variable.",
            paramLabel = "LOGDIR",
            defaultValue = "${LOGDIR}")
    @Getter
    private static Path logDirectory;

    @Option(names = {"--verbose", "-v"},
            description = "Turn on more verbose logging output. Can be given multiple times. When not given, print only warnings and error messages. With @|underline -v|@, print status messages. With @|underline -vvv|@, print everything.",
        scope = ScopeType.INHERIT)
    private boolean[] verbosity;

    /**
     * PicoCLI execution strategy that uses common initialization.
     */
    int executionStrategy(ParseResult parseResult) {
        init();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Initialization code shared between this class and any
     * subcommands: set logging level and create log directory.
     */
    private void init() {
        // Note: in logback.xml we set the level to WARN.  Here we override
        // the level.
        final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger("eu.nebulouscloud");
        if (!(logger instanceof ch.qos.logback.classic.Logger)) {
            log.info("Cannot set log level: logger not of class ch.qos.logback.classic.Logger");
        } else {
            ch.qos.logback.classic.Logger logbackLogger = (ch.qos.logback.classic.Logger) logger;
            if (verbosity != null) {
                switch (verbosity.length) {
                    case 0: break;
                    case 1: logbackLogger.setLevel(ch.qos.logback.classic.Level.INFO); break;
                    case 2: logbackLogger.setLevel(ch.qos.logback.classic.Level.DEBUG); break;
                    case 3: logbackLogger.setLevel(ch.qos.logback.classic.Level.TRACE); break;
                    default: logbackLogger.setLevel(ch.qos.logback.classic.Level.ALL); break;
                }
            }
        }

        log.debug("Beginning common startup of deployr");
        if (logDirectory != null) {
            if (!Files.exists(logDirectory)) {
                try {
                    Files.createDirectories(logDirectory);
                    log.info("Logging topologies and deployments to new directory {}", logDirectory);
                } catch (IOException e) {
                    log.warn("Could not create log directory {}. Continuing without file logging.", logDirectory, e);
                    logDirectory = null;
                }
            } else if (!Files.isDirectory(logDirectory) || !Files.isWritable(logDirectory)) {
                log.warn("Trying to use a file as log directory, or directory not writable: {}. Continuing without file logging.", logDirectory);
                logDirectory = null;
            } else {
                log.info("Logging topologies and deployments to directory {}", logDirectory);
            }
        }
    }

    /**
     * Without a subcommand there is nothing to deploy; print usage.
     *
     * @return 0
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }

    /**
     * Create the command line object, with common initialization hooked in.
     */
    public static CommandLine commandLine() {
        Main main = new Main();
        return new CommandLine(main)
            .setExecutionStrategy(main::executionStrategy); // perform common initialization
    }

    /**
     * External entry point for the main class.  Parses command-line
     * parameters and invokes the `call` method.
     *
     * @param args the command-line parameters as passed by the user
     */
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * Log a file into the given log directory.  Does nothing if {@link
     * Main#logDirectory} is not set.
     *
     * @param name A string that can be used as part of a filename, does not
     *  need to be unique.  Should not contain characters that are illegal in
     *  file names, e.g., avoid colons (:) or slashes (/).
     * @param contents The content of the file to be written.  Will be
     *  converted to a String via `toString`.
     */
    public static void logFile(String name, Object contents) {
        if (Main.logDirectory == null) return;
        String prefix = LocalDateTime.now().toString()
            .replace(":", "-"); // make Windows less unhappy
        Path path = logDirectory.resolve(prefix + "--" + name);
        try (FileWriter out = new FileWriter(path.toFile())) {
            out.write(contents.toString());
            log.trace("Wrote log file {}", path);
        } catch (IOException e) {
            log.warn("Error while trying to create data file in log directory", e);
        }
    }
}
