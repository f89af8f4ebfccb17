package io.yamlschema.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.yamlschema.cli.config.CliConfig;
import io.yamlschema.cli.config.CliConfigException;
import io.yamlschema.cli.config.CliConfigLoader;
import java.io.PrintStream;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code yaml-validator} command.
 *
 * <p>
 * Exits 0 when every document validates, 1 on validation failures, unreadable input or usage
 * errors.
 */
public final class ValidatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorMain.class);

    static final String LOG_APPENDER = "STDERR";
    static final String LOG_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String USAGE = String.join(
            "\n",
            "Usage: yaml-validator [--config <file>] -s|--schema <file>... -u|--uri <uri>",
            "                      [--check-refs] [--log-level <level>] [--log-format text|json] <file>...",
            "",
            "Validates YAML files against a context of any number of cross-referencing schema files.",
            "",
            "Options:",
            "  -s, --schema <file>   schema file to include in the context, may be repeated",
            "  -u, --uri <uri>       URI of the schema to validate the files against",
            "      --config <file>   YAML file supplying defaults for these options",
            "      --check-refs      fail if any schema references a URI missing from the context",
            "      --log-level <l>   TRACE, DEBUG, INFO, WARN or ERROR (default WARN)",
            "      --log-format <f>  text or json (default text)",
            "  -h, --help            print this message",
            "");

    private ValidatorMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = run(args, System::getenv, System.out, System.err);
        } catch (Exception e) {
            LOG.error("Validation aborted: {}", e.getMessage(), e);
            code = 1;
        }
        System.exit(code);
    }

    /**
     * Runs the command without exiting the JVM.
     *
     * @return the exit code
     */
    static int run(String[] args, Function<String, String> envLookup, PrintStream out, PrintStream err) {
        CliConfig config;
        try {
            config = CliConfigLoader.load(args, envLookup);
        } catch (CliConfigException e) {
            err.println(e.getMessage());
            return 1;
        }
        if (config.help()) {
            out.print(USAGE);
            return 0;
        }

        configureLogging(config);
        return ValidateCommand.run(config, out, err);
    }

    /**
     * Points the root logger at stderr with the configured level and format. Stdout carries only
     * the success message. Unknown level names fall back to WARN.
     */
    static void configureLogging(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(config.loggingLevel(), Level.WARN));
        root.detachAndStopAllAppenders();

        Encoder<ILoggingEvent> encoder;
        if ("json".equalsIgnoreCase(config.loggingFormat())) {
            encoder = new JsonEncoder();
        } else {
            PatternLayoutEncoder pattern = new PatternLayoutEncoder();
            pattern.setPattern(LOG_PATTERN);
            encoder = pattern;
        }
        encoder.setContext(context);
        encoder.start();

        ConsoleAppender<ILoggingEvent> stderr = new ConsoleAppender<>();
        stderr.setContext(context);
        stderr.setName(LOG_APPENDER);
        stderr.setTarget("System.err");
        stderr.setEncoder(encoder);
        stderr.start();
        root.addAppender(stderr);
        LOG.debug("Logging at {} in {} format", root.getLevel(), config.loggingFormat());
    }
}
