package io.yamlschema.cli.config;

/**
 * Thrown when the command line, the environment or the configuration file cannot be turned into a
 * {@link CliConfig}. The message is printed to the user as is.
 */
public class CliConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CliConfigException(String message) {
        super(message);
    }

    public CliConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
