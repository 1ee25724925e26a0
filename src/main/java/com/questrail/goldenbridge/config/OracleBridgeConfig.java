package com.questrail.goldenbridge.config;

import com.questrail.goldenbridge.process.OracleCommand;
import com.questrail.goldenbridge.process.OracleUnavailableException;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Aggregated configuration of the golden bridge.
 *
 * <p>{@code command} may be absent; that is only an error once the oracle
 * actually has to be launched ({@link #requireCommand()}).</p>
 */
public record OracleBridgeConfig(
    OracleCommand command,
    Duration timeout,
    boolean lenientBatch
) {
    public static final String PREFIX = "goldenbridge.oracle.";
    public static final String COMMAND = PREFIX + "command";
    public static final String MAIN_CLASS = PREFIX + "main-class";
    public static final String JVM_ARGS = PREFIX + "jvm-args";
    public static final String WORKING_DIRECTORY = PREFIX + "working-directory";
    public static final String TIMEOUT = PREFIX + "timeout";
    public static final String LENIENT = PREFIX + "lenient";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public OracleBridgeConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public Optional<OracleCommand> commandIfConfigured() {
        return Optional.ofNullable(command);
    }

    /**
     * @throws OracleUnavailableException if no oracle command was configured
     */
    public OracleCommand requireCommand() {
        if (command == null) {
            throw new OracleUnavailableException(
                "No oracle configured; set " + COMMAND + " or " + MAIN_CLASS);
        }
        return command;
    }

    /**
     * Reads the {@code goldenbridge.oracle.*} keys through {@code parameters},
     * typically the JUnit Platform configuration parameters.
     *
     * @throws IllegalArgumentException if a value is present but malformed
     */
    public static OracleBridgeConfig fromParameters(Function<String, Optional<String>> parameters) {
        Objects.requireNonNull(parameters, "parameters");
        Builder builder = builder();

        Optional<String> commandLine = nonBlank(parameters.apply(COMMAND));
        Optional<String> mainClass = nonBlank(parameters.apply(MAIN_CLASS));
        OracleCommand command = null;
        if (commandLine.isPresent()) {
            command = OracleCommand.parse(commandLine.get());
        } else if (mainClass.isPresent()) {
            List<String> jvmArgs = nonBlank(parameters.apply(JVM_ARGS))
                .map(s -> OracleCommand.parse(s).argv())
                .orElse(List.of());
            command = OracleCommand.javaMainClass(mainClass.get().trim(), new ArrayList<>(jvmArgs));
        }
        if (command != null) {
            Optional<String> directory = nonBlank(parameters.apply(WORKING_DIRECTORY));
            if (directory.isPresent()) {
                command = command.withWorkingDirectory(Paths.get(directory.get().trim()));
            }
        }
        builder.withCommand(command);

        nonBlank(parameters.apply(TIMEOUT)).ifPresent(s -> builder.withTimeout(parseTimeout(s.trim())));
        nonBlank(parameters.apply(LENIENT)).ifPresent(s -> builder.withLenientBatch(Boolean.parseBoolean(s.trim())));
        return builder.build();
    }

    static Duration parseTimeout(String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + TIMEOUT + " value: '" + value + "'", e);
        }
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value == null ? Optional.empty() : value.filter(s -> !s.isBlank());
    }

    public static OracleBridgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OracleCommand command;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean lenientBatch = false;

        public Builder withCommand(OracleCommand command) {
            this.command = command;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withLenientBatch(boolean lenientBatch) {
            this.lenientBatch = lenientBatch;
            return this;
        }

        public OracleBridgeConfig build() {
            return new OracleBridgeConfig(command, timeout, lenientBatch);
        }
    }
}
