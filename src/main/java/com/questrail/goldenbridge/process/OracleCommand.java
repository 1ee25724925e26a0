package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.oracle.DumpCommandLine;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * OracleCommand
 * -----------------------------------------------------------------------------
 * The argv prefix that launches the oracle, plus its process environment.
 *
 * <p>Batch and single invocations append their mode arguments to the prefix:
 * <pre>
 *   &lt;argv&gt; batch [--lenient]
 *   &lt;argv&gt; &lt;module&gt; k=v ...
 * </pre>
 */
public record OracleCommand(List<String> argv, Path workingDirectory, Map<String, String> environment)
{
    public OracleCommand {
        Objects.requireNonNull(argv, "argv");
        Objects.requireNonNull(environment, "environment");
        argv = List.copyOf(argv);
        environment = Map.copyOf(environment);
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("Oracle command must not be empty");
        }
    }

    public static OracleCommand of(String... argv) {
        return new OracleCommand(List.of(argv), null, Map.of());
    }

    /**
     * Splits a command line on whitespace; double quotes group a token.
     */
    public static OracleCommand parse(String commandLine) {
        Objects.requireNonNull(commandLine, "commandLine");
        List<String> tokens = splitCommand(commandLine);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Oracle command line is blank");
        }
        return new OracleCommand(tokens, null, Map.of());
    }

    /**
     * Launches {@code mainClass} in a fresh JVM, using the running JVM's
     * executable and class path. The code sources of the oracle framework and
     * of SLF4J are added so that the child can start even when the current
     * class path is assembled by a launcher rather than by {@code -cp}.
     */
    public static OracleCommand javaMainClass(String mainClass, List<String> jvmArgs) {
        Objects.requireNonNull(mainClass, "mainClass");
        Objects.requireNonNull(jvmArgs, "jvmArgs");

        Set<String> classPath = new LinkedHashSet<>();
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isEmpty()) {
                classPath.add(entry);
            }
        }
        addCodeSource(classPath, loadQuietly(mainClass));
        addCodeSource(classPath, DumpCommandLine.class);
        addCodeSource(classPath, LoggerFactory.class);

        List<String> argv = new ArrayList<>();
        argv.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        argv.addAll(jvmArgs);
        argv.add("-cp");
        argv.add(String.join(File.pathSeparator, classPath));
        argv.add(mainClass);
        return new OracleCommand(argv, null, Map.of());
    }

    public OracleCommand withWorkingDirectory(Path directory) {
        return new OracleCommand(argv, directory, environment);
    }

    public OracleCommand withEnvironment(Map<String, String> environment) {
        return new OracleCommand(argv, workingDirectory, environment);
    }

    List<String> batchInvocation(boolean lenient) {
        List<String> command = new ArrayList<>(argv);
        command.add("batch");
        if (lenient) {
            command.add("--lenient");
        }
        return command;
    }

    List<String> singleInvocation(DumpRequest request) {
        List<String> command = new ArrayList<>(argv);
        command.add(request.module());
        for (DumpArgument argument : request.arguments()) {
            command.add(argument.toWireToken());
        }
        return command;
    }

    static List<String> splitCommand(String commandLine) {
        List<String> out = new ArrayList<>();
        boolean inQuote = false;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    private static Class<?> loadQuietly(String className) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(className, false, loader != null ? loader : OracleCommand.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            // Not visible here; the child JVM reports it if it is missing there too.
            return null;
        }
    }

    private static void addCodeSource(Set<String> classPath, Class<?> type) {
        if (type == null) {
            return;
        }
        CodeSource source = type.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return;
        }
        try {
            classPath.add(Paths.get(source.getLocation().toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            classPath.add(source.getLocation().getPath());
        }
    }
}
