package com.questrail.goldenbridge.oracle;

import com.questrail.goldenbridge.OracleBridgeException;
import com.questrail.goldenbridge.codec.impl.FrameWriter;
import com.questrail.goldenbridge.model.DumpArgument;
import com.questrail.goldenbridge.model.DumpRequest;
import com.questrail.goldenbridge.model.RawTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DumpCommandLine
 * -----------------------------------------------------------------------------
 * Command-line driver of an oracle built from {@link DumpModule}s.
 *
 * <h2>Single mode</h2>
 * {@code <module> [key=value]*} writes the module's table as plain CSV.
 * An argument error prints {@code Error: <message>} and the module usage to
 * stderr and exits 1.
 *
 * <h2>Batch mode</h2>
 * {@code batch [--lenient]} reads one wire line per stdin line and writes one
 * frame per request it can satisfy. A failing request gets no frame; instead
 * {@code Error in request '<line>': <message>} goes to stderr. The exit code is
 * 1 if any request failed, or 0 with {@code --lenient}.
 *
 * <p>Any other exception is a defect in a module: it is reported with its stack
 * trace and the exit code is 1.</p>
 */
public final class DumpCommandLine
{
    public static final String BATCH = "batch";
    public static final String LENIENT = "--lenient";

    private final Map<String, DumpModule> modules = new LinkedHashMap<>();

    public DumpCommandLine(Collection<? extends DumpModule> modules) {
        Objects.requireNonNull(modules, "modules");
        for (DumpModule module : modules) {
            if (this.modules.putIfAbsent(module.name(), module) != null) {
                throw new IllegalArgumentException("Duplicate dump module: " + module.name());
            }
        }
    }

    /**
     * @return the process exit code
     */
    public int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8), false);
        try {
            if (args.length > 0 && args[0].equals(BATCH)) {
                boolean lenient = Arrays.asList(args).subList(1, args.length).contains(LENIENT);
                return runBatch(stdin, new FrameWriter(out), stderr, lenient);
            }
            return runSingle(args, new FrameWriter(out), stderr);
        } catch (IOException | RuntimeException e) {
            stderr.println("Exception caught in oracle (" + e.getClass().getSimpleName() + "): " + e.getMessage());
            e.printStackTrace(stderr);
            return 1;
        } finally {
            out.flush();
        }
    }

    private int runSingle(String[] args, FrameWriter writer, PrintStream stderr) {
        if (args.length == 0) {
            stderr.println("Error: No dump module specified");
            stderr.println();
            usage(stderr);
            return 1;
        }

        DumpModule module = modules.get(args[0]);
        if (module == null) {
            stderr.println("Error: Unknown dump module: " + args[0]);
            stderr.println();
            usage(stderr);
            return 1;
        }

        final RawTable table;
        try {
            List<DumpArgument> arguments = new ArrayList<>();
            for (int i = 1; i < args.length; i++) {
                arguments.add(DumpArgument.parse(args[i]));
            }
            table = execute(module, DumpRequest.build(module.name(), arguments));
        } catch (IllegalArgumentException | OracleBridgeException e) {
            stderr.println("Error: " + e.getMessage());
            if (!module.usage().isEmpty()) {
                stderr.println();
                stderr.println("Module usage:");
                stderr.println("  " + module.usage());
            }
            return 1;
        }
        writer.writeTable(table);
        return 0;
    }

    private int runBatch(InputStream stdin, FrameWriter writer, PrintStream stderr, boolean lenient)
            throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        int failures = 0;

        String line;
        while ((line = in.readLine()) != null) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            try {
                DumpRequest request = DumpRequest.parseWireLine(trimmed);
                DumpModule module = modules.get(request.module());
                if (module == null) {
                    throw new IllegalArgumentException("Unknown dump module: " + request.module());
                }
                writer.writeFrame(request, execute(module, request));
            } catch (IllegalArgumentException | OracleBridgeException e) {
                failures++;
                stderr.println("Error in request '" + trimmed + "': " + e.getMessage());
            }
        }
        return failures > 0 && !lenient ? 1 : 0;
    }

    private static RawTable execute(DumpModule module, DumpRequest request) {
        DumpContext context = new DumpContext(request, module.schema());
        module.run(context);
        return context.table();
    }

    private void usage(PrintStream stderr) {
        stderr.println("Usage:");
        stderr.println("  <oracle> <module> [key=value ...]");
        stderr.println("  <oracle> batch [--lenient]   (reads wire lines from stdin)");
        stderr.println();
        stderr.println("Available dumps:");
        for (DumpModule module : modules.values()) {
            stderr.println("  " + module.name() + (module.usage().isEmpty() ? "" : "  " + module.usage()));
        }
    }
}
