package com.questrail.goldenbridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DumpRequest
 * -----------------------------------------------------------------------------
 * Immutable, canonical identifier for "compute reference data for
 * {module, arguments}".
 *
 * <h2>Canonical form</h2>
 * Arguments are sorted by key at construction time. Equality, hashing and the
 * wire line are all derived from the sorted sequence, so two requests built
 * from permutations of the same pairs are interchangeable as cache keys:
 *
 * <pre>
 *   build("X", [b=2, a=1]).toWireLine()  ==  "X a=1 b=2"
 *   build("X", [a=1, b=2]).toWireLine()  ==  "X a=1 b=2"
 * </pre>
 *
 * <h2>Wire line</h2>
 * {@code <module> <key1>=<value1> <key2>=<value2> ...}. It is the batch input
 * line sent to the oracle, the echo inside a {@code #BEGIN} marker, and the
 * identifier quoted in cache-miss and schema diagnostics.
 */
public final class DumpRequest implements Comparable<DumpRequest>
{
    private final String module;
    private final List<DumpArgument> arguments;
    private final String wireLine;

    private DumpRequest(String module, List<DumpArgument> sortedArguments) {
        this.module = module;
        this.arguments = Collections.unmodifiableList(sortedArguments);

        StringBuilder sb = new StringBuilder(module);
        for (DumpArgument argument : sortedArguments) {
            sb.append(' ').append(argument.toWireToken());
        }
        this.wireLine = sb.toString();
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    /**
     * Builds a request from already-normalized arguments.
     *
     * @throws DuplicateArgumentException if two arguments share a key
     * @throws InvalidRequestException if the module name is not a wire token
     */
    public static DumpRequest build(String module, Iterable<DumpArgument> arguments) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(arguments, "arguments");
        DumpArgument.requireToken("module name", module);

        List<DumpArgument> sorted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DumpArgument argument : arguments) {
            Objects.requireNonNull(argument, "argument");
            if (!seen.add(argument.key())) {
                throw new DuplicateArgumentException(module, argument.key());
            }
            sorted.add(argument);
        }
        sorted.sort(DumpArgument.BY_KEY);
        return new DumpRequest(module, sorted);
    }

    public static DumpRequest of(String module, DumpArgument... arguments) {
        return build(module, List.of(arguments));
    }

    /**
     * Builds a request from loosely-typed pairs, coercing keys and values to
     * their string wire form with {@link String#valueOf(Object)}.
     */
    public static DumpRequest fromPairs(String module, Iterable<? extends Map.Entry<?, ?>> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        List<DumpArgument> arguments = new ArrayList<>();
        for (Map.Entry<?, ?> pair : pairs) {
            arguments.add(DumpArgument.of(pair.getKey(), pair.getValue()));
        }
        return build(module, arguments);
    }

    /**
     * Parses a wire line ({@code module key=value ...}). Token order is
     * irrelevant; the result is canonical.
     */
    public static DumpRequest parseWireLine(String line) {
        Objects.requireNonNull(line, "line");
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException("Empty request line");
        }

        final String[] tokens = trimmed.split("\\s+");
        List<DumpArgument> arguments = new ArrayList<>(tokens.length - 1);
        for (int i = 1; i < tokens.length; i++) {
            arguments.add(DumpArgument.parse(tokens[i]));
        }
        return build(tokens[0], arguments);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String module() {
        return module;
    }

    /**
     * Arguments in canonical (key-sorted) order.
     */
    public List<DumpArgument> arguments() {
        return arguments;
    }

    public Optional<String> argument(String key) {
        for (DumpArgument argument : arguments) {
            if (argument.key().equals(key)) {
                return Optional.of(argument.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Arguments as an insertion-ordered map (which is canonical order).
     */
    public Map<String, String> argumentMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (DumpArgument argument : arguments) {
            map.put(argument.key(), argument.value());
        }
        return Collections.unmodifiableMap(map);
    }

    public String toWireLine() {
        return wireLine;
    }

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    @Override
    public int compareTo(DumpRequest other) {
        return wireLine.compareTo(other.wireLine);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DumpRequest)) {
            return false;
        }
        DumpRequest other = (DumpRequest) o;
        return module.equals(other.module) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, arguments);
    }

    @Override
    public String toString() {
        return wireLine;
    }
}
