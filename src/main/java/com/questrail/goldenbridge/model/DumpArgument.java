package com.questrail.goldenbridge.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One {@code key=value} pair of a {@link DumpRequest}, already in wire form.
 *
 * <p>Neither part may be empty or contain {@code '='} or whitespace; the wire
 * line is only an unambiguous identifier while that holds.</p>
 */
public record DumpArgument(String key, String value) implements Comparable<DumpArgument>
{
    static final Comparator<DumpArgument> BY_KEY = Comparator.comparing(DumpArgument::key);

    public DumpArgument {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        requireToken("argument key", key);
        requireToken("value of argument '" + key + "'", value);
    }

    /**
     * Creates an argument from arbitrary objects by taking their string form.
     */
    public static DumpArgument of(Object key, Object value) {
        return new DumpArgument(String.valueOf(key), String.valueOf(value));
    }

    /**
     * Parses a single {@code key=value} token. The first {@code '='} splits
     * the token, so a second one lands in the value and is rejected there.
     */
    public static DumpArgument parse(String token) {
        Objects.requireNonNull(token, "token");
        final int idx = token.indexOf('=');
        if (idx <= 0 || idx == token.length() - 1) {
            throw new InvalidRequestException(
                    "Invalid argument '" + token + "', expected key=value");
        }
        return new DumpArgument(token.substring(0, idx), token.substring(idx + 1));
    }

    public String toWireToken() {
        return key + "=" + value;
    }

    @Override
    public int compareTo(DumpArgument other) {
        return BY_KEY.compare(this, other);
    }

    @Override
    public String toString() {
        return toWireToken();
    }

    static void requireToken(String what, String token) {
        if (token.isEmpty()) {
            throw new InvalidRequestException(what + " must not be empty");
        }
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if (c == '=' || Character.isWhitespace(c)) {
                throw new InvalidRequestException(
                        what + " '" + token + "' must not contain '=' or whitespace");
            }
        }
    }
}
