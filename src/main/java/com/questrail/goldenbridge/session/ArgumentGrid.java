package com.questrail.goldenbridge.session;

import com.questrail.goldenbridge.model.DumpArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ArgumentGrid
 * -----------------------------------------------------------------------------
 * Cartesian product of explicit argument cases and named value axes.
 *
 * <p>Combinations are produced in declaration order: cases outermost, then
 * each axis in the order it was added, the last axis varying fastest. With no
 * case declared a single empty case is assumed. An axis with no values yields
 * no combinations at all.</p>
 *
 * <pre>
 *   cases  [ {trans=0}, {trans=1} ]
 *   axis   Z = 26, 29
 *   -&gt;     {trans=0, Z=26} {trans=0, Z=29} {trans=1, Z=26} {trans=1, Z=29}
 * </pre>
 */
public final class ArgumentGrid
{
    private final List<List<DumpArgument>> combinations;

    private ArgumentGrid(List<List<DumpArgument>> combinations) {
        this.combinations = combinations;
    }

    public List<List<DumpArgument>> combinations() {
        return combinations;
    }

    public int size() {
        return combinations.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<List<DumpArgument>> cases = new ArrayList<>();
        private final List<String> axisKeys = new ArrayList<>();
        private final List<List<String>> axisValues = new ArrayList<>();

        public Builder addCase(List<DumpArgument> arguments) {
            Objects.requireNonNull(arguments, "arguments");
            cases.add(List.copyOf(arguments));
            return this;
        }

        /**
         * Adds a case written as whitespace-separated {@code key=value} tokens.
         */
        public Builder addCase(String tokens) {
            Objects.requireNonNull(tokens, "tokens");
            List<DumpArgument> arguments = new ArrayList<>();
            for (String token : tokens.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    arguments.add(DumpArgument.parse(token));
                }
            }
            return addCase(arguments);
        }

        public Builder addAxis(String key, List<String> values) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(values, "values");
            axisKeys.add(key);
            axisValues.add(List.copyOf(values));
            return this;
        }

        public ArgumentGrid build() {
            List<List<DumpArgument>> result = new ArrayList<>();
            List<List<DumpArgument>> base = cases.isEmpty() ? List.of(List.of()) : cases;
            for (List<DumpArgument> c : base) {
                expand(0, new ArrayList<>(c), result);
            }
            return new ArgumentGrid(Collections.unmodifiableList(result));
        }

        private void expand(int axis, List<DumpArgument> prefix, List<List<DumpArgument>> out) {
            if (axis == axisKeys.size()) {
                out.add(List.copyOf(prefix));
                return;
            }
            for (String value : axisValues.get(axis)) {
                prefix.add(DumpArgument.of(axisKeys.get(axis), value));
                expand(axis + 1, prefix, out);
                prefix.remove(prefix.size() - 1);
            }
        }
    }
}
