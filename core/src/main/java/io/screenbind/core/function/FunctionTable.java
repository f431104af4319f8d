package io.screenbind.core.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed, immutable name → function table. The evaluator resolves call nodes here and nowhere
 * else: there is no fallback lookup and no way to reach a function that was not registered when
 * the table was built.
 *
 * <p>
 * Thread-safe: immutable after {@link Builder#build()}.
 */
public final class FunctionTable {

    private final Map<String, SafeFunction> functions;

    private FunctionTable(Map<String, SafeFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /**
     * Looks up a function by name.
     *
     * @return the function, or empty if not in the table
     */
    public Optional<SafeFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /** Returns {@code true} if a function with the given name is in the table. */
    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    /** Registered names, in registration order. */
    public Set<String> names() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder seeded with every entry of this table. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.functions.putAll(functions);
        return builder;
    }

    public static final class Builder {

        private final Map<String, SafeFunction> functions = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a function. A later registration under the same name replaces the earlier
         * one (last-write-wins).
         *
         * @throws NullPointerException     if name or function is null
         * @throws IllegalArgumentException if name is empty
         */
        public Builder register(String name, SafeFunction function) {
            if (name == null) {
                throw new NullPointerException("function name must not be null");
            }
            if (name.isEmpty()) {
                throw new IllegalArgumentException("function name must not be empty");
            }
            if (function == null) {
                throw new NullPointerException("function must not be null");
            }
            functions.put(name, function);
            return this;
        }

        public FunctionTable build() {
            return new FunctionTable(functions);
        }
    }
}
