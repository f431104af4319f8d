package io.screenbind.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive metadata for a safe function, used by editor help and autocomplete panels. Has no
 * bearing on evaluation.
 *
 * @param params      parameter names; optional ones end in {@code ?}, variadic ones start with
 *                    {@code ...}
 * @param returnType  informal return type name
 * @param description one-line description
 */
public record FunctionSignature(List<String> params, String returnType, String description) {

    public FunctionSignature {
        params = params != null ? List.copyOf(params) : List.of();
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }

    public static FunctionSignature of(String returnType, String description, String... params) {
        return new FunctionSignature(List.of(params), returnType, description);
    }
}
