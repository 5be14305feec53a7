package com.skindx.infrastructure.ai.provider;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads yes/no fields of a provider answer. Models answer with JSON booleans, but
 * also with strings such as {@code "no"} or numbers, and every reader of a flag must
 * agree on what those mean.
 */
public final class ProviderFlags {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0");

    private ProviderFlags() {
    }

    /**
     * @return the flag, or empty when the value is missing or not recognisable as a yes/no
     */
    public static Optional<Boolean> read(Object value) {
        if (value instanceof Boolean b) return Optional.of(b);
        if (value instanceof Number n) return Optional.of(n.doubleValue() != 0);
        if (value == null) return Optional.empty();

        String word = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) return Optional.of(true);
        if (FALSE_WORDS.contains(word)) return Optional.of(false);
        return Optional.empty();
    }
}
