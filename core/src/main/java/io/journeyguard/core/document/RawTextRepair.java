package io.journeyguard.core.document;

import java.util.List;
import java.util.Objects;

/**
 * Collapses over-escaped sequences in raw document text before it is parsed. A value such as
 * {@code "[\\n  {\\"key\\": 1}]"} (a double backslash before the escape character) becomes
 * {@code "[\n  {\"key\": 1}]"}.
 *
 * <p>
 * Passes repeat until one changes nothing, so several levels of over-escaping are removed.
 */
public final class RawTextRepair {

    static final int MAX_PASSES = 10;

    private static final List<Replacement> REPLACEMENTS = List.of(
            new Replacement("\\\\\"", "\\\""),
            new Replacement("\\\\n", "\\n"),
            new Replacement("\\\\t", "\\t"),
            new Replacement("\\\\r", "\\r"),
            new Replacement("\\\\/", "\\/"));

    private RawTextRepair() {
        // utility class
    }

    /**
     * Repairs the given text.
     *
     * @param text raw document text
     * @return the repaired text and the number of sequences collapsed
     */
    public static Result repair(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String current = text;
        int total = 0;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            int changed = 0;
            for (Replacement replacement : REPLACEMENTS) {
                int count = occurrences(current, replacement.pattern());
                if (count > 0) {
                    current = current.replace(replacement.pattern(), replacement.value());
                    changed += count;
                }
            }
            total += changed;
            if (changed == 0) {
                break;
            }
        }
        return new Result(current, total);
    }

    private static int occurrences(String text, String pattern) {
        int count = 0;
        int from = text.indexOf(pattern);
        while (from >= 0) {
            count++;
            from = text.indexOf(pattern, from + pattern.length());
        }
        return count;
    }

    private record Replacement(String pattern, String value) {}

    /**
     * @param text  the repaired text
     * @param fixes number of over-escaped sequences collapsed
     */
    public record Result(String text, int fixes) {

        public boolean changed() {
            return fixes > 0;
        }
    }
}
