package io.github.trustedsql.common;

import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when a value is not a member of the {@link Allowlist} it was checked against.
 */
public class ValidationException extends Exception {

    private static final Escaper ESCAPER = buildEscaper();

    private final String rejectedValue;
    private final ImmutableSet<String> allowlistItems;

    public ValidationException(String rejectedValue, Set<String> allowlistItems, int maxListedItems) {
        super(String.format("value %s is not in allowlist %s",
                quote(rejectedValue), describe(allowlistItems, maxListedItems)));
        this.rejectedValue = rejectedValue;
        this.allowlistItems = ImmutableSet.copyOf(allowlistItems);
    }

    public String rejectedValue() {
        return rejectedValue;
    }

    public ImmutableSet<String> allowlistItems() {
        return allowlistItems;
    }

    private static String quote(String value) {
        return value == null ? "null" : '"' + ESCAPER.escape(value) + '"';
    }

    // Keeps rejected values on one line with unambiguous quoting.
    private static Escaper buildEscaper() {
        var builder = Escapers.builder()
                .addEscape('"', "\\\"")
                .addEscape('\\', "\\\\")
                .addEscape('\n', "\\n")
                .addEscape('\r', "\\r")
                .addEscape('\t', "\\t");
        for (char c = 0; c < 0x20; c++) {
            if (c != '\n' && c != '\r' && c != '\t') {
                builder.addEscape(c, String.format("\\u%04x", (int) c));
            }
        }
        for (char c : new char[]{0x7f, 0x85, 0x2028, 0x2029}) {
            builder.addEscape(c, String.format("\\u%04x", (int) c));
        }
        return builder.build();
    }

    private static String describe(Set<String> items, int maxListedItems) {
        var listed = items.stream()
                .limit(maxListedItems)
                .map(ValidationException::quote)
                .collect(Collectors.joining(", "));
        int remaining = items.size() - Math.min(items.size(), maxListedItems);
        if (remaining > 0) {
            listed = listed.isEmpty()
                    ? String.format("... (%d more)", remaining)
                    : String.format("%s, ... (%d more)", listed, remaining);
        }
        return "[" + listed + "]";
    }
}
