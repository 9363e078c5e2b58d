package io.github.trustedsql.common;

import java.util.Objects;

/**
 * Operations that combine {@link ValidatedString}s. Every argument is a {@code ValidatedString},
 * so the result is trusted whenever its inputs are.
 */
public final class ValidatedStrings {

    private ValidatedStrings() {
    }

    public static ValidatedString concat(ValidatedString a, ValidatedString b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return ValidatedString.trusted(a.toString().concat(b.toString()));
    }

    public static ValidatedString concat(ValidatedString first, ValidatedString... rest) {
        var builder = new StringBuilder(Objects.requireNonNull(first, "first").toString());
        for (var fragment : rest) {
            builder.append(Objects.requireNonNull(fragment, "fragment"));
        }
        return ValidatedString.trusted(builder.toString());
    }

    /**
     * Concatenates {@code elements}, placing {@code separator} between consecutive elements.
     * No elements yields the empty string and a single element is returned as is.
     */
    public static ValidatedString join(Iterable<ValidatedString> elements, ValidatedString separator) {
        Objects.requireNonNull(separator, "separator");
        var iterator = elements.iterator();
        if (!iterator.hasNext()) {
            return ValidatedString.empty();
        }
        var first = Objects.requireNonNull(iterator.next(), "element");
        if (!iterator.hasNext()) {
            return first;
        }
        var builder = new StringBuilder(first.toString());
        while (iterator.hasNext()) {
            builder.append(separator).append(Objects.requireNonNull(iterator.next(), "element"));
        }
        return ValidatedString.trusted(builder.toString());
    }

    /**
     * Replaces the first {@code n} non-overlapping occurrences of {@code old}, scanning left to
     * right. A negative {@code n} replaces every occurrence. An empty {@code old} matches at the
     * start of {@code s} and after each code point.
     */
    public static ValidatedString replace(ValidatedString s, ValidatedString old,
                                          ValidatedString replacement, int n) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(old, "old");
        Objects.requireNonNull(replacement, "replacement");
        if (n == 0 || old.equals(replacement)) {
            return s;
        }
        var text = s.toString();
        var target = old.toString();
        int matches = countMatches(text, target);
        if (matches == 0) {
            return s;
        }
        if (n < 0 || matches < n) {
            n = matches;
        }

        var builder = new StringBuilder(text.length() + n * (replacement.length() - target.length()));
        int start = 0;
        for (int i = 0; i < n; i++) {
            int j = start;
            if (target.isEmpty()) {
                if (i > 0) {
                    j += Character.charCount(text.codePointAt(start));
                }
            } else {
                j = text.indexOf(target, start);
            }
            builder.append(text, start, j).append(replacement);
            start = j + target.length();
        }
        builder.append(text, start, text.length());
        return ValidatedString.trusted(builder.toString());
    }

    public static ValidatedString replaceAll(ValidatedString s, ValidatedString old, ValidatedString replacement) {
        return replace(s, old, replacement, -1);
    }

    private static int countMatches(String text, String target) {
        if (target.isEmpty()) {
            return text.codePointCount(0, text.length()) + 1;
        }
        int count = 0;
        int from = 0;
        int at;
        while ((at = text.indexOf(target, from)) >= 0) {
            count++;
            from = at + target.length();
        }
        return count;
    }
}
