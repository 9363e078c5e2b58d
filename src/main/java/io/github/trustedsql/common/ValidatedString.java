package io.github.trustedsql.common;

import com.google.errorprone.annotations.CompileTimeConstant;
import com.google.errorprone.annotations.Immutable;

import java.util.Objects;

/**
 * A piece of SQL text that is safe to splice into a query.
 *
 * <p>Instances come only from {@link #wrap(String)} with a literal written in source code,
 * from {@link Allowlist#validate(String)},
 * from {@link #fromInt(int)} / {@link #fromLong(long)}, or from combining other instances
 * with {@link ValidatedStrings} or {@link ValidatedStringBuilder}.
 *
 * <p>{@code wrap} is only checked at build time when the Error Prone compiler plugin is enabled,
 * which enforces {@link CompileTimeConstant}. Without it, passing a variable to {@code wrap}
 * compiles and silently defeats the guarantee. Keep {@code wrap} calls to string literals and
 * {@code static final} constants, and validate everything else through an allowlist.
 */
@Immutable
public final class ValidatedString implements Comparable<ValidatedString> {

    private static final ValidatedString EMPTY = new ValidatedString("");

    private final String value;

    private ValidatedString(String value) {
        this.value = value;
    }

    /**
     * Wraps a literal written by the developer. Never pass a value derived from input,
     * configuration or any other runtime source.
     */
    public static ValidatedString wrap(@CompileTimeConstant String literal) {
        return new ValidatedString(Objects.requireNonNull(literal, "literal"));
    }

    public static ValidatedString empty() {
        return EMPTY;
    }

    public static ValidatedString fromInt(int i) {
        return new ValidatedString(Integer.toString(i));
    }

    public static ValidatedString fromLong(long l) {
        return new ValidatedString(Long.toString(l));
    }

    // Only for values that are already trusted: allowlist members and composition results.
    static ValidatedString trusted(String value) {
        return value.isEmpty() ? EMPTY : new ValidatedString(value);
    }

    public int length() {
        return value.length();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public ValidatedString concat(ValidatedString other) {
        return ValidatedStrings.concat(this, other);
    }

    public ValidatedString replace(ValidatedString old, ValidatedString replacement, int n) {
        return ValidatedStrings.replace(this, old, replacement, n);
    }

    public ValidatedString replaceAll(ValidatedString old, ValidatedString replacement) {
        return ValidatedStrings.replaceAll(this, old, replacement);
    }

    /**
     * Returns the plain text. Call this only when handing the finished query to the SQL layer.
     */
    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ValidatedString other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(ValidatedString o) {
        return value.compareTo(o.value);
    }
}
