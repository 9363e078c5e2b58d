package io.github.trustedsql.common;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.Objects;

/**
 * Accumulates {@link ValidatedString} fragments into a single buffer, avoiding the copying of
 * repeated {@link ValidatedStrings#concat} calls. Not thread-safe.
 */
public final class ValidatedStringBuilder {

    private StringBuilder buffer = new StringBuilder(0);

    @CanIgnoreReturnValue
    public ValidatedStringBuilder append(ValidatedString fragment) {
        buffer.append(Objects.requireNonNull(fragment, "fragment").toString());
        return this;
    }

    /**
     * Ensures that at least {@code n} more chars can be appended without another allocation.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public void grow(int n) {
        Preconditions.checkArgument(n >= 0, "negative grow count: %s", n);
        if (n > Integer.MAX_VALUE - buffer.length()) {
            throw new OutOfMemoryError("Required capacity exceeds implementation limit");
        }
        buffer.ensureCapacity(buffer.length() + n);
    }

    public int length() {
        return buffer.length();
    }

    public int capacity() {
        return buffer.capacity();
    }

    /**
     * Clears the content and releases the buffer, so {@link #capacity()} drops back to zero.
     */
    public void reset() {
        buffer = new StringBuilder(0);
    }

    public ValidatedString toValidatedString() {
        return ValidatedString.trusted(buffer.toString());
    }

    /**
     * Returns the accumulated plain text, for handing straight to the SQL layer.
     */
    @Override
    public String toString() {
        return buffer.toString();
    }
}
