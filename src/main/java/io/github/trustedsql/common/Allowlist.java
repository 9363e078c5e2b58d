package io.github.trustedsql.common;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CompileTimeConstant;
import io.github.trustedsql.common.util.DiagnosticSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * An immutable set of permitted values, used to turn runtime strings such as column or table
 * names into {@link ValidatedString}s. Matching is exact and case-sensitive.
 *
 * <pre>{@code
 * var columns = Allowlist.of("first_name", "middle_name", "last_name");
 * var column = columns.validate(request.column());
 * var sql = ValidatedStrings.concat(
 *         ValidatedString.wrap("SELECT COUNT(*) FROM users WHERE "), column, ValidatedString.wrap(" = ?"));
 * }</pre>
 *
 * Safe to share between threads.
 */
public final class Allowlist {

    private static final Logger logger = LoggerFactory.getLogger(Allowlist.class);

    private final ImmutableSet<String> items;
    private final DiagnosticSettings diagnostics;

    private Allowlist(ImmutableSet<String> items, DiagnosticSettings diagnostics) {
        this.items = items;
        this.diagnostics = diagnostics;
    }

    public static Allowlist of(ValidatedString firstItem, ValidatedString... otherItems) {
        var builder = ImmutableSet.<String>builderWithExpectedSize(otherItems.length + 1);
        builder.add(Objects.requireNonNull(firstItem, "firstItem").toString());
        for (var item : otherItems) {
            builder.add(Objects.requireNonNull(item, "item").toString());
        }
        return new Allowlist(builder.build(), DiagnosticSettings.defaults());
    }

    /**
     * Builds an allowlist from literals written in source code. Like
     * {@link ValidatedString#wrap(String)}, the items must be compile-time constants.
     */
    public static Allowlist of(@CompileTimeConstant String firstItem, @CompileTimeConstant String... otherItems) {
        var builder = ImmutableSet.<String>builderWithExpectedSize(otherItems.length + 1);
        builder.add(Objects.requireNonNull(firstItem, "firstItem"));
        for (var item : otherItems) {
            builder.add(Objects.requireNonNull(item, "item"));
        }
        return new Allowlist(builder.build(), DiagnosticSettings.defaults());
    }

    public Allowlist withDiagnostics(DiagnosticSettings diagnostics) {
        return new Allowlist(items, Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    /**
     * Returns {@code value} as a {@link ValidatedString} if it is one of the allowed items.
     *
     * @throws ValidationException if {@code value} is not allowed
     */
    public ValidatedString validate(String value) throws ValidationException {
        if (value != null && items.contains(value)) {
            return ValidatedString.trusted(value);
        }
        var e = new ValidationException(value, items, diagnostics.maxListedItems());
        if (diagnostics.logRejections()) {
            logger.atDebug().log(e.getMessage());
        }
        throw e;
    }

    /**
     * Like {@link #validate(String)}, for values the caller already knows to be allowed.
     * A rejection here is a bug in the calling code. Logging it is left to the caller.
     *
     * @throws IllegalArgumentException if {@code value} is not allowed
     */
    public ValidatedString mustValidate(String value) {
        try {
            return validate(value);
        } catch (ValidationException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    public boolean contains(String value) {
        return value != null && items.contains(value);
    }

    public ImmutableSet<String> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public DiagnosticSettings diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "Allowlist" + items;
    }
}
