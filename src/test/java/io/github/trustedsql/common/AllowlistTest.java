package io.github.trustedsql.common;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.trustedsql.common.util.DiagnosticSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class AllowlistTest {

    private static final Allowlist ALLOWLIST = Allowlist.of("foo", "bar", "tar");

    @ParameterizedTest
    @ValueSource(strings = {"foo", "bar", "tar"})
    public void testValidateMember(String value) throws ValidationException {
        assertEquals(value, ALLOWLIST.validate(value).toString());
        assertEquals(value, ALLOWLIST.mustValidate(value).toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"baz", "FOO", "foo ", " foo", "", "foo; DROP TABLE users; --"})
    public void testValidateRejects(String value) {
        var thrown = assertThrows(ValidationException.class, () -> ALLOWLIST.validate(value));
        assertEquals(value, thrown.rejectedValue());
        assertEquals(List.of("foo", "bar", "tar"), thrown.allowlistItems().asList());
        assertFalse(ALLOWLIST.contains(value));
    }

    @Test
    public void testValidateRejectsNull() {
        var thrown = assertThrows(ValidationException.class, () -> ALLOWLIST.validate(null));
        assertNull(thrown.rejectedValue());
        assertEquals("value null is not in allowlist [\"foo\", \"bar\", \"tar\"]", thrown.getMessage());
    }

    @Test
    public void testMustValidateRejects() {
        var thrown = assertThrows(IllegalArgumentException.class, () -> ALLOWLIST.mustValidate("baz"));
        assertInstanceOf(ValidationException.class, thrown.getCause());
        assertEquals("value \"baz\" is not in allowlist [\"foo\", \"bar\", \"tar\"]", thrown.getMessage());
    }

    @Test
    public void testValidatedStringItems() throws ValidationException {
        var allowlist = Allowlist.of(ValidatedString.wrap("users"), ValidatedString.wrap("customers"));
        assertEquals(ValidatedString.wrap("customers"), allowlist.validate("customers"));
        assertThrows(ValidationException.class, () -> allowlist.validate("orders"));
    }

    @Test
    public void testDuplicateItemsCollapse() {
        var allowlist = Allowlist.of("a", "b", "a");
        assertEquals(2, allowlist.size());
        assertEquals(List.of("a", "b"), allowlist.items().asList());
        assertTrue(allowlist.contains("a"));
        assertFalse(allowlist.contains(null));
    }

    @Test
    public void testMessageTruncatedByDefaultSettings() {
        // src/test/resources/application.conf lowers max-listed-items to 3
        var allowlist = Allowlist.of("a", "b", "c", "d", "e");
        var thrown = assertThrows(ValidationException.class, () -> allowlist.validate("z"));
        assertEquals("value \"z\" is not in allowlist [\"a\", \"b\", \"c\", ... (2 more)]", thrown.getMessage());
        assertEquals(5, thrown.allowlistItems().size());
    }

    @Test
    public void testWithDiagnostics() {
        var allowlist = Allowlist.of("a", "b").withDiagnostics(new DiagnosticSettings(false, 0));
        assertFalse(allowlist.diagnostics().logRejections());
        var thrown = assertThrows(ValidationException.class, () -> allowlist.validate("z"));
        assertEquals("value \"z\" is not in allowlist [... (2 more)]", thrown.getMessage());
    }

    @Test
    public void testEndToEnd() throws ValidationException {
        var columns = Allowlist.of("first_name", "middle_name", "last_name");
        var column = columns.validate("middle_name");
        assertEquals("middle_name", column.toString());

        var query = ValidatedStrings.concat(
                ValidatedString.wrap("SELECT COUNT(*) FROM users WHERE "), column, ValidatedString.wrap(" = ?;"));
        assertEquals("SELECT COUNT(*) FROM users WHERE middle_name = ?;", query.toString());

        assertThrows(ValidationException.class, () -> columns.validate("true; DROP TABLE users; --"));
    }

    @Test
    public void testRejectedValueIsEscapedInMessage() {
        var value = "x\"\n[main] INFO admin login ok \"y\\\u0000";
        var thrown = assertThrows(ValidationException.class, () -> ALLOWLIST.validate(value));
        assertEquals(value, thrown.rejectedValue());
        assertFalse(thrown.getMessage().contains("\n"));
        assertEquals("value \"x\\\"\\n[main] INFO admin login ok \\\"y\\\\\\u0000\" is not in allowlist "
                + "[\"foo\", \"bar\", \"tar\"]", thrown.getMessage());
    }

    @Test
    public void testMalformedConfigFailsOnEveryCall() {
        var key = "trusted-sql.diagnostics.max-listed-items";
        System.setProperty(key, "many");
        ConfigFactory.invalidateCaches();
        try {
            for (int i = 0; i < 2; i++) {
                assertThrows(ConfigException.WrongType.class, () -> Allowlist.of("a", "b"));
            }
        } finally {
            System.clearProperty(key);
            ConfigFactory.invalidateCaches();
        }
        assertEquals(2, Allowlist.of("a", "b").size());
    }

    @Test
    public void testConcurrentValidate() {
        var allowlist = Allowlist.of("even", "odd");
        var results = IntStream.range(0, 10_000)
                .parallel()
                .mapToObj(i -> {
                    try {
                        return allowlist.validate(i % 2 == 0 ? "even" : "odd").toString();
                    } catch (ValidationException e) {
                        throw new RuntimeException(e);
                    }
                })
                .collect(Collectors.groupingBy(s -> s, Collectors.counting()));
        assertEquals(5_000L, results.get("even"));
        assertEquals(5_000L, results.get("odd"));

        var rejected = IntStream.range(0, 1_000)
                .parallel()
                .filter(i -> assertThrows(ValidationException.class,
                        () -> allowlist.validate("odd" + i)).rejectedValue().equals("odd" + i))
                .count();
        assertEquals(1_000L, rejected);
    }
}
