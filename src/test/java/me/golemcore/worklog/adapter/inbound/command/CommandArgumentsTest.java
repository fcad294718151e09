package me.golemcore.worklog.adapter.inbound.command;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandArgumentsTest {

    private static final Set<String> FLAGS = Set.of("light", "force");
    private static final Set<String> OPTIONS = Set.of("tag", "limit", "project");

    @Test
    void shouldSeparatePositionalFlagsAndOptions() {
        CommandArguments parsed = CommandArguments.parse(
                List.of("auth", "--light", "bug", "--tag", "wip", "--tag=review", "--limit", "5"), FLAGS, OPTIONS);

        assertEquals(List.of("auth", "bug"), parsed.positional());
        assertEquals("auth bug", parsed.positionalText());
        assertTrue(parsed.flag("light"));
        assertFalse(parsed.flag("force"));
        assertEquals(List.of("wip", "review"), parsed.values("tag"));
        assertEquals("review", parsed.value("tag"));
        assertEquals(5, parsed.intValue("limit"));
    }

    @Test
    void shouldReturnNullForAbsentValues() {
        CommandArguments parsed = CommandArguments.parse(List.of(), FLAGS, OPTIONS);

        assertNull(parsed.positionalText());
        assertNull(parsed.value("project"));
        assertNull(parsed.intValue("limit"));
        assertTrue(parsed.values("tag").isEmpty());
    }

    @Test
    void shouldTreatBareDoubleDashAsPositional() {
        CommandArguments parsed = CommandArguments.parse(List.of("--"), FLAGS, OPTIONS);

        assertEquals(List.of("--"), parsed.positional());
    }

    @Test
    void shouldRejectUnknownOptionAndMissingValue() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandArguments.parse(List.of("--verbose"), FLAGS, OPTIONS));
        assertThrows(IllegalArgumentException.class,
                () -> CommandArguments.parse(List.of("--project"), FLAGS, OPTIONS));
        assertThrows(IllegalArgumentException.class,
                () -> CommandArguments.parse(List.of("--light=yes"), FLAGS, OPTIONS));
    }

    @Test
    void shouldRejectNonNumericValue() {
        CommandArguments parsed = CommandArguments.parse(List.of("--limit", "many"), FLAGS, OPTIONS);

        assertThrows(IllegalArgumentException.class, () -> parsed.intValue("limit"));
    }
}
