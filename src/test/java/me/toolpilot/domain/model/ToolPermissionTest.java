package me.toolpilot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolPermissionTest {

    @Test
    void shouldParseFlagsInAnyOrder() {
        Set<ToolPermission> permissions = ToolPermission.parse("xr");

        assertEquals(EnumSet.of(ToolPermission.READ, ToolPermission.EXECUTE), permissions);
    }

    @Test
    void shouldIgnoreSeparatorsAndWhitespace() {
        assertEquals(EnumSet.of(ToolPermission.READ, ToolPermission.WRITE), ToolPermission.parse(" r, w "));
    }

    @Test
    void shouldParseEmptyAndNullAsNoPermissions() {
        assertTrue(ToolPermission.parse("").isEmpty());
        assertTrue(ToolPermission.parse(null).isEmpty());
    }

    @Test
    void shouldRejectUnknownFlag() {
        assertThrows(IllegalArgumentException.class, () -> ToolPermission.parse("rz"));
    }

    @Test
    void shouldFormatInCanonicalOrder() {
        assertEquals("rwxn", ToolPermission.format(EnumSet.allOf(ToolPermission.class)));
        assertEquals("rx", ToolPermission.format(EnumSet.of(ToolPermission.EXECUTE, ToolPermission.READ)));
        assertEquals("", ToolPermission.format(EnumSet.noneOf(ToolPermission.class)));
    }
}
