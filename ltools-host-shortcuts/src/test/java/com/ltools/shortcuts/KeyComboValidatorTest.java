package com.ltools.shortcuts;

import com.ltools.config.ShortcutBinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyComboValidatorTest {

    private final KeyComboValidator darwin = new KeyComboValidator("darwin");

    @Test
    void emptyCombo_isInvalid() {
        KeyValidationResult r = darwin.validate(" + ");
        assertFalse(r.valid());
        assertEquals(List.of("key combination is empty"), r.errors());
    }

    @Test
    void cmdWithSixToNine_isUnstable() {
        KeyValidationResult r = darwin.validate("Cmd+Shift+7");
        assertFalse(r.valid());
        assertEquals(KeyStability.UNSTABLE, r.stability());
        assertEquals("cmd+shift+f7", r.suggestion());
        assertTrue(new KeyComboValidator("linux").validate("ctrl+7").valid());
    }

    @Test
    void systemShortcuts_areWarnedNotRejected() {
        KeyValidationResult r = darwin.validate("cmd+c");
        assertTrue(r.valid());
        assertEquals(KeyStability.SYSTEM_RESERVED, r.stability());
        assertTrue(r.warnings().get(0).contains("Copy"));
        assertEquals(KeyStability.STABLE, new KeyComboValidator("darwin", true).validate("cmd+c").stability());
    }

    @Test
    void warnings_forModifiersAndShiftLetter() {
        assertEquals(KeyStability.MOSTLY_STABLE, darwin.validate("ctrl+alt+shift+k").stability());
        assertTrue(darwin.validate("shift+a").warnings().stream().anyMatch(w -> w.startsWith("Shift+Letter")));
        assertEquals(KeyStability.SYSTEM_RESERVED, darwin.validate("ctrl+f2").stability());
    }

    @Test
    void keyCombos_normalizeParseAndFormat() {
        assertEquals("cmd+shift+s", KeyCombos.normalize("Cmd - Shift_S"));
        assertEquals(new KeyCombos.Parsed("ctrl+cmd+alt", "k"), KeyCombos.parse("control+meta+option+K"));
        assertEquals("⌘+⇧+S", KeyCombos.format("cmd+shift+s", "darwin"));
        assertEquals("Ctrl+Alt+DELETE", KeyCombos.format("ctrl+alt+delete", "windows"));
    }

    @Test
    void table_skipsInvalidDisabledAndConflictingBindings() {
        ShortcutTable table = ShortcutTable.build(List.of(
                new ShortcutBinding("cmd+5", "search.window.builtin"),
                new ShortcutBinding("cmd+8", "kanban.builtin"),
                new ShortcutBinding("cmd+shift+k", "kanban.builtin", false),
                new ShortcutBinding("CMD+5", "calculator.builtin")), darwin);

        assertEquals(1, table.size());
        assertEquals("search.window.builtin", table.lookup("cmd + 5").orElseThrow());
        assertTrue(table.lookup("cmd+8").isEmpty());
        assertEquals(List.of("cmd+5"), table.combosFor("search.window.builtin"));
    }
}
