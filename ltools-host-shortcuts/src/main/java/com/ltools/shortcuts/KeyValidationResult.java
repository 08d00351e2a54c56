package com.ltools.shortcuts;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link KeyComboValidator#validate}.
 *
 * @param valid      false if the combo must not be registered
 * @param stability  stability level
 * @param warnings   non-fatal findings
 * @param errors     reasons the combo is invalid
 * @param suggestion suggested replacement for an invalid combo; null if none
 */
public record KeyValidationResult(boolean valid, KeyStability stability, List<String> warnings,
                                  List<String> errors, String suggestion) {

    public KeyValidationResult {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public Optional<String> suggested() {
        return Optional.ofNullable(suggestion);
    }
}
