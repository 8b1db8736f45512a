package io.github.jbellis.refactor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Failure categories reported by every operation.
 */
public enum ErrorKind {
    SYMBOL_NOT_FOUND,
    AMBIGUOUS_SYMBOL,
    NAMING_CONFLICT,
    IDENTIFIER_STALE,
    EXTRACTION_SHAPE_ERROR,
    PARSE_ERROR,
    APPLY_ERROR,
    BACKUP_NOT_FOUND,
    VALIDATION_FAILED,
    UNSUPPORTED_LANGUAGE,
    OPERATION_FAILED;

    /**
     * snake_case name used on the wire, e.g. {@code symbol_not_found}.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
