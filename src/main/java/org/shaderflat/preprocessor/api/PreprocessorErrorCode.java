package org.shaderflat.preprocessor.api;

/**
 * Defines unique, testable error codes for all errors that can occur during preprocessing.
 * This decouples the test logic from the formatted error messages.
 */
public enum PreprocessorErrorCode {
    // region Unit errors
    /** A top-level unit or a resolved include target could not be opened. */
    UNIT_UNREADABLE(Category.UNIT_UNREADABLE),
    /** An I/O error occurred after a file was opened. */
    IO_ERROR_READING_FILE(Category.UNIT_UNREADABLE),
    // endregion

    // region Directive errors
    /** A directive that requires a name (#ifndef, #define) was missing it. */
    DIRECTIVE_NEEDS_NAME(Category.DIRECTIVE_MALFORMED),
    /** An #include directive without a target. */
    EMPTY_INCLUDE(Category.DIRECTIVE_MALFORMED),
    /** An #include target not wrapped in exactly one pair of &lt;...&gt; or "...". */
    INVALID_INCLUDE_SYNTAX(Category.DIRECTIVE_MALFORMED),
    /** A #pragma with an argument other than 'once'. */
    UNSUPPORTED_PRAGMA(Category.DIRECTIVE_MALFORMED),
    // endregion

    // region Structural errors
    /** An #endif with no open guard and no active suppression. */
    ENDIF_WITHOUT_IFNDEF(Category.STRUCTURAL_MISMATCH),
    /** An #ifndef still open at the end of the session. */
    UNTERMINATED_IFNDEF(Category.STRUCTURAL_MISMATCH),
    // endregion

    // region Ordering errors
    /** A #define that is not a guard definition appeared before the accepted #version. */
    DIRECTIVE_BEFORE_VERSION(Category.ORDERING_VIOLATION),
    // endregion

    // region Inclusion errors
    /** An include target was not found in the including directory or any search directory. */
    INCLUDE_NOT_FOUND(Category.INCLUSION_FAILURE),
    /** Includes nested deeper than the configured limit, usually an unguarded include cycle. */
    INCLUDE_NESTING_TOO_DEEP(Category.INCLUSION_FAILURE);
    // endregion

    /**
     * The broad error classes a caller may want to react to.
     */
    public enum Category {
        UNIT_UNREADABLE,
        DIRECTIVE_MALFORMED,
        STRUCTURAL_MISMATCH,
        ORDERING_VIOLATION,
        INCLUSION_FAILURE
    }

    private final Category category;

    PreprocessorErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category this code belongs to.
     */
    public Category category() {
        return category;
    }
}
