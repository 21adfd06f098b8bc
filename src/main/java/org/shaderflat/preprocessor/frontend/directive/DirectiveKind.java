package org.shaderflat.preprocessor.frontend.directive;

/**
 * The kinds of lines the directive parser distinguishes.
 */
public enum DirectiveKind {
    /** {@code #version ...} */
    VERSION,
    /** {@code #include <name>} or {@code #include "name"} */
    INCLUDE,
    /** {@code #pragma once} */
    PRAGMA_ONCE,
    /** {@code #ifndef NAME} */
    GUARD_OPEN,
    /** {@code #endif} */
    GUARD_CLOSE,
    /** {@code #define NAME ...} */
    DEFINE,
    /** Anything else, including other {@code #} lines. */
    PLAIN_LINE
}
