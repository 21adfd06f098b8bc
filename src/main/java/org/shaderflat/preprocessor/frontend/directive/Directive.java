package org.shaderflat.preprocessor.frontend.directive;

import org.shaderflat.preprocessor.frontend.io.SourceLine;

/**
 * A classified source line. Every line is classified exactly once by the
 * {@link DirectiveScanner}; the parser then switches over {@link #kind()}.
 */
public sealed interface Directive permits Directive.Version, Directive.Include, Directive.PragmaOnce,
        Directive.GuardOpen, Directive.GuardClose, Directive.Define, Directive.PlainLine {

    /**
     * @return The kind of this directive.
     */
    DirectiveKind kind();

    /**
     * @return The source line the directive was read from.
     */
    SourceLine line();

    /**
     * {@code #version ...}; the whole line is emitted verbatim when accepted.
     * @param line The source line.
     */
    record Version(SourceLine line) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.VERSION;
        }
    }

    /**
     * {@code #include} with a validated target.
     * @param line The source line.
     * @param target The include target.
     */
    record Include(SourceLine line, IncludeTarget target) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.INCLUDE;
        }
    }

    /**
     * {@code #pragma once}.
     * @param line The source line.
     */
    record PragmaOnce(SourceLine line) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.PRAGMA_ONCE;
        }
    }

    /**
     * {@code #ifndef NAME}.
     * @param line The source line.
     * @param name The guard name.
     */
    record GuardOpen(SourceLine line, String name) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.GUARD_OPEN;
        }
    }

    /**
     * {@code #endif}.
     * @param line The source line.
     */
    record GuardClose(SourceLine line) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.GUARD_CLOSE;
        }
    }

    /**
     * {@code #define NAME ...}.
     * @param line The source line.
     * @param name The macro name.
     */
    record Define(SourceLine line, String name) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.DEFINE;
        }
    }

    /**
     * A line without a recognized directive.
     * @param line The source line.
     */
    record PlainLine(SourceLine line) implements Directive {
        @Override
        public DirectiveKind kind() {
            return DirectiveKind.PLAIN_LINE;
        }
    }
}
