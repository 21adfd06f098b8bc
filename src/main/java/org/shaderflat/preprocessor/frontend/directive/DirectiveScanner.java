package org.shaderflat.preprocessor.frontend.directive;

import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.api.PreprocessorErrorCode;
import org.shaderflat.preprocessor.diagnostics.Diagnostic;
import org.shaderflat.preprocessor.frontend.io.SourceLine;

/**
 * Classifies source lines into {@link Directive}s by their first token.
 * <p>
 * Only six directives are recognized: {@code #version}, {@code #include}, {@code #pragma},
 * {@code #ifndef}, {@code #define} and {@code #endif}. Any other line, including lines with
 * other preprocessor directives such as {@code #extension} or {@code #ifdef}, is a
 * {@link Directive.PlainLine}. Whitespace is allowed before the {@code #} and between the
 * {@code #} and the directive name.
 */
public final class DirectiveScanner {

    private final String fileName;

    /**
     * Creates a scanner for the lines of one file.
     * @param fileName The file name used in diagnostics.
     */
    public DirectiveScanner(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Classifies a single line.
     *
     * @param line The line to classify.
     * @return The directive the line holds.
     * @throws PreprocessingException if the line holds a recognized directive with a missing
     *                                or malformed argument.
     */
    public Directive scan(SourceLine line) throws PreprocessingException {
        String content = line.content();
        int pos = skipWhitespace(content, 0);
        if (pos >= content.length() || content.charAt(pos) != '#') {
            return new Directive.PlainLine(line);
        }

        int keywordStart = skipWhitespace(content, pos + 1);
        int keywordEnd = keywordStart;
        while (keywordEnd < content.length() && isIdentifierPart(content.charAt(keywordEnd))) {
            keywordEnd++;
        }
        String keyword = content.substring(keywordStart, keywordEnd);
        int argumentStart = skipWhitespace(content, keywordEnd);

        return switch (keyword) {
            case "version" -> new Directive.Version(line);
            case "include" -> new Directive.Include(line, scanIncludeTarget(line, argumentStart, keywordEnd));
            case "pragma" -> scanPragma(line, argumentStart, keywordEnd);
            case "ifndef" -> new Directive.GuardOpen(line, requireName(line, "#ifndef", argumentStart));
            case "define" -> new Directive.Define(line, requireName(line, "#define", argumentStart));
            case "endif" -> new Directive.GuardClose(line);
            default -> new Directive.PlainLine(line);
        };
    }

    /**
     * Classifies a line inside a suppressed region. Only {@code #ifndef} and {@code #endif} are
     * recognized, so that nested conditionals can be counted; arguments are not validated and
     * every other line is a {@link Directive.PlainLine}.
     *
     * @param line The line to classify.
     * @return The directive the line holds.
     */
    public Directive scanSuppressed(SourceLine line) {
        String content = line.content();
        int pos = skipWhitespace(content, 0);
        if (pos >= content.length() || content.charAt(pos) != '#') {
            return new Directive.PlainLine(line);
        }
        int keywordStart = skipWhitespace(content, pos + 1);
        int keywordEnd = keywordStart;
        while (keywordEnd < content.length() && isIdentifierPart(content.charAt(keywordEnd))) {
            keywordEnd++;
        }
        return switch (content.substring(keywordStart, keywordEnd)) {
            case "ifndef" -> new Directive.GuardOpen(line, "");
            case "endif" -> new Directive.GuardClose(line);
            default -> new Directive.PlainLine(line);
        };
    }

    private IncludeTarget scanIncludeTarget(SourceLine line, int argumentStart, int keywordEnd) throws PreprocessingException {
        String content = line.content();
        String argument = content.substring(argumentStart).stripTrailing();
        if (argument.isEmpty()) {
            throw error(PreprocessorErrorCode.EMPTY_INCLUDE,
                    "Empty #include directive. Expected <filename> or \"filename\".", line, keywordEnd);
        }

        char open = argument.charAt(0);
        char close = argument.charAt(argument.length() - 1);
        String name = argument.length() >= 2 ? argument.substring(1, argument.length() - 1) : "";

        if (open == '<' && close == '>' && isValidName(name, '<', '>')) {
            return new IncludeTarget(name, IncludeTarget.Style.ANGLE, argumentStart);
        }
        if (open == '"' && close == '"' && argument.length() >= 2 && isValidName(name, '"', '"')) {
            return new IncludeTarget(name, IncludeTarget.Style.QUOTED, argumentStart);
        }
        throw error(PreprocessorErrorCode.INVALID_INCLUDE_SYNTAX,
                "Formatting mismatch in #include target '" + argument + "'. Expected <filename> or \"filename\".",
                line, argumentStart);
    }

    private Directive scanPragma(SourceLine line, int argumentStart, int keywordEnd) throws PreprocessingException {
        String argument = line.content().substring(argumentStart).strip();
        if ("once".equals(argument)) {
            return new Directive.PragmaOnce(line);
        }
        if (argument.isEmpty()) {
            throw error(PreprocessorErrorCode.UNSUPPORTED_PRAGMA,
                    "Missing #pragma argument. Only '#pragma once' is supported.", line, keywordEnd);
        }
        throw error(PreprocessorErrorCode.UNSUPPORTED_PRAGMA,
                "Unsupported #pragma argument '" + argument + "'. Only '#pragma once' is supported.", line, argumentStart);
    }

    private String requireName(SourceLine line, String directive, int argumentStart) throws PreprocessingException {
        String content = line.content();
        int end = argumentStart;
        while (end < content.length() && isIdentifierPart(content.charAt(end))) {
            end++;
        }
        if (end == argumentStart) {
            throw error(PreprocessorErrorCode.DIRECTIVE_NEEDS_NAME,
                    directive + " directive requires a name.", line, argumentStart);
        }
        return content.substring(argumentStart, end);
    }

    private PreprocessingException error(PreprocessorErrorCode code, String message, SourceLine line, int column) {
        return new PreprocessingException(code, new Diagnostic(message, fileName, line.number(), column, line.content()));
    }

    private static boolean isValidName(String name, char open, char close) {
        return !name.isBlank() && name.indexOf(open) < 0 && name.indexOf(close) < 0;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
