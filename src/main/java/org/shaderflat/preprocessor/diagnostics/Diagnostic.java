package org.shaderflat.preprocessor.diagnostics;

/**
 * Represents a single error found while preprocessing a shader source.
 *
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue, or {@code 0} if the issue has no line
 *                   (for example, a unit that could not be opened).
 * @param column The 0-based column the caret points at.
 * @param sourceLine The offending source line, or {@code null} if there is none.
 */
public record Diagnostic(
        String message,
        String fileName,
        int lineNumber,
        int column,
        String sourceLine
) {
    /**
     * Creates a diagnostic without line context.
     *
     * @param message The diagnostic message.
     * @param fileName The file the message is about.
     * @return A diagnostic that renders as a single header line.
     */
    public static Diagnostic withoutLine(String message, String fileName) {
        return new Diagnostic(message, fileName, 0, 0, null);
    }

    /**
     * @return {@code true} if this diagnostic points at a concrete source line.
     */
    public boolean hasSourceLine() {
        return lineNumber > 0 && sourceLine != null;
    }

    @Override
    public String toString() {
        return DiagnosticFormatter.format(this);
    }
}
