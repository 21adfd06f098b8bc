package org.shaderflat.preprocessor.diagnostics;

/**
 * Renders a {@link Diagnostic} as a file/line anchored, caret-pointed message:
 * <pre>
 * In file 'lighting.glsl' on line 7: error: #endif without matching #ifndef
 * 7 | #endif
 *   | ^
 * </pre>
 * All inputs are stripped of their trailing newline first so that the caret always
 * lines up with a single physical line. Diagnostics without a line render as the header only.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {}

    /**
     * Formats the given diagnostic.
     *
     * @param diagnostic The diagnostic to render.
     * @return The rendered message, without a trailing newline.
     */
    public static String format(Diagnostic diagnostic) {
        if (!diagnostic.hasSourceLine()) {
            return String.format("In file '%s': error: %s",
                    stripNewline(diagnostic.fileName()), stripNewline(diagnostic.message()));
        }
        return format(diagnostic.fileName(), diagnostic.sourceLine(), diagnostic.lineNumber(),
                diagnostic.message(), diagnostic.column());
    }

    /**
     * Formats a three-line error message.
     *
     * @param fileName The file name shown in the header.
     * @param sourceLine The offending source line.
     * @param lineNumber The 1-based line number.
     * @param message The error message.
     * @param column The 0-based column offset of the caret.
     * @return The rendered message, without a trailing newline.
     */
    public static String format(String fileName, String sourceLine, int lineNumber, String message, int column) {
        String line = stripNewline(sourceLine);
        String number = Integer.toString(lineNumber);

        StringBuilder sb = new StringBuilder();
        sb.append("In file '").append(stripNewline(fileName)).append("' on line ").append(number)
                .append(": error: ").append(stripNewline(message)).append('\n');
        sb.append(number).append(" | ").append(line).append('\n');
        sb.append(" ".repeat(number.length())).append(" | ");
        int caret = Math.max(0, Math.min(column, line.length()));
        for (int i = 0; i < caret; i++) {
            // keep tabs so the caret lands under the same character in a terminal
            sb.append(line.charAt(i) == '\t' ? '\t' : ' ');
        }
        sb.append('^');
        return sb.toString();
    }

    static String stripNewline(String text) {
        if (text == null) {
            return "";
        }
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
