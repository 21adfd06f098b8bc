package org.shaderflat.preprocessor.frontend.parser;

/**
 * One encountered {@code #ifndef NAME} scope.
 * <p>
 * A guard is open while its closing line is unset. Once its {@code #define NAME} has been seen
 * the guard counts as satisfied, and every later {@code #ifndef NAME} of the session suppresses
 * its body.
 */
public final class IncludeGuard {

    /** Marker for a line number that has not been found yet. */
    public static final int UNSET = -1;

    private final String fileName;
    private final String name;
    private final String sourceLine;
    private final int openingLine;
    private int closingLine = UNSET;
    private int definitionLine = UNSET;

    IncludeGuard(String fileName, String name, String sourceLine, int openingLine) {
        this.fileName = fileName;
        this.name = name;
        this.sourceLine = sourceLine;
        this.openingLine = openingLine;
    }

    public String fileName() {
        return fileName;
    }

    public String name() {
        return name;
    }

    /**
     * @return The raw text of the {@code #ifndef} line, for diagnostics.
     */
    public String sourceLine() {
        return sourceLine;
    }

    public int openingLine() {
        return openingLine;
    }

    public int closingLine() {
        return closingLine;
    }

    public int definitionLine() {
        return definitionLine;
    }

    public boolean isOpen() {
        return closingLine == UNSET;
    }

    public boolean isDefined() {
        return definitionLine != UNSET;
    }

    void close(int line) {
        this.closingLine = line;
    }

    void define(int line) {
        this.definitionLine = line;
    }

    @Override
    public String toString() {
        return String.format("#ifndef %s (%s:%d, define=%d, endif=%d)", name, fileName, openingLine, definitionLine, closingLine);
    }
}
