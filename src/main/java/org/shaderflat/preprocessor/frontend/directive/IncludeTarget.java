package org.shaderflat.preprocessor.frontend.directive;

/**
 * The target of an {@code #include} directive.
 *
 * @param name The file name between the delimiters.
 * @param style How the name was delimited.
 * @param column The 0-based column of the opening delimiter.
 */
public record IncludeTarget(String name, Style style, int column) {

    /**
     * The delimiter pair used around an include target.
     */
    public enum Style {
        /** {@code <name>}: searched in the registered include directories. */
        ANGLE,
        /** {@code "name"}: resolved against the including file's directory. */
        QUOTED
    }

    @Override
    public String toString() {
        return style == Style.ANGLE ? "<" + name + ">" : "\"" + name + "\"";
    }
}
