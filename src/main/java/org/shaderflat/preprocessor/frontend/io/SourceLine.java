package org.shaderflat.preprocessor.frontend.io;

/**
 * A logical line produced by the {@link LineReader}.
 *
 * @param number The 1-based line number within its file.
 * @param text The comment-stripped line text, always terminated by a single {@code \n}.
 */
public record SourceLine(int number, String text) {

    /**
     * @return The line text without its terminating newline.
     */
    public String content() {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
