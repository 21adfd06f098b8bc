package org.shaderflat.preprocessor.postprocess;

/**
 * Normalizes the raw flattened text of a unit.
 * <p>
 * Every run of two or more {@code \n} is collapsed into a single {@code \n}. After that, one
 * leading and one trailing newline can be trimmed. No other whitespace is touched, so
 * applying the processor to its own output changes nothing.
 */
public final class OutputPostProcessor {

    private final boolean trimLeadingNewline;
    private final boolean trimTrailingNewline;

    /**
     * @param trimLeadingNewline Whether to drop one {@code \n} at the start of the text.
     * @param trimTrailingNewline Whether to drop one {@code \n} at the end of the text.
     */
    public OutputPostProcessor(boolean trimLeadingNewline, boolean trimTrailingNewline) {
        this.trimLeadingNewline = trimLeadingNewline;
        this.trimTrailingNewline = trimTrailingNewline;
    }

    public String process(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        char previous = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\n' && previous == '\n') {
                continue;
            }
            sb.append(c);
            previous = c;
        }
        if (trimLeadingNewline && sb.length() > 0 && sb.charAt(0) == '\n') {
            sb.deleteCharAt(0);
        }
        if (trimTrailingNewline && sb.length() > 0 && sb.charAt(sb.length() - 1) == '\n') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }
}
