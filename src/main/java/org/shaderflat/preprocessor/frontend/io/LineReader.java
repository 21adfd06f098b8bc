package org.shaderflat.preprocessor.frontend.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads a shader source one logical line at a time.
 * <p>
 * Each line has its {@code //} comment and any {@code /* ... *}{@code /} comments removed,
 * trailing control characters (such as the {@code \r} of CRLF files) dropped, and a single
 * {@code \n} appended. Comment removal never crosses a line: an unterminated block comment
 * only removes the rest of the line it starts on.
 * <p>
 * The sequence is lazy and can be iterated only once. I/O failures while reading surface as
 * {@link UncheckedIOException} from {@link #hasNext()}.
 */
public final class LineReader implements Iterator<SourceLine>, Closeable {

    private final BufferedReader reader;
    private int lineNumber = 0;
    private String pending;
    private boolean exhausted = false;

    /**
     * Creates a line reader over an already opened character stream.
     * @param reader The stream to read from. It is closed by {@link #close()}.
     */
    public LineReader(Reader reader) {
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    }

    /**
     * Opens a UTF-8 encoded file for line reading.
     *
     * @param path The file to open.
     * @return A new line reader positioned before the first line.
     * @throws IOException if the file cannot be opened.
     */
    public static LineReader open(Path path) throws IOException {
        return new LineReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            try {
                pending = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (pending == null) {
                exhausted = true;
            }
        }
        return pending != null;
    }

    @Override
    public SourceLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines");
        }
        String raw = pending;
        pending = null;
        lineNumber++;
        return new SourceLine(lineNumber, stripTrailingControlCharacters(stripComments(raw)) + "\n");
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    /**
     * Removes line and block comments from a single line.
     *
     * @param line The raw line, without a line terminator.
     * @return The line with all comments removed.
     */
    public static String stripComments(String line) {
        StringBuilder sb = null;
        int copyFrom = 0;
        int i = 0;
        while (i < line.length() - 1) {
            char c = line.charAt(i);
            if (c == '/' && line.charAt(i + 1) == '/') {
                if (sb == null) sb = new StringBuilder(line.length());
                sb.append(line, copyFrom, i);
                copyFrom = line.length();
                break;
            }
            if (c == '/' && line.charAt(i + 1) == '*') {
                if (sb == null) sb = new StringBuilder(line.length());
                sb.append(line, copyFrom, i);
                int end = line.indexOf("*/", i + 2);
                if (end < 0) {
                    copyFrom = line.length();
                    break;
                }
                i = end + 2;
                copyFrom = i;
                continue;
            }
            i++;
        }
        if (sb == null) {
            return line;
        }
        sb.append(line, Math.min(copyFrom, line.length()), line.length());
        return sb.toString();
    }

    static String stripTrailingControlCharacters(String line) {
        int end = line.length();
        while (end > 0 && Character.isISOControl(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }
}
