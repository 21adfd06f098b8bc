package org.shaderflat.preprocessor.api;

import java.nio.file.Path;

/**
 * The result of preprocessing one top-level unit: every include inlined, every
 * directive except the leading {@code #version} and plain macro definitions removed,
 * and all comments stripped.
 *
 * @param unit The path of the top-level unit as given by the caller.
 * @param text The flattened source text.
 */
public record FlattenedSource(Path unit, String text) {
}
