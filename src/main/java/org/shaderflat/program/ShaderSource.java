package org.shaderflat.program;

import java.nio.file.Path;

/**
 * One flattened component of a shader program, ready for the compiler.
 *
 * @param path The component file.
 * @param kind The stage derived from the file extension.
 * @param text The flattened source text.
 */
public record ShaderSource(Path path, ShaderKind kind, String text) {
}
