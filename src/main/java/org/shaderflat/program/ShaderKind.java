package org.shaderflat.program;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * The pipeline stage of a shader component, derived from its file extension.
 */
public enum ShaderKind {
    VERTEX("vert"),
    FRAGMENT("frag"),
    GEOMETRY("geom"),
    TESS_CONTROL("tesc"),
    TESS_EVALUATION("tese"),
    COMPUTE("comp");

    private final String extension;

    ShaderKind(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * @param extension The extension without the dot, matched case-sensitively.
     * @return The kind, or empty if the extension is not in the table.
     */
    public static Optional<ShaderKind> fromExtension(String extension) {
        return Arrays.stream(values()).filter(k -> k.extension.equals(extension)).findFirst();
    }

    /**
     * Returns the extension of a file path: everything after the last dot of the file name.
     *
     * @param path The path.
     * @return The extension, or empty if the file name has no dot.
     */
    public static Optional<String> extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(name.substring(dot + 1));
    }
}
