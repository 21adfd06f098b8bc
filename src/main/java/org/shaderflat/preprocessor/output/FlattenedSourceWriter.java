package org.shaderflat.preprocessor.output;

import org.shaderflat.preprocessor.api.FlattenedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes flattened sources into an output directory, one file per unit, named by the unit's
 * base file name. Existing files are overwritten.
 */
public final class FlattenedSourceWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FlattenedSourceWriter.class);

    private final Path outputDirectory;

    public FlattenedSourceWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Writes one flattened source.
     *
     * @param source The source to write.
     * @return The path of the written file.
     * @throws IOException if the directory cannot be created, the output path exists and is
     *                     not a directory, or the file cannot be written.
     */
    public Path write(FlattenedSource source) throws IOException {
        if (Files.exists(outputDirectory) && !Files.isDirectory(outputDirectory)) {
            throw new IOException("Output path exists and is not a directory: " + outputDirectory);
        }
        Files.createDirectories(outputDirectory);
        Path target = outputDirectory.resolve(assetName(source.unit().toString()));
        Files.writeString(target, source.text(), StandardCharsets.UTF_8);
        LOG.info("Wrote flattened source {}", target);
        return target;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    /**
     * Returns the base file name of a path written with either separator.
     *
     * @param path The path, for example {@code shaders\\lit/basic.frag}.
     * @return The base name, for example {@code basic.frag}.
     */
    public static String assetName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(slash + 1);
    }
}
