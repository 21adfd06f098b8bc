package org.shaderflat.preprocessor.api;

import java.nio.file.Path;

/**
 * Defines the public interface of the shader preprocessor.
 * <p>
 * Implementations take the path of a top-level unit and return its flattened source.
 * On the first error a {@link PreprocessingException} is thrown and no partial output is returned.
 */
public interface IPreprocessor {

    /**
     * Preprocesses one top-level unit in a fresh parse session.
     *
     * @param unit The path of the unit. Must name a readable text file.
     * @return The flattened source of the unit.
     * @throws PreprocessingException if the unit or one of its includes cannot be processed.
     */
    FlattenedSource process(Path unit) throws PreprocessingException;
}
