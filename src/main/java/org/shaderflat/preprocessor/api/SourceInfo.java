package org.shaderflat.preprocessor.api;

/**
 * A pure data class representing a position in a shader source file.
 * It is part of the public preprocessor API and free of implementation details.
 *
 * @param fileName The file where the position is located.
 * @param lineNumber The 1-based line number.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ", line " + lineNumber;
    }
}
