package org.shaderflat.program;

import java.util.List;

/**
 * The graphics back end that turns flattened sources into a program object.
 * <p>
 * No implementation ships with this library; applications bind it to their graphics API.
 */
public interface IShaderCompiler {

    /**
     * Compiles every source and links them into one program.
     *
     * @param programName The program name, for error messages.
     * @param sources The flattened components, in the order they were given.
     * @return The handle of the new program.
     * @throws ShaderCompilationException if a component fails to compile or the program fails to link.
     *         No program object is left behind in that case.
     */
    int compileProgram(String programName, List<ShaderSource> sources) throws ShaderCompilationException;

    /**
     * Releases a program returned by {@link #compileProgram(String, List)}.
     * @param handle The program handle.
     */
    void deleteProgram(int handle);
}
