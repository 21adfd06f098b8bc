package org.shaderflat.program;

/**
 * Thrown by an {@link IShaderCompiler} when a program fails to compile or link.
 */
public class ShaderCompilationException extends Exception {

    public ShaderCompilationException(String programName, String message) {
        super("Shader: " + programName + " failed to build. " + message);
    }

    public ShaderCompilationException(String programName, String message, Throwable cause) {
        super("Shader: " + programName + " failed to build. " + message, cause);
    }
}
