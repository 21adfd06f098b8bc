package org.shaderflat.program;

import org.shaderflat.preprocessor.api.FlattenedSource;
import org.shaderflat.preprocessor.api.IPreprocessor;
import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.output.FlattenedSourceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * A named shader program assembled from component files such as {@code basic.vert} and
 * {@code basic.frag}.
 * <p>
 * Each component is flattened by the preprocessor in its own session, tagged with the
 * {@link ShaderKind} of its extension, optionally written to an output directory, and handed to
 * the {@link IShaderCompiler}. {@link #recompile()} repeats the whole pipeline from disk; the
 * previous program stays active if it fails.
 */
public class ShaderProgram implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ShaderProgram.class);

    /** Handle value while no program is built. */
    public static final int NO_PROGRAM = -1;

    private final String name;
    private final List<Path> componentPaths;
    private final IPreprocessor preprocessor;
    private final IShaderCompiler compiler;
    private final FlattenedSourceWriter writer;
    private int handle = NO_PROGRAM;

    public ShaderProgram(String name, List<Path> componentPaths, IPreprocessor preprocessor, IShaderCompiler compiler) {
        this(name, componentPaths, preprocessor, compiler, null);
    }

    /**
     * @param name The program name.
     * @param componentPaths The component files. Repeated paths are processed once.
     * @param preprocessor The preprocessor flattening each component.
     * @param compiler The compiler back end.
     * @param writer Writes each flattened component, or {@code null} to skip writing.
     */
    public ShaderProgram(String name, List<Path> componentPaths, IPreprocessor preprocessor,
                         IShaderCompiler compiler, FlattenedSourceWriter writer) {
        this.name = name;
        this.componentPaths = List.copyOf(new LinkedHashSet<>(componentPaths));
        this.preprocessor = preprocessor;
        this.compiler = compiler;
        this.writer = writer;
    }

    /**
     * Classifies and flattens every component.
     *
     * @return The flattened components, in the order they were given.
     * @throws IllegalArgumentException if a component has no extension or an unknown one.
     * @throws PreprocessingException if a component cannot be flattened.
     * @throws IOException if writing a flattened component fails.
     */
    public List<ShaderSource> gatherSources() throws PreprocessingException, IOException {
        List<ShaderSource> sources = new ArrayList<>(componentPaths.size());
        for (Path path : componentPaths) {
            String extension = ShaderKind.extensionOf(path).orElseThrow(() ->
                    new IllegalArgumentException("Could not find shader extension on file: \"" + path + "\""));
            ShaderKind kind = ShaderKind.fromExtension(extension).orElseThrow(() ->
                    new IllegalArgumentException("Unknown or unsupported shader of type: \"" + extension + "\""));

            FlattenedSource flattened = preprocessor.process(path);
            if (writer != null) {
                writer.write(flattened);
            }
            sources.add(new ShaderSource(path, kind, flattened.text()));
        }
        return sources;
    }

    /**
     * Builds the program, replacing a previously built one on success.
     *
     * @return The new program handle.
     * @throws PreprocessingException if a component cannot be flattened.
     * @throws ShaderCompilationException if the compiler rejects the sources.
     * @throws IOException if writing a flattened component fails.
     */
    public int build() throws PreprocessingException, ShaderCompilationException, IOException {
        List<ShaderSource> sources = gatherSources();
        int built = compiler.compileProgram(name, sources);
        if (handle != NO_PROGRAM) {
            LOG.debug("Releasing previous program {} of shader {}", handle, name);
            compiler.deleteProgram(handle);
        }
        handle = built;
        LOG.debug("Built shader {} from {} components as program {}", name, sources.size(), built);
        return built;
    }

    /**
     * Re-reads and rebuilds every component.
     * @see #build()
     */
    public int recompile() throws PreprocessingException, ShaderCompilationException, IOException {
        LOG.debug("Recompiling shader {}", name);
        return build();
    }

    public String getName() {
        return name;
    }

    /**
     * @return The current program handle, or empty if the program was never built or is closed.
     */
    public Optional<Integer> getHandle() {
        return handle == NO_PROGRAM ? Optional.empty() : Optional.of(handle);
    }

    @Override
    public void close() {
        if (handle != NO_PROGRAM) {
            compiler.deleteProgram(handle);
            handle = NO_PROGRAM;
        }
    }
}
