package org.shaderflat.preprocessor;

import org.shaderflat.preprocessor.api.FlattenedSource;
import org.shaderflat.preprocessor.api.IPreprocessor;
import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.frontend.include.IncludeSearchPath;
import org.shaderflat.preprocessor.frontend.parser.DirectiveParser;
import org.shaderflat.preprocessor.frontend.parser.ParseSession;
import org.shaderflat.preprocessor.postprocess.OutputPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * The main entry point for flattening shader sources.
 * <p>
 * Each call to {@link #process(Path)} runs in its own {@link ParseSession}, built on a snapshot
 * of the include search path taken when the call starts. Calls for different units may
 * therefore run concurrently, and registering another include directory never affects a
 * request already in flight.
 */
public class Preprocessor implements IPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final IncludeSearchPath searchPath;
    private final OutputPostProcessor postProcessor;
    private final int maxIncludeDepth;

    /**
     * Creates a preprocessor with default settings and no include directories.
     */
    public Preprocessor() {
        this(PreprocessorSettings.defaults());
    }

    /**
     * Creates a preprocessor from settings. Every configured include directory is registered.
     *
     * @param settings The settings.
     * @throws IllegalArgumentException if a configured include directory does not exist.
     */
    public Preprocessor(PreprocessorSettings settings) {
        this(new IncludeSearchPath(),
                new OutputPostProcessor(settings.trimLeadingNewline(), settings.trimTrailingNewline()),
                settings.maxIncludeDepth());
        settings.includeDirectories().forEach(searchPath::addIncludeDirectory);
    }

    /**
     * Creates a preprocessor from its parts.
     *
     * @param searchPath The include search path. The caller may keep adding directories to it.
     * @param postProcessor The post-processor applied to each flattened unit.
     * @param maxIncludeDepth The maximum nesting of {@code #include} directives.
     */
    public Preprocessor(IncludeSearchPath searchPath, OutputPostProcessor postProcessor, int maxIncludeDepth) {
        this.searchPath = searchPath;
        this.postProcessor = postProcessor;
        this.maxIncludeDepth = maxIncludeDepth;
    }

    /**
     * Appends a directory to the include search path.
     *
     * @param directory The directory to add.
     * @return This preprocessor, for chaining.
     * @throws IllegalArgumentException if the directory does not exist.
     */
    public Preprocessor addIncludeDirectory(String directory) {
        searchPath.addIncludeDirectory(directory);
        return this;
    }

    @Override
    public FlattenedSource process(Path unit) throws PreprocessingException {
        ParseSession session = new ParseSession(searchPath.snapshot());
        DirectiveParser parser = new DirectiveParser(session, maxIncludeDepth);

        LOG.debug("Preprocessing unit {}", unit);
        String raw = parser.parseUnit(unit);
        parser.validateIncludeGuardScope();

        if (!session.isVersionAccepted()) {
            LOG.warn("Unit {} declares no #version directive; all of its lines were dropped", unit);
        }
        String text = postProcessor.process(raw);
        LOG.debug("Preprocessed unit {}: {} guards, {} characters", unit, session.guards().size(), text.length());
        return new FlattenedSource(unit, text);
    }
}
