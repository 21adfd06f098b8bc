package org.shaderflat.preprocessor;

import com.typesafe.config.Config;
import org.shaderflat.preprocessor.frontend.parser.DirectiveParser;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable settings of a {@link Preprocessor}, usually read from the
 * {@code shaderflat.preprocessor} block of the application configuration.
 *
 * @param includeDirectories The include search directories, in search order.
 * @param outputDirectory The directory flattened sources are written to, if any.
 * @param trimLeadingNewline Whether one leading newline is trimmed from the output.
 * @param trimTrailingNewline Whether one trailing newline is trimmed from the output.
 * @param maxIncludeDepth The maximum nesting of {@code #include} directives.
 */
public record PreprocessorSettings(
        List<String> includeDirectories,
        Optional<Path> outputDirectory,
        boolean trimLeadingNewline,
        boolean trimTrailingNewline,
        int maxIncludeDepth
) {
    public static final String CONFIG_PATH = "shaderflat.preprocessor";

    public PreprocessorSettings {
        includeDirectories = List.copyOf(includeDirectories);
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("max-include-depth must be at least 1, was " + maxIncludeDepth);
        }
    }

    /**
     * @return The settings used when no configuration is given.
     */
    public static PreprocessorSettings defaults() {
        return new PreprocessorSettings(List.of(), Optional.empty(), true, false, DirectiveParser.DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * Reads the settings from a configuration.
     *
     * @param config The application configuration. Missing keys fall back to {@link #defaults()}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a present key has the wrong type.
     */
    public static PreprocessorSettings fromConfig(Config config) {
        PreprocessorSettings defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config c = config.getConfig(CONFIG_PATH);
        List<String> includes = c.hasPath("include-directories") ? c.getStringList("include-directories") : defaults.includeDirectories();
        String output = c.hasPath("output-directory") ? c.getString("output-directory") : "";
        return new PreprocessorSettings(
                includes,
                output.isBlank() ? Optional.empty() : Optional.of(Path.of(output)),
                c.hasPath("trim-leading-newline") ? c.getBoolean("trim-leading-newline") : defaults.trimLeadingNewline(),
                c.hasPath("trim-trailing-newline") ? c.getBoolean("trim-trailing-newline") : defaults.trimTrailingNewline(),
                c.hasPath("max-include-depth") ? c.getInt("max-include-depth") : defaults.maxIncludeDepth());
    }

    public PreprocessorSettings withIncludeDirectories(List<String> directories) {
        return new PreprocessorSettings(directories, outputDirectory, trimLeadingNewline, trimTrailingNewline, maxIncludeDepth);
    }

    public PreprocessorSettings withOutputDirectory(Path directory) {
        return new PreprocessorSettings(includeDirectories, Optional.ofNullable(directory), trimLeadingNewline, trimTrailingNewline, maxIncludeDepth);
    }

    public PreprocessorSettings withTrimTrailingNewline(boolean trim) {
        return new PreprocessorSettings(includeDirectories, outputDirectory, trimLeadingNewline, trim, maxIncludeDepth);
    }
}
