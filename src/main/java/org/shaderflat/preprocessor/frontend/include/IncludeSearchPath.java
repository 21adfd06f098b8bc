package org.shaderflat.preprocessor.frontend.include;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The ordered list of directories searched for {@code #include <name>} targets.
 * <p>
 * Directories are appended at setup time; registration order is search order. Parse sessions
 * never read this object directly but work on the immutable {@link #snapshot()} taken when the
 * session starts, so an in-flight request is unaffected by later registrations.
 */
public final class IncludeSearchPath {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeSearchPath.class);

    private final List<String> directories = new CopyOnWriteArrayList<>();

    /**
     * Appends a directory to the search list.
     *
     * @param directory The directory. Backslashes are normalized to forward slashes and a trailing
     *                  slash is added if missing.
     * @return This search path, for chaining.
     * @throws IllegalArgumentException if the path does not name an existing directory.
     */
    public IncludeSearchPath addIncludeDirectory(String directory) {
        String normalized = normalize(directory);
        if (!Files.isDirectory(Path.of(normalized))) {
            throw new IllegalArgumentException("Include directory does not exist or is not a directory: " + directory);
        }
        directories.add(normalized);
        LOG.debug("Registered include directory #{}: {}", directories.size(), normalized);
        return this;
    }

    /**
     * @return The registered directories, slash-normalized, in search order.
     */
    public List<String> directories() {
        return List.copyOf(directories);
    }

    /**
     * Takes an immutable snapshot of the current search order.
     * @return The registered directories as paths.
     */
    public List<Path> snapshot() {
        return directories.stream().map(Path::of).toList();
    }

    static String normalize(String directory) {
        String normalized = directory.replace('\\', '/');
        if (!normalized.endsWith("/")) {
            normalized += '/';
        }
        return normalized;
    }
}
