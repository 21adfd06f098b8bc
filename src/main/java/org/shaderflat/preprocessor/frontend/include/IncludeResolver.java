package org.shaderflat.preprocessor.frontend.include;

import org.shaderflat.preprocessor.frontend.directive.IncludeTarget;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves {@code #include} targets to files.
 * <ul>
 *   <li>{@code <name>} is looked up in each search directory in registration order; the first
 *       directory holding a regular file of that name wins.</li>
 *   <li>{@code "name"} is resolved against the directory of the including file. If no such file
 *       exists there, the search directories are tried as for {@code <name>}.</li>
 * </ul>
 */
public final class IncludeResolver {

    private final List<Path> searchDirectories;

    /**
     * @param searchDirectories The search directories of the current session, in search order.
     */
    public IncludeResolver(List<Path> searchDirectories) {
        this.searchDirectories = List.copyOf(searchDirectories);
    }

    /**
     * Resolves an include target.
     *
     * @param target The target to resolve.
     * @param includingFile The file holding the {@code #include}.
     * @return The normalized path of the resolved file, or empty if none of the candidates exist.
     */
    public Optional<Path> resolve(IncludeTarget target, Path includingFile) {
        for (Path candidate : candidates(target, includingFile)) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the paths that are tried for a target, in order.
     *
     * @param target The target to resolve.
     * @param includingFile The file holding the {@code #include}.
     * @return The candidate paths.
     */
    public List<Path> candidates(IncludeTarget target, Path includingFile) {
        List<Path> candidates = new ArrayList<>();
        try {
            if (target.style() == IncludeTarget.Style.QUOTED) {
                Path parent = includingFile.getParent();
                Path base = parent != null ? parent : Path.of("");
                candidates.add(base.resolve(target.name()).normalize());
            }
            for (Path directory : searchDirectories) {
                candidates.add(directory.resolve(target.name()).normalize());
            }
        } catch (InvalidPathException e) {
            // an unrepresentable name has no candidates; the caller reports it as not found
            return List.of();
        }
        return candidates;
    }
}
