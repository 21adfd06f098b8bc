package org.shaderflat.preprocessor.frontend.parser;

import org.shaderflat.preprocessor.api.SourceInfo;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The state shared by every file of one top-level preprocessing request.
 * <p>
 * A session is created for each top-level unit and passed by reference through the whole
 * inclusion tree, so guard, pragma-once and version state are visible to all nested files.
 * It is owned by a single call and is not thread-safe.
 * <p>
 * Suppression is modelled by one {@code skipping} flag. While it is set, a depth counter tracks
 * {@code #ifndef}/{@code #endif} pairs nested inside the suppressed region, so only the
 * {@code #endif} that matches the satisfied guard ends the region.
 */
public final class ParseSession {

    /**
     * What started the current suppressed region.
     */
    enum Suppression {
        NONE,
        /** An {@code #ifndef} of an already defined guard; ends at the matching {@code #endif}. */
        GUARD,
        /** A {@code #pragma once} of an already included file; ends at that file's end. */
        PRAGMA_ONCE
    }

    private final List<Path> searchDirectories;
    private final Set<String> guardNames = new HashSet<>();
    private final List<IncludeGuard> guards = new ArrayList<>();
    private final Set<String> onceFiles = new HashSet<>();
    private final Deque<SourceInfo> onceStack = new ArrayDeque<>();
    private boolean versionAccepted = false;
    private boolean skipping = false;
    private Suppression suppression = Suppression.NONE;
    private int nestedConditionalDepth = 0;

    /**
     * @param searchDirectories The include search directories snapshot for this session.
     */
    public ParseSession(List<Path> searchDirectories) {
        this.searchDirectories = List.copyOf(searchDirectories);
    }

    public List<Path> searchDirectories() {
        return searchDirectories;
    }

    // --- Guards ---

    public boolean isGuardNameSeen(String name) {
        return guardNames.contains(name);
    }

    /**
     * @param name The guard name.
     * @return The most recently opened guard with that name.
     */
    public Optional<IncludeGuard> latestGuard(String name) {
        for (int i = guards.size() - 1; i >= 0; i--) {
            if (guards.get(i).name().equals(name)) {
                return Optional.of(guards.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @param name The guard name.
     * @return The open guard with that name, if any.
     */
    public Optional<IncludeGuard> findOpenGuard(String name) {
        return latestGuard(name).filter(IncludeGuard::isOpen);
    }

    /**
     * @return The most recently opened guard that has not been closed yet.
     */
    public Optional<IncludeGuard> innermostOpenGuard() {
        for (int i = guards.size() - 1; i >= 0; i--) {
            if (guards.get(i).isOpen()) {
                return Optional.of(guards.get(i));
            }
        }
        return Optional.empty();
    }

    IncludeGuard openGuard(String fileName, String name, String sourceLine, int line) {
        IncludeGuard guard = new IncludeGuard(fileName, name, sourceLine, line);
        guards.add(guard);
        guardNames.add(name);
        return guard;
    }

    /**
     * @return All guards of the session, in the order they were opened.
     */
    public List<IncludeGuard> guards() {
        return Collections.unmodifiableList(guards);
    }

    // --- Pragma once ---

    /**
     * Records a file as a pragma-once instance.
     *
     * @param fileKey The canonical key of the file.
     * @return {@code true} if the file was not recorded before.
     */
    boolean markOnce(String fileKey) {
        return onceFiles.add(fileKey);
    }

    void pushOnce(SourceInfo site) {
        onceStack.push(site);
    }

    SourceInfo popOnce() {
        return onceStack.pop();
    }

    /**
     * @return The active once-guarded inclusion chain, innermost first.
     */
    public List<SourceInfo> onceStack() {
        return List.copyOf(onceStack);
    }

    // --- Version ---

    public boolean isVersionAccepted() {
        return versionAccepted;
    }

    /**
     * Accepts a {@code #version} directive if none was accepted before.
     * @return {@code true} if this call accepted the version.
     */
    boolean acceptVersion() {
        if (versionAccepted) {
            return false;
        }
        versionAccepted = true;
        return true;
    }

    // --- Suppression ---

    public boolean isSkipping() {
        return skipping;
    }

    Suppression suppression() {
        return suppression;
    }

    void beginSuppression(Suppression reason) {
        skipping = true;
        suppression = reason;
        nestedConditionalDepth = 0;
    }

    void endSuppression() {
        skipping = false;
        suppression = Suppression.NONE;
        nestedConditionalDepth = 0;
    }

    void enterNestedConditional() {
        nestedConditionalDepth++;
    }

    /**
     * Handles an {@code #endif} met while skipping.
     * @return {@code true} if the {@code #endif} ended the suppressed region.
     */
    boolean leaveConditional() {
        if (nestedConditionalDepth > 0) {
            nestedConditionalDepth--;
            return false;
        }
        if (suppression == Suppression.GUARD) {
            endSuppression();
            return true;
        }
        return false;
    }
}
