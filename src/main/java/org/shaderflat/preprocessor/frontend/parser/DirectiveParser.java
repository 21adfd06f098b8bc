package org.shaderflat.preprocessor.frontend.parser;

import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.api.PreprocessorErrorCode;
import org.shaderflat.preprocessor.api.SourceInfo;
import org.shaderflat.preprocessor.diagnostics.Diagnostic;
import org.shaderflat.preprocessor.frontend.directive.Directive;
import org.shaderflat.preprocessor.frontend.directive.DirectiveScanner;
import org.shaderflat.preprocessor.frontend.directive.IncludeTarget;
import org.shaderflat.preprocessor.frontend.include.IncludeResolver;
import org.shaderflat.preprocessor.frontend.io.LineReader;
import org.shaderflat.preprocessor.frontend.io.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The line-oriented state machine that flattens one top-level unit.
 * <p>
 * The parser reads its file through a {@link LineReader}, classifies every line once with a
 * {@link DirectiveScanner}, and dispatches on the directive kind. Inside a suppressed region
 * only {@code #ifndef} and {@code #endif} are recognized and no argument is validated.
 * {@code #include} recurses into the resolved file with the same {@link ParseSession}, so guard,
 * pragma-once and version state span the whole inclusion tree. Errors abort the whole request; each include frame an error
 * passes through adds an "included from" entry to it.
 * <p>
 * A parser is created per top-level unit and is not thread-safe.
 */
public final class DirectiveParser {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveParser.class);

    /** Default limit for nested includes. */
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 200;

    private final ParseSession session;
    private final IncludeResolver resolver;
    private final int maxIncludeDepth;
    private int includeDepth = 0;

    /**
     * Per-file state that must not leak into the includer.
     */
    private static final class FileFrame {
        final Path file;
        final String fileKey;
        final String displayName;
        final DirectiveScanner scanner;
        boolean ownsOnceEntry = false;
        boolean pragmaSuppressed = false;

        FileFrame(Path file, String displayName) {
            this.file = file;
            this.fileKey = file.toAbsolutePath().normalize().toString();
            this.displayName = displayName;
            this.scanner = new DirectiveScanner(displayName);
        }
    }

    /**
     * Creates a parser with the default include depth limit.
     * @param session The session of the top-level unit.
     */
    public DirectiveParser(ParseSession session) {
        this(session, DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * Creates a parser.
     * @param session The session of the top-level unit.
     * @param maxIncludeDepth The maximum nesting of {@code #include} directives.
     */
    public DirectiveParser(ParseSession session, int maxIncludeDepth) {
        this.session = session;
        this.resolver = new IncludeResolver(session.searchDirectories());
        this.maxIncludeDepth = maxIncludeDepth;
    }

    /**
     * Flattens a top-level unit.
     *
     * @param unit The path of the unit.
     * @return The raw flattened text, before post-processing.
     * @throws PreprocessingException on the first error in the unit or any of its includes.
     */
    public String parseUnit(Path unit) throws PreprocessingException {
        return parseFile(unit, displayName(unit));
    }

    /**
     * Checks that every guard opened during the session was closed.
     *
     * @throws PreprocessingException for the first guard still open, reported at its own
     *                                {@code #ifndef} line.
     */
    public void validateIncludeGuardScope() throws PreprocessingException {
        List<IncludeGuard> unterminated = session.guards().stream()
                .filter(IncludeGuard::isOpen)
                .collect(Collectors.toList());
        if (unterminated.isEmpty()) {
            return;
        }
        unterminated.forEach(guard -> LOG.debug("Unterminated guard: {}", guard));
        IncludeGuard first = unterminated.get(0);
        String message = "Unterminated #ifndef " + first.name() + ": no matching #endif found.";
        if (unterminated.size() > 1) {
            message += " (" + (unterminated.size() - 1) + " more unterminated #ifndef)";
        }
        String line = first.sourceLine();
        throw new PreprocessingException(PreprocessorErrorCode.UNTERMINATED_IFNDEF,
                new Diagnostic(message, first.fileName(), first.openingLine(), indexOfHash(line), line));
    }

    private String parseFile(Path file, String displayName) throws PreprocessingException {
        LineReader reader;
        try {
            reader = LineReader.open(file);
        } catch (IOException e) {
            throw new PreprocessingException(PreprocessorErrorCode.UNIT_UNREADABLE,
                    Diagnostic.withoutLine("Could not open shader file: \"" + displayName + "\"", displayName), e);
        }

        LOG.debug("Processing {} (include depth {})", displayName, includeDepth);
        FileFrame frame = new FileFrame(file, displayName);
        StringBuilder out = new StringBuilder();
        try (reader) {
            while (reader.hasNext()) {
                SourceLine line = reader.next();
                Directive directive = session.isSkipping()
                        ? frame.scanner.scanSuppressed(line)
                        : frame.scanner.scan(line);
                out.append(dispatch(directive, frame));
            }
        } catch (UncheckedIOException | IOException e) {
            Throwable cause = e instanceof UncheckedIOException u ? u.getCause() : e;
            throw new PreprocessingException(PreprocessorErrorCode.IO_ERROR_READING_FILE,
                    Diagnostic.withoutLine("Could not read shader file: \"" + displayName + "\" (" + cause.getMessage() + ")", displayName),
                    cause);
        }
        finishFile(frame);
        return out.toString();
    }

    private String dispatch(Directive directive, FileFrame frame) throws PreprocessingException {
        return switch (directive.kind()) {
            case PRAGMA_ONCE -> onPragmaOnce((Directive.PragmaOnce) directive, frame);
            case GUARD_OPEN -> onGuardOpen((Directive.GuardOpen) directive, frame);
            case DEFINE -> onDefine((Directive.Define) directive, frame);
            case GUARD_CLOSE -> onGuardClose((Directive.GuardClose) directive, frame);
            case VERSION -> onVersion((Directive.Version) directive, frame);
            case INCLUDE -> onInclude((Directive.Include) directive, frame);
            case PLAIN_LINE -> onPlainLine((Directive.PlainLine) directive);
        };
    }

    private String onPragmaOnce(Directive.PragmaOnce directive, FileFrame frame) {
        if (session.isSkipping() || frame.ownsOnceEntry) {
            return "";
        }
        int lineNumber = directive.line().number();
        if (session.markOnce(frame.fileKey)) {
            session.pushOnce(new SourceInfo(frame.displayName, lineNumber));
            frame.ownsOnceEntry = true;
            LOG.trace("Recorded #pragma once for {}", frame.displayName);
        } else {
            LOG.debug("Suppressing {}: already included (#pragma once on line {})", frame.displayName, lineNumber);
            session.beginSuppression(ParseSession.Suppression.PRAGMA_ONCE);
            frame.pragmaSuppressed = true;
        }
        return "";
    }

    private String onGuardOpen(Directive.GuardOpen directive, FileFrame frame) {
        if (session.isSkipping()) {
            session.enterNestedConditional();
            return "";
        }
        SourceLine line = directive.line();
        String name = directive.name();
        if (!session.isGuardNameSeen(name)) {
            IncludeGuard guard = session.openGuard(frame.displayName, name, line.content(), line.number());
            LOG.trace("Opened {}", guard);
            return "";
        }

        IncludeGuard latest = session.latestGuard(name).orElseThrow();
        if (latest.isDefined()) {
            LOG.debug("Suppressing guarded body in {} on line {}: {} already defined", frame.displayName, line.number(), name);
            session.beginSuppression(ParseSession.Suppression.GUARD);
        } else if (!latest.isOpen()) {
            // closed without a #define: the body is emitted again under a fresh record
            IncludeGuard guard = session.openGuard(frame.displayName, name, line.content(), line.number());
            LOG.trace("Reopened {}", guard);
        } else {
            LOG.trace("Guard {} is already open, ignoring #ifndef in {} on line {}", name, frame.displayName, line.number());
        }
        return "";
    }

    private String onDefine(Directive.Define directive, FileFrame frame) throws PreprocessingException {
        if (session.isSkipping()) {
            return "";
        }
        SourceLine line = directive.line();
        Optional<IncludeGuard> guard = session.findOpenGuard(directive.name());
        if (guard.isPresent()) {
            if (!guard.get().isDefined()) {
                guard.get().define(line.number());
                LOG.trace("Defined {}", guard.get());
            }
            return "";
        }
        if (!session.isVersionAccepted()) {
            throw error(PreprocessorErrorCode.DIRECTIVE_BEFORE_VERSION,
                    "#define " + directive.name() + " appears before the #version directive. #version must be the first statement.",
                    frame, line, indexOfHash(line.content()));
        }
        return line.text();
    }

    private String onGuardClose(Directive.GuardClose directive, FileFrame frame) throws PreprocessingException {
        SourceLine line = directive.line();
        if (session.isSkipping()) {
            if (session.leaveConditional()) {
                LOG.trace("Suppressed region ended in {} on line {}", frame.displayName, line.number());
            }
            return "";
        }
        Optional<IncludeGuard> guard = session.innermostOpenGuard();
        if (guard.isEmpty()) {
            throw error(PreprocessorErrorCode.ENDIF_WITHOUT_IFNDEF, "#endif without matching #ifndef",
                    frame, line, indexOfHash(line.content()));
        }
        guard.get().close(line.number());
        LOG.trace("Closed {}", guard.get());
        return "";
    }

    private String onVersion(Directive.Version directive, FileFrame frame) {
        if (session.isSkipping()) {
            return "";
        }
        if (session.acceptVersion()) {
            return directive.line().text();
        }
        LOG.debug("Dropping repeated #version in {} on line {}", frame.displayName, directive.line().number());
        return "";
    }

    private String onInclude(Directive.Include directive, FileFrame frame) throws PreprocessingException {
        if (session.isSkipping()) {
            return "";
        }
        SourceLine line = directive.line();
        IncludeTarget target = directive.target();

        if (includeDepth >= maxIncludeDepth) {
            throw error(PreprocessorErrorCode.INCLUDE_NESTING_TOO_DEEP,
                    "#include nested too deeply (limit " + maxIncludeDepth + "). Is there an include cycle without a guard?",
                    frame, line, target.column());
        }

        Optional<Path> resolved = resolver.resolve(target, frame.file);
        if (resolved.isEmpty()) {
            throw error(PreprocessorErrorCode.INCLUDE_NOT_FOUND, notFoundMessage(target, frame.file), frame, line, target.column());
        }

        Path includedFile = resolved.get();
        LOG.debug("Including {} as {} from {} on line {}", target, includedFile, frame.displayName, line.number());
        includeDepth++;
        try {
            return parseFile(includedFile, displayName(includedFile));
        } catch (PreprocessingException e) {
            throw e.includedFrom(new SourceInfo(frame.displayName, line.number()));
        } finally {
            includeDepth--;
        }
    }

    private String onPlainLine(Directive.PlainLine directive) {
        if (session.isSkipping() || !session.isVersionAccepted()) {
            return "";
        }
        return directive.line().text();
    }

    private void finishFile(FileFrame frame) {
        if (frame.pragmaSuppressed) {
            session.endSuppression();
        }
        if (frame.ownsOnceEntry) {
            SourceInfo site = session.popOnce();
            LOG.trace("Closed once scope {}", site);
        }
    }

    private String notFoundMessage(IncludeTarget target, Path includingFile) {
        List<Path> candidates = resolver.candidates(target, includingFile);
        if (candidates.isEmpty()) {
            return "Could not find include file " + target + ". No include directories are registered.";
        }
        String searched = candidates.stream()
                .map(DirectiveParser::displayName)
                .collect(Collectors.joining(", "));
        return "Could not find include file " + target + ". Searched: " + searched;
    }

    private PreprocessingException error(PreprocessorErrorCode code, String message, FileFrame frame, SourceLine line, int column) {
        return new PreprocessingException(code, new Diagnostic(message, frame.displayName, line.number(), column, line.content()));
    }

    private static int indexOfHash(String line) {
        int index = line.indexOf('#');
        return Math.max(index, 0);
    }

    static String displayName(Path path) {
        return path.toString().replace('\\', '/');
    }
}
