package org.shaderflat.preprocessor.api;

import org.shaderflat.preprocessor.diagnostics.Diagnostic;
import org.shaderflat.preprocessor.diagnostics.DiagnosticFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An exception that is thrown when preprocessing of a top-level unit fails.
 * <p>
 * It carries exactly one {@link Diagnostic} plus the chain of include sites the error
 * travelled through on its way out. Each include frame appends one entry, so the message
 * reads as an inclusion backtrace:
 * <pre>
 * In file 'common.glsl' on line 3: error: #endif without matching #ifndef
 * 3 | #endif
 *   | ^
 *   included from: shaders/basic.frag, line 2
 * </pre>
 */
public class PreprocessingException extends Exception {

    private final PreprocessorErrorCode errorCode;
    private final Diagnostic diagnostic;
    private final List<SourceInfo> includeTrail;

    /**
     * Constructs a new preprocessing exception.
     * @param errorCode The error code.
     * @param diagnostic The diagnostic describing the error.
     */
    public PreprocessingException(PreprocessorErrorCode errorCode, Diagnostic diagnostic) {
        this(errorCode, diagnostic, List.of(), null);
    }

    /**
     * Constructs a new preprocessing exception with a cause.
     * @param errorCode The error code.
     * @param diagnostic The diagnostic describing the error.
     * @param cause The cause.
     */
    public PreprocessingException(PreprocessorErrorCode errorCode, Diagnostic diagnostic, Throwable cause) {
        this(errorCode, diagnostic, List.of(), cause);
    }

    private PreprocessingException(PreprocessorErrorCode errorCode, Diagnostic diagnostic,
                                   List<SourceInfo> includeTrail, Throwable cause) {
        super(render(diagnostic, includeTrail), cause);
        this.errorCode = errorCode;
        this.diagnostic = diagnostic;
        this.includeTrail = Collections.unmodifiableList(includeTrail);
    }

    /**
     * Returns a copy of this exception with one more include site appended to the trail.
     *
     * @param includeSite The file and line of the {@code #include} the error propagated through.
     * @return The annotated exception.
     */
    public PreprocessingException includedFrom(SourceInfo includeSite) {
        List<SourceInfo> trail = new ArrayList<>(includeTrail);
        trail.add(includeSite);
        PreprocessingException annotated = new PreprocessingException(errorCode, diagnostic, trail, getCause());
        annotated.setStackTrace(getStackTrace());
        return annotated;
    }

    public PreprocessorErrorCode getErrorCode() {
        return errorCode;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    /**
     * @return The include sites from the innermost to the outermost frame.
     */
    public List<SourceInfo> getIncludeTrail() {
        return includeTrail;
    }

    private static String render(Diagnostic diagnostic, List<SourceInfo> trail) {
        StringBuilder sb = new StringBuilder(DiagnosticFormatter.format(diagnostic));
        for (SourceInfo site : trail) {
            sb.append("\n  included from: ").append(site);
        }
        return sb.toString();
    }
}
