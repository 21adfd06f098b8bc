package org.shaderflat.preprocessor.frontend.directive;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.api.PreprocessorErrorCode;
import org.shaderflat.preprocessor.frontend.io.SourceLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Tag("unit")
class DirectiveScannerTest {

    private final DirectiveScanner scanner = new DirectiveScanner("test.glsl");

    private Directive scan(String content) throws PreprocessingException {
        return scanner.scan(new SourceLine(3, content + "\n"));
    }

    private PreprocessingException scanError(String content) {
        return catchThrowableOfType(() -> scan(content), PreprocessingException.class);
    }

    @Test
    void classifiesEveryRecognizedDirective() throws Exception {
        assertThat(scan("#version 330 core").kind()).isEqualTo(DirectiveKind.VERSION);
        assertThat(scan("#include <a.glsl>").kind()).isEqualTo(DirectiveKind.INCLUDE);
        assertThat(scan("#pragma once").kind()).isEqualTo(DirectiveKind.PRAGMA_ONCE);
        assertThat(scan("#ifndef A").kind()).isEqualTo(DirectiveKind.GUARD_OPEN);
        assertThat(scan("#define A").kind()).isEqualTo(DirectiveKind.DEFINE);
        assertThat(scan("#endif").kind()).isEqualTo(DirectiveKind.GUARD_CLOSE);
        assertThat(scan("float x;").kind()).isEqualTo(DirectiveKind.PLAIN_LINE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"#extension GL_ARB_foo : enable", "#ifdef A", "#else", "#versionx 1", "   ", ""})
    void otherLinesArePlain(String content) throws Exception {
        assertThat(scan(content)).isInstanceOf(Directive.PlainLine.class);
    }

    @Test
    void allowsWhitespaceAroundTheHash() throws Exception {
        Directive directive = scan("  #  ifndef   LIGHTING_GLSL  ");

        assertThat(directive).isEqualTo(new Directive.GuardOpen(new SourceLine(3, "  #  ifndef   LIGHTING_GLSL  \n"), "LIGHTING_GLSL"));
    }

    @Test
    void defineKeepsOnlyTheName() throws Exception {
        assertThat(((Directive.Define) scan("#define PI 3.14159")).name()).isEqualTo("PI");
    }

    @Test
    void parsesAngleAndQuotedTargets() throws Exception {
        IncludeTarget angle = ((Directive.Include) scan("#include <lib/noise.glsl>")).target();
        IncludeTarget quoted = ((Directive.Include) scan("#include   \"local.glsl\"  ")).target();

        assertThat(angle).isEqualTo(new IncludeTarget("lib/noise.glsl", IncludeTarget.Style.ANGLE, 9));
        assertThat(quoted.name()).isEqualTo("local.glsl");
        assertThat(quoted.style()).isEqualTo(IncludeTarget.Style.QUOTED);
        assertThat(quoted.toString()).isEqualTo("\"local.glsl\"");
    }

    @Test
    void emptyIncludeIsMalformed() {
        PreprocessingException e = scanError("#include");

        assertThat(e.getErrorCode()).isEqualTo(PreprocessorErrorCode.EMPTY_INCLUDE);
        assertThat(e.getErrorCode().category()).isEqualTo(PreprocessorErrorCode.Category.DIRECTIVE_MALFORMED);
        assertThat(e.getDiagnostic().lineNumber()).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"#include <a.glsl\"", "#include a.glsl", "#include <>", "#include \"\"", "#include <a<b.glsl>", "#include \""})
    void mismatchedIncludeDelimitersAreMalformed(String content) {
        assertThat(scanError(content).getErrorCode()).isEqualTo(PreprocessorErrorCode.INVALID_INCLUDE_SYNTAX);
    }

    @Test
    void unsupportedPragmaIsMalformed() {
        PreprocessingException e = scanError("#pragma optimize(off)");

        assertThat(e.getErrorCode()).isEqualTo(PreprocessorErrorCode.UNSUPPORTED_PRAGMA);
        assertThat(e.getMessage()).contains("Unsupported #pragma argument 'optimize(off)'");
        assertThat(e.getDiagnostic().column()).isEqualTo("#pragma ".length());
    }

    @Test
    void pragmaWithoutArgumentIsMalformed() {
        assertThat(scanError("#pragma").getMessage()).contains("Missing #pragma argument");
    }

    @Test
    void guardDirectivesRequireAName() {
        assertThat(scanError("#ifndef").getMessage()).contains("#ifndef directive requires a name.");
        assertThat(scanError("#define   ").getErrorCode()).isEqualTo(PreprocessorErrorCode.DIRECTIVE_NEEDS_NAME);
    }

    @ParameterizedTest
    @ValueSource(strings = {"#include noise_tables.glsl", "#include", "#pragma optimize(off)", "#define", "#version 330"})
    void suppressedLinesAreNeverValidated(String content) {
        Directive directive = scanner.scanSuppressed(new SourceLine(3, content + "\n"));

        assertThat(directive).isInstanceOf(Directive.PlainLine.class);
    }

    @Test
    void suppressedScanStillCountsConditionals() {
        assertThat(scanner.scanSuppressed(new SourceLine(1, "#ifndef\n")).kind()).isEqualTo(DirectiveKind.GUARD_OPEN);
        assertThat(scanner.scanSuppressed(new SourceLine(2, "  #  ifndef NOISE\n")).kind()).isEqualTo(DirectiveKind.GUARD_OPEN);
        assertThat(scanner.scanSuppressed(new SourceLine(3, "#endif // NOISE\n")).kind()).isEqualTo(DirectiveKind.GUARD_CLOSE);
        assertThat(scanner.scanSuppressed(new SourceLine(4, "float hq;\n")).kind()).isEqualTo(DirectiveKind.PLAIN_LINE);
    }
}
