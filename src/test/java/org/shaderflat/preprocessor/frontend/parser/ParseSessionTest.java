package org.shaderflat.preprocessor.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.shaderflat.preprocessor.api.SourceInfo;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParseSessionTest {

    private final ParseSession session = new ParseSession(List.of());

    @Test
    void guardSuppressionEndsOnlyAtTheMatchingEndif() {
        session.beginSuppression(ParseSession.Suppression.GUARD);
        session.enterNestedConditional();

        assertThat(session.leaveConditional()).isFalse();
        assertThat(session.isSkipping()).isTrue();
        assertThat(session.leaveConditional()).isTrue();
        assertThat(session.isSkipping()).isFalse();
    }

    @Test
    void endifDoesNotEndPragmaOnceSuppression() {
        session.beginSuppression(ParseSession.Suppression.PRAGMA_ONCE);

        assertThat(session.leaveConditional()).isFalse();
        assertThat(session.isSkipping()).isTrue();
        assertThat(session.suppression()).isEqualTo(ParseSession.Suppression.PRAGMA_ONCE);

        session.endSuppression();
        assertThat(session.isSkipping()).isFalse();
    }

    @Test
    void onlyTheFirstVersionIsAccepted() {
        assertThat(session.isVersionAccepted()).isFalse();
        assertThat(session.acceptVersion()).isTrue();
        assertThat(session.acceptVersion()).isFalse();
    }

    @Test
    void tracksGuardLifecycle() {
        IncludeGuard guard = session.openGuard("a.glsl", "A", "#ifndef A", 1);

        assertThat(session.findOpenGuard("A")).containsSame(guard);
        assertThat(guard.definitionLine()).isEqualTo(IncludeGuard.UNSET);
        assertThat(guard.closingLine()).isEqualTo(IncludeGuard.UNSET);
        guard.define(2);
        guard.close(5);

        assertThat(guard.definitionLine()).isEqualTo(2);
        assertThat(guard.closingLine()).isEqualTo(5);
        assertThat(guard.openingLine()).isEqualTo(1);

        assertThat(session.isGuardNameSeen("A")).isTrue();
        assertThat(session.findOpenGuard("A")).isEmpty();
        assertThat(session.innermostOpenGuard()).isEmpty();
        assertThat(session.latestGuard("A").orElseThrow().isDefined()).isTrue();
    }

    @Test
    void innermostOpenGuardIsTheLatestStillOpen() {
        IncludeGuard outer = session.openGuard("a.glsl", "OUTER", "#ifndef OUTER", 1);
        IncludeGuard inner = session.openGuard("a.glsl", "INNER", "#ifndef INNER", 3);

        assertThat(session.innermostOpenGuard()).containsSame(inner);
        inner.close(6);
        assertThat(session.innermostOpenGuard()).containsSame(outer);
    }

    @Test
    void onceFilesAreRecordedOnce() {
        assertThat(session.markOnce("/abs/once.glsl")).isTrue();
        assertThat(session.markOnce("/abs/once.glsl")).isFalse();

        session.pushOnce(new SourceInfo("once.glsl", 1));
        assertThat(session.onceStack()).containsExactly(new SourceInfo("once.glsl", 1));
        assertThat(session.popOnce()).isEqualTo(new SourceInfo("once.glsl", 1));
        assertThat(session.onceStack()).isEmpty();
    }
}
