package org.shaderflat.preprocessor.postprocess;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OutputPostProcessorTest {

    @Test
    void collapsesNewlineRuns() {
        OutputPostProcessor processor = new OutputPostProcessor(false, false);

        assertThat(processor.process("a\n\n\nb\n\nc\n")).isEqualTo("a\nb\nc\n");
    }

    @Test
    void leavesOtherWhitespaceAlone() {
        OutputPostProcessor processor = new OutputPostProcessor(false, false);

        assertThat(processor.process("a  \n \n\tb")).isEqualTo("a  \n \n\tb");
    }

    @Test
    void trimsOneLeadingAndOneTrailingNewlineWhenAsked() {
        OutputPostProcessor processor = new OutputPostProcessor(true, true);

        assertThat(processor.process("\n\n\na\n\n")).isEqualTo("a");
    }

    @Test
    void keepsTrailingNewlineByDefaultSettings() {
        OutputPostProcessor processor = new OutputPostProcessor(true, false);

        assertThat(processor.process("\na\n")).isEqualTo("a\n");
        assertThat(processor.process("")).isEmpty();
    }

    @Test
    void isIdempotent() {
        OutputPostProcessor processor = new OutputPostProcessor(true, false);
        String once = processor.process("\n\n#version 330\n\n\nfloat a;\n\n");

        assertThat(processor.process(once)).isEqualTo(once);
    }
}
