package org.shaderflat.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void cliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("shaderflat");
        assertThat(cmd.getSubcommands()).containsKeys("preprocess", "kinds", "help");
    }

    @Test
    void withoutSubcommandPrintsUsage() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("Usage: shaderflat").contains("preprocess");
    }

    @Test
    void kindsListsTheExtensionTable() {
        assertThat(run("kinds")).isZero();
        assertThat(out.toString())
                .contains(".vert   VERTEX")
                .contains(".comp   COMPUTE");
    }

    @Test
    void configFileSettingsReachTheSubcommand() throws Exception {
        Path include = Files.createDirectories(tempDir.resolve("include"));
        Files.writeString(include.resolve("lib.glsl"), "float lib;\n");
        Path unit = Files.writeString(tempDir.resolve("main.frag"), "#version 330\n#include <lib.glsl>\n");
        Path conf = Files.writeString(tempDir.resolve("custom.conf"), """
                shaderflat.preprocessor {
                  include-directories = ["%s"]
                  trim-trailing-newline = true
                }
                """.formatted(include.toString().replace('\\', '/')));

        int exitCode = run("--config", conf.toString(), "preprocess", unit.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("#version 330\nfloat lib;");
    }

    @Test
    void missingConfigFileIsAUsageError() throws Exception {
        Path unit = Files.writeString(tempDir.resolve("main.frag"), "#version 330\n");

        int exitCode = run("--config", tempDir.resolve("absent.conf").toString(), "preprocess", unit.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("was not found");
    }
}
