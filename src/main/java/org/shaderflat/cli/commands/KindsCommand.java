package org.shaderflat.cli.commands;

import org.shaderflat.program.ShaderKind;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "kinds", description = "Lists the file extensions recognized as shader components.")
public class KindsCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (ShaderKind kind : ShaderKind.values()) {
            out.printf(".%-6s %s%n", kind.extension(), kind);
        }
        out.flush();
        return 0;
    }
}
