package org.shaderflat.cli.commands;

import org.shaderflat.cli.CommandLineInterface;
import org.shaderflat.preprocessor.Preprocessor;
import org.shaderflat.preprocessor.PreprocessorSettings;
import org.shaderflat.preprocessor.api.FlattenedSource;
import org.shaderflat.preprocessor.api.PreprocessingException;
import org.shaderflat.preprocessor.output.FlattenedSourceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "preprocess", description = "Flattens shader units and prints them or writes them to a directory.")
public class PreprocessCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PreprocessCommand.class);

    static final int EXIT_PREPROCESSING_FAILED = 1;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-I", "--include"}, description = "Adds a directory to the include search path. Repeatable; searched in order.")
    private List<File> includeDirectories = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Writes each flattened unit into this directory instead of stdout.")
    private File outputDirectory;

    @Option(names = "--trim-trailing-newline", description = "Removes one trailing newline from each flattened unit.")
    private boolean trimTrailingNewline;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The shader units to flatten.")
    private List<File> units;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        PreprocessorSettings settings = PreprocessorSettings.fromConfig(parent.getConfig());
        if (!includeDirectories.isEmpty()) {
            List<String> directories = new ArrayList<>(settings.includeDirectories());
            includeDirectories.forEach(d -> directories.add(d.getPath()));
            settings = settings.withIncludeDirectories(directories);
        }
        if (outputDirectory != null) {
            settings = settings.withOutputDirectory(outputDirectory.toPath());
        }
        if (trimTrailingNewline) {
            settings = settings.withTrimTrailingNewline(true);
        }

        Preprocessor preprocessor;
        try {
            preprocessor = new Preprocessor(settings);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.flush();
            return EXIT_PREPROCESSING_FAILED;
        }
        FlattenedSourceWriter writer = settings.outputDirectory().map(FlattenedSourceWriter::new).orElse(null);

        for (File unit : units) {
            try {
                FlattenedSource source = preprocessor.process(unit.toPath());
                if (writer != null) {
                    writer.write(source);
                } else {
                    out.print(source.text());
                    out.flush();
                }
            } catch (PreprocessingException e) {
                LOG.debug("Preprocessing {} failed with {}", unit, e.getErrorCode());
                err.println(e.getMessage());
                err.flush();
                return EXIT_PREPROCESSING_FAILED;
            } catch (IOException e) {
                err.println("error: could not write flattened source of " + unit + ": " + e.getMessage());
                err.flush();
                return EXIT_PREPROCESSING_FAILED;
            }
        }
        return 0;
    }
}
