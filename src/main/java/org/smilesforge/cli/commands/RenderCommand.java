package org.smilesforge.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.smilesforge.ast.AstNode;
import org.smilesforge.cli.CommandLineInterface;
import org.smilesforge.codegen.CodegenOptions;
import org.smilesforge.codegen.SmilesCodegenException;
import org.smilesforge.codegen.SmilesGenerator;
import org.smilesforge.io.AstJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that renders AST JSON documents as SMILES.
 * <p>
 * Each input file yields one output line. Without {@code --file} a single document is read from
 * standard input.
 */
@Command(
    name = "render",
    mixinStandardHelpOptions = true,
    description = "Render AST JSON documents as SMILES line notation"
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RenderCommand.class);

    @Option(
        names = {"-f", "--file"},
        description = "AST JSON file to render (repeatable, default: read standard input)"
    )
    private File[] files;

    @Option(
        names = {"--strict"},
        description = "Fail on inconsistent metadata instead of falling back to defaults"
    )
    private boolean strict;

    @Option(
        names = {"--verify"},
        description = "Check parentheses and ring-closure pairing of every result"
    )
    private boolean verify;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final AstJsonReader reader = new AstJsonReader();

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        SmilesGenerator generator;
        try {
            generator = new SmilesGenerator(options());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (files == null || files.length == 0) {
            try (Reader in = new InputStreamReader(System.in, StandardCharsets.UTF_8)) {
                out.println(render(generator, in, "<stdin>"));
            } catch (IOException | SmilesCodegenException e) {
                return fail(err, "<stdin>", e);
            }
            out.flush();
            return 0;
        }

        for (File file : files) {
            try (Reader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
                out.println(render(generator, in, file.getName()));
            } catch (IOException | SmilesCodegenException e) {
                return fail(err, file.getPath(), e);
            }
        }
        out.flush();
        return 0;
    }

    private CodegenOptions options() {
        CodegenOptions options = CodegenOptions.fromConfig(parent.getConfig());
        if (strict) {
            options = options.withStrictMetadata(true);
        }
        if (verify) {
            options = options.withVerifyOutput(true);
        }
        return options;
    }

    private String render(SmilesGenerator generator, Reader in, String source) {
        AstNode root = reader.read(in);
        String smiles = generator.render(root);
        LOG.debug("Rendered {}: {}", source, smiles);
        return smiles;
    }

    private int fail(PrintWriter err, String source, Exception e) {
        LOG.error("Failed to render {}: {}", source, e.getMessage());
        err.println("Error rendering " + source + ": " + e.getMessage());
        err.flush();
        return 1;
    }
}
