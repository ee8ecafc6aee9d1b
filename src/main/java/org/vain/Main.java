package org.vain;

import org.vain.analysis.AnalyzerConfiguration;
import org.vain.astnode.ErrorNode;
import org.vain.astnode.Node;
import org.vain.astvisitor.PrintVisitor;
import org.vain.codegen.EmitterContext;
import org.vain.lexer.Lexer;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;
import org.vain.parser.Parser;
import org.vain.pipeline.BuildPipeline;
import org.vain.runtime.VainBuildException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point.
 * <p>
 * Exit status is 0 when every file compiled, 1 otherwise; all errors are
 * printed to standard error, one per line.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ArgumentParser.CompilerOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        if (options.helpRequested) {
            ArgumentParser.printHelp();
            return 0;
        }
        if (options.versionRequested) {
            System.out.println(Configuration.versionBanner());
            return 0;
        }
        if (options.debugEnabled) {
            System.out.println(options);
        }

        List<Path> sources;
        try {
            sources = BuildPipeline.collectSources(options.paths);
        } catch (IOException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        if (options.tokenizeOnly || options.parseOnly) {
            return inspect(sources, options);
        }

        AnalyzerConfiguration analyzerConfiguration;
        try {
            analyzerConfiguration = loadAnalyzerConfiguration(options);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: cannot load analyzer configuration: " + e.getMessage());
            return 1;
        }

        try {
            new BuildPipeline(options, analyzerConfiguration).run(sources);
            return 0;
        } catch (VainBuildException e) {
            for (String error : e.getErrors()) {
                System.err.println(error);
            }
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Error: interrupted");
            return 1;
        }
    }

    static AnalyzerConfiguration loadAnalyzerConfiguration(ArgumentParser.CompilerOptions options) throws IOException {
        if (options.configFile != null) {
            return AnalyzerConfiguration.load(Paths.get(options.configFile));
        }
        Path implicit = Paths.get(Configuration.defaultConfigFileName);
        if (Files.isRegularFile(implicit)) {
            return AnalyzerConfiguration.load(implicit);
        }
        return AnalyzerConfiguration.defaults();
    }

    /**
     * --tokenize and --parse: print the tokens or the tree of each file.
     */
    private static int inspect(List<Path> sources, ArgumentParser.CompilerOptions options) {
        int status = 0;
        for (Path source : sources) {
            String input;
            try {
                input = Files.readString(source, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println(source + ": cannot read file: " + e.getMessage());
                status = 1;
                continue;
            }
            EmitterContext ctx = new EmitterContext(source.toString(), options);
            List<LexerToken> tokens = new Lexer(ctx.fileName, input).tokenize();
            if (options.tokenizeOnly) {
                for (LexerToken token : tokens) {
                    System.out.println(token);
                    if (token.type == LexerTokenType.ERROR) {
                        System.err.println(token.text);
                        status = 1;
                    }
                }
                continue;
            }
            Node unit = new Parser(ctx, tokens).parse();
            if (unit instanceof ErrorNode error) {
                System.err.println(error.message);
                status = 1;
                continue;
            }
            PrintVisitor printVisitor = new PrintVisitor();
            unit.accept(printVisitor);
            System.out.print(printVisitor.getResult());
        }
        return status;
    }
}
