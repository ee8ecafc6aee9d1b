package org.vain.pipeline;

import org.vain.ArgumentParser;
import org.vain.analysis.AnalyzerConfiguration;
import org.vain.codegen.EmitterContext;
import org.vain.runtime.VainBuildException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one {@link FilePipeline} per source file, at most {@code jobs} files at
 * a time, and reports the errors of all files together.
 */
public class BuildPipeline {

    public static final String SOURCE_EXTENSION = ".vain";

    private final ArgumentParser.CompilerOptions options;
    private final AnalyzerConfiguration analyzerConfiguration;

    public BuildPipeline(ArgumentParser.CompilerOptions options, AnalyzerConfiguration analyzerConfiguration) {
        this.options = options;
        this.analyzerConfiguration = analyzerConfiguration;
    }

    /**
     * Expands the command line paths: files are taken as given, directories are
     * searched recursively for source files. No paths means the current
     * directory.
     */
    public static List<Path> collectSources(List<String> paths) throws IOException {
        List<String> roots = paths.isEmpty() ? List.of(".") : paths;
        List<Path> sources = new ArrayList<>();
        for (String root : roots) {
            Path path = Paths.get(root);
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    sources.addAll(walk
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                            .sorted()
                            .collect(Collectors.toList()));
                } catch (UncheckedIOException e) {
                    throw e.getCause();
                }
            } else if (Files.exists(path)) {
                sources.add(path);
            } else {
                throw new IOException("no such file or directory: " + root);
            }
        }
        return sources;
    }

    /**
     * Compiles every source file.
     *
     * @throws VainBuildException with the errors of all files, in file order
     */
    public void run(List<Path> sources) throws VainBuildException, InterruptedException {
        Command command = options.effectiveCommand();
        int jobs = Math.max(1, options.jobs);
        ExecutorService executor = Executors.newFixedThreadPool(jobs, runnable -> {
            Thread thread = new Thread(runnable, "vain-file");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (Path source : sources) {
                EmitterContext ctx = new EmitterContext(source.toString(), options);
                ctx.logDebug(command.name + " " + source);
                FilePipeline pipeline = new FilePipeline(source, ctx, command, analyzerConfiguration);
                results.add(executor.submit(pipeline::run));
            }

            List<String> errors = new ArrayList<>();
            for (int i = 0; i < results.size(); i++) {
                try {
                    errors.addAll(results.get(i).get());
                } catch (ExecutionException e) {
                    errors.add(sources.get(i) + ": fatal: " + e.getCause());
                }
            }
            if (!errors.isEmpty()) {
                throw new VainBuildException(errors);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
