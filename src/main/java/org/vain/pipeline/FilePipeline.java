package org.vain.pipeline;

import org.vain.analysis.Analyzer;
import org.vain.analysis.AnalyzerConfiguration;
import org.vain.astnode.Node;
import org.vain.codegen.EmitterContext;
import org.vain.codegen.Generator;
import org.vain.codegen.TextChunk;
import org.vain.lexer.Lexer;
import org.vain.lexer.LexerToken;
import org.vain.parser.Parser;
import org.vain.parser.TokenStream;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Compiles one source file.
 * <p>
 * Lexer, parser, analyzer, generator and writer each run on their own thread
 * and hand their results to the next stage through a single-slot
 * {@link Channel}. A stage closes its output channel when its input is
 * exhausted. Errors travel downstream as error nodes and error chunks and are
 * collected by the writer. A stage that fails unexpectedly, including on
 * {@link StackOverflowError} from deeply nested input, records the failure,
 * tells the writer to discard its output and drains its input so the stages
 * before it can finish.
 */
public class FilePipeline {

    private final Path source;
    private final EmitterContext ctx;
    private final Command command;
    private final AnalyzerConfiguration analyzerConfiguration;
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

    public FilePipeline(Path source, EmitterContext ctx, Command command, AnalyzerConfiguration analyzerConfiguration) {
        this.source = source;
        this.ctx = ctx;
        this.command = command;
        this.analyzerConfiguration = analyzerConfiguration;
    }

    /**
     * Runs all stages and waits for them.
     *
     * @return every error found in the file, empty on success
     */
    public List<String> run() throws InterruptedException {
        String input;
        try {
            input = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return List.of(ctx.errorUtil.errorMessage(null, "cannot read file: " + e.getMessage()));
        }

        Channel<LexerToken> tokens = new Channel<>();
        Channel<Node> parsed = new Channel<>();
        Channel<Node> analyzed = new Channel<>();
        Channel<TextChunk> chunks = new Channel<>();
        Generator generator = command.newGenerator(ctx);
        OutputWriter writer = new OutputWriter(ctx, generator.outputPath(source));

        List<Thread> stages = List.of(
                start("lex", () -> lex(input, tokens), tokens, null, writer),
                start("parse", () -> parse(tokens, parsed), parsed, tokens, writer),
                start("analyze", () -> analyze(parsed, analyzed), analyzed, parsed, writer),
                start("generate", () -> generate(generator, analyzed, chunks), chunks, analyzed, writer),
                start("write", () -> errors.addAll(writer.write(chunks)), null, chunks, writer));
        for (Thread stage : stages) {
            stage.join();
        }
        ctx.logDebug(source + ": " + errors.size() + " error(s)");
        return new ArrayList<>(errors);
    }

    private void lex(String input, Channel<LexerToken> out) throws InterruptedException {
        Lexer lexer = new Lexer(ctx.fileName, input);
        LexerToken token;
        while ((token = lexer.nextToken()) != null) {
            out.send(token);
        }
    }

    private void parse(Channel<LexerToken> in, Channel<Node> out) throws InterruptedException {
        Parser parser = new Parser(ctx, new TokenStream(() -> {
            try {
                return in.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }));
        Node unit;
        while ((unit = parser.parse()) != null) {
            out.send(unit);
        }
    }

    private void analyze(Channel<Node> in, Channel<Node> out) throws InterruptedException {
        Analyzer analyzer = command.analyze ? new Analyzer(ctx, analyzerConfiguration) : null;
        Node unit;
        while ((unit = in.receive()) != null) {
            if (analyzer == null) {
                out.send(unit);
                continue;
            }
            for (Node result : analyzer.analyze(unit)) {
                out.send(result);
            }
        }
    }

    private void generate(Generator generator, Channel<Node> in, Channel<TextChunk> out) throws InterruptedException {
        Node unit;
        while ((unit = in.receive()) != null) {
            Iterator<TextChunk> rendered = generator.render(unit);
            while (rendered.hasNext()) {
                out.send(rendered.next());
            }
        }
    }

    @FunctionalInterface
    private interface StageBody {
        void run() throws InterruptedException;
    }

    private Thread start(String name, StageBody body, Channel<?> out, Channel<?> in, OutputWriter writer) {
        Thread thread = new Thread(() -> {
            try {
                try {
                    body.run();
                } catch (RuntimeException | Error e) {
                    // abort before closing, so the writer sees it before its input ends
                    writer.abort();
                    String reason = e instanceof StackOverflowError ? "input is nested too deeply" : e.toString();
                    errors.add(ctx.errorUtil.errorMessage(null, "fatal: " + name + " stage failed: " + reason));
                } finally {
                    // the upstream stage may still be blocked on a send
                    if (in != null) {
                        in.drain();
                    }
                    if (out != null) {
                        out.close();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "vain-" + name + "-" + source.getFileName());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
