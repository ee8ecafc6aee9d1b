package org.vain.pipeline;

import org.vain.codegen.EmitterContext;
import org.vain.codegen.TextChunk;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Last pipeline stage: streams text chunks into a temporary file next to the
 * target and renames it into place once the stream ends cleanly.
 * <p>
 * An error chunk means the output is incomplete. The temporary file is then
 * removed and the target is left untouched; the rest of the stream is still
 * consumed so that every error of the file is reported.
 */
public class OutputWriter {

    private final EmitterContext ctx;
    private final Path target;
    private volatile boolean aborted;

    public OutputWriter(EmitterContext ctx, Path target) {
        this.ctx = ctx;
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }

    /**
     * Marks the output as incomplete: the target is not replaced when the
     * stream ends. Called when an earlier stage fails.
     */
    public void abort() {
        aborted = true;
    }

    /**
     * Consumes the channel until it is closed.
     *
     * @return the errors found in the stream, empty when the target was written
     */
    public List<String> write(Channel<TextChunk> chunks) throws InterruptedException {
        List<String> errors = new ArrayList<>();
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        Writer writer = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
            writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
        } catch (IOException e) {
            errors.add(ctx.errorUtil.errorMessage(null, "cannot create output file in " + directory + ": " + e.getMessage()));
        }

        try {
            TextChunk chunk;
            while ((chunk = chunks.receive()) != null) {
                if (chunk.isError()) {
                    errors.add(chunk.getError());
                } else if (writer != null && errors.isEmpty()) {
                    try {
                        writer.write(chunk.getText());
                    } catch (IOException e) {
                        errors.add(ctx.errorUtil.errorMessage(null, "cannot write " + temp + ": " + e.getMessage()));
                    }
                }
            }
            if (writer != null) {
                writer.close();
                writer = null;
            }
            if (errors.isEmpty() && !aborted && temp != null) {
                move(temp, target);
                ctx.logDebug("wrote " + target);
                temp = null;
            }
        } catch (IOException e) {
            errors.add(ctx.errorUtil.errorMessage(null, "cannot write " + target + ": " + e.getMessage()));
        } finally {
            if (writer != null) {
                closeQuietly(writer, errors);
            }
            if (temp != null) {
                discard(temp, errors);
            }
        }
        return errors;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void closeQuietly(Writer writer, List<String> errors) {
        try {
            writer.close();
        } catch (IOException e) {
            errors.add(ctx.errorUtil.errorMessage(null, "cannot close temporary file: " + e.getMessage()));
        }
    }

    private void discard(Path path, List<String> errors) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            errors.add(ctx.errorUtil.errorMessage(null, "cannot remove temporary file " + path + ": " + e.getMessage()));
        }
    }
}
