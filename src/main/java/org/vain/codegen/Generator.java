package org.vain.codegen;

import org.vain.astnode.Node;

import java.nio.file.Path;
import java.util.Iterator;

/**
 * A lowering pass from an analyzed tree to text.
 * <p>
 * Rendering is pulled chunk by chunk, so output can be streamed to a file as it
 * is produced. A failure is reported as an error chunk and ends the sequence.
 */
public interface Generator {

    /**
     * Renders one compilation unit. An {@code ErrorNode} unit renders as a
     * single error chunk.
     */
    Iterator<TextChunk> render(Node unit);

    /**
     * Where the output for the given source file goes.
     */
    Path outputPath(Path source);
}
