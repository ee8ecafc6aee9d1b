package org.vain.codegen;

/**
 * One piece of generator output: either text to be written, or an error that
 * aborts the output file.
 */
public final class TextChunk {
    private final String text;
    private final String error;

    private TextChunk(String text, String error) {
        this.text = text;
        this.error = error;
    }

    public static TextChunk text(String text) {
        return new TextChunk(text, null);
    }

    public static TextChunk error(String message) {
        return new TextChunk(null, message);
    }

    public boolean isError() {
        return error != null;
    }

    public String getText() {
        return text;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isError() ? "error: " + error : text;
    }
}
