package org.vain.runtime;

import org.vain.astnode.Position;

/**
 * Utility class for generating error messages that point into a source file.
 * <p>
 * Messages have the form {@code path:line:col: message}, with both line and
 * column 1-origin.
 */
public class ErrorMessageUtil {
    private final String fileName;

    /**
     * Constructs an ErrorMessageUtil for the specified file name.
     *
     * @param fileName the name of the file, as given on the command line
     */
    public ErrorMessageUtil(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    public static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message located at the given position.
     *
     * @param position the position of the error, or null when unknown
     * @param message  the error message
     * @return the formatted error message
     */
    public String errorMessage(Position position, String message) {
        if (position == null) {
            return fileName + ": " + message;
        }
        return fileName + ":" + position.line + ":" + (position.col + 1) + ": " + message;
    }
}
