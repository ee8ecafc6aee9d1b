package org.vain.runtime;

import org.vain.astnode.Position;

import java.io.Serial;

/**
 * VainCompilerException is thrown by the parser on the first structural error
 * of a file. It carries the message already formatted with file, line and column.
 */
public class VainCompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Detailed error message that includes the location of the error
    private final String errorMessage;
    private final transient Position position;

    /**
     * Constructs a new VainCompilerException using the error message utility.
     *
     * @param position         the position where the error occurred
     * @param message          the detail message describing the error
     * @param errorMessageUtil the utility for formatting error messages
     */
    public VainCompilerException(Position position, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.position = position;
        this.errorMessage = errorMessageUtil.errorMessage(position, message);
    }

    /**
     * Constructs a new VainCompilerException from a message that is already formatted,
     * such as the text of a lexer error token.
     */
    public VainCompilerException(String formattedMessage, Position position) {
        super(formattedMessage);
        this.position = position;
        this.errorMessage = formattedMessage;
    }

    public Position getPosition() {
        return position;
    }

    @Override
    public String getMessage() {
        return errorMessage;
    }
}
