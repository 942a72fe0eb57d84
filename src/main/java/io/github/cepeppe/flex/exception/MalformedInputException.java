package io.github.cepeppe.flex.exception;

import java.util.Map;

/** Il flusso in ingresso non è XML ben formato. */
public class MalformedInputException extends FlexParseException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public MalformedInputException(String message, int line, int column, Throwable cause) {
        super(Code.MALFORMED_INPUT, null, message + " at line " + line + ", column " + column,
                Map.of("line", line, "column", column), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
