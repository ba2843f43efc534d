package com.postfixspin.text;

public class SourceParseException extends RuntimeException {
    private final Position position;
    private final String source;

    public SourceParseException(String message, Position position, String source) {
        super(buildMessage(message, position, source));
        this.position = position;
        this.source = source;
    }

    public Position getPosition() {
        return position;
    }

    public String getSource() {
        return source;
    }

    private static String buildMessage(String message, Position position, String source) {
        String header = "Lex error at " + position + ": " + message;
        String pointer = position.pointer(source);
        return pointer.isEmpty() ? header : header + System.lineSeparator() + pointer;
    }
}
