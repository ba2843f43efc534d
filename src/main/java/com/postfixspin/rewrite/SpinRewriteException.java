package com.postfixspin.rewrite;

import com.postfixspin.text.Position;

public class SpinRewriteException extends RuntimeException {
    private final ErrorKind kind;
    private final Position position;
    private final String description;

    public SpinRewriteException(ErrorKind kind, String description, Position position) {
        this(kind, description, position, null, null);
    }

    public SpinRewriteException(ErrorKind kind, String description, Position position, String source, Throwable cause) {
        super(buildMessage(kind, description, position, source), cause);
        this.kind = kind;
        this.position = position;
        this.description = description;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Position getPosition() {
        return position;
    }

    public String getDescription() {
        return description;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(kind, position, description);
    }

    /**
     * 附加源码文本，生成带行内指针的错误信息。
     */
    public SpinRewriteException withSource(String source) {
        return new SpinRewriteException(kind, description, position, source, this);
    }

    public static SpinRewriteException from(Diagnostic diagnostic) {
        return new SpinRewriteException(diagnostic.kind(), diagnostic.description(), diagnostic.position());
    }

    private static String buildMessage(ErrorKind kind, String description, Position position, String source) {
        String header = "Rewrite error [" + kind + "] at " + position + ": " + description;
        String pointer = position.pointer(source);
        return pointer.isEmpty() ? header : header + System.lineSeparator() + pointer;
    }
}
