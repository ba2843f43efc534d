package com.postfixspin.rewrite;

import com.postfixspin.text.Position;

public record Diagnostic(ErrorKind kind, Position position, String description) {

    @Override
    public String toString() {
        return "[" + kind + "] " + position + ": " + description;
    }
}
