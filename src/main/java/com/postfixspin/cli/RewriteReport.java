package com.postfixspin.cli;

public record RewriteReport(
        String source,
        String output,
        int rewrites,
        int passes,
        long elapsedMs
) {
}
