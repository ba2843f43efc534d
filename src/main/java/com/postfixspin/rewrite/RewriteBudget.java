package com.postfixspin.rewrite;

import com.postfixspin.text.Position;

/**
 * 单次改写调用内的改写计数，超出上限即中止。
 */
final class RewriteBudget {
    private final int maxRewrites;
    private int rewrites;

    RewriteBudget(int maxRewrites) {
        this.maxRewrites = maxRewrites;
    }

    void consume(Position position) {
        if (rewrites >= maxRewrites) {
            throw new SpinRewriteException(ErrorKind.REWRITE_LIMIT_EXCEEDED,
                    "改写次数超过上限 " + maxRewrites, position);
        }
        rewrites++;
    }

    int rewrites() {
        return rewrites;
    }
}
