package com.postfixspin.rewrite;

import com.postfixspin.text.TokenGroup;

/**
 * 一次改写调用的结果：成功时携带新记号树，失败时携带首个诊断。
 */
public sealed interface RewriteResult permits RewriteResult.Success, RewriteResult.Failure {

    boolean isSuccess();

    /**
     * 成功时返回输出树，失败时抛出对应的改写异常。
     */
    TokenGroup orElseThrow();

    record Success(TokenGroup output, int rewrites, int passes) implements RewriteResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public TokenGroup orElseThrow() {
            return output;
        }
    }

    record Failure(Diagnostic diagnostic) implements RewriteResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public TokenGroup orElseThrow() {
            throw SpinRewriteException.from(diagnostic);
        }
    }
}
