package com.postfixspin.rewrite;

import com.postfixspin.text.Token;

/**
 * 同层兄弟序列中的一次标记出现。
 *
 * @param markerIndex {@code ::} 记号在兄弟序列中的下标
 * @param marker      {@code ::} 记号本身，用于定位诊断
 */
public record Occurrence(int markerIndex, Token marker) {

    public int headIndex() {
        return markerIndex + 1;
    }

    public int afterHead() {
        return markerIndex + 2;
    }
}
