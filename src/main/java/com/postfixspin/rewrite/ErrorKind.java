package com.postfixspin.rewrite;

public enum ErrorKind {
    /** 标记前找不到合法的操作数 */
    MALFORMED_OPERAND,
    /** 标记后不是括号构造头 */
    EXPECTED_HEAD_GROUP,
    /** 构造头关键字不在识别范围内 */
    UNKNOWN_CONSTRUCT,
    /** 关键字可识别但构造头缺少或多出成分 */
    MALFORMED_HEAD,
    /** 构造头后不是花括号构造体 */
    EXPECTED_BODY,
    /** 改写未在上限内收敛 */
    REWRITE_LIMIT_EXCEEDED
}
