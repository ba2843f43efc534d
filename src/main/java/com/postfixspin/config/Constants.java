package com.postfixspin.config;

/**
 * 全局常量定义
 *
 * 包含标记语法、改写上限参数和命令行输入限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 标记语法 ====================
    /** 后缀标记记号，紧跟括号构造头 */
    public static final String MARKER = "::";

    // ==================== 改写上限 ====================
    /** 单次调用允许的最大改写次数 */
    public static final int DEFAULT_MAX_REWRITES = 10_000;
    /** 收敛前允许的最大扫描轮数 */
    public static final int DEFAULT_MAX_PASSES = 64;
    /** 记号分组最大嵌套深度 */
    public static final int DEFAULT_MAX_DEPTH = 256;

    // ==================== 命令行参数 ====================
    /** 单个源文件最大字符数（4M） */
    public static final int MAX_SOURCE_LENGTH = 4 * 1024 * 1024;
    /** 命令行允许设置的改写次数上限 */
    public static final int MAX_REWRITES_CEILING = 1_000_000;
}
