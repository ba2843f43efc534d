package com.postfixspin.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 改写器运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class RewriterConfig {
    private int maxRewrites = Constants.DEFAULT_MAX_REWRITES;
    private int maxPasses = Constants.DEFAULT_MAX_PASSES;
    private int maxDepth = Constants.DEFAULT_MAX_DEPTH;
    private boolean wrapCompoundOperands = true;

    public int getMaxRewrites() {
        return maxRewrites;
    }

    public void setMaxRewrites(int maxRewrites) {
        this.maxRewrites = maxRewrites;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public void setMaxPasses(int maxPasses) {
        this.maxPasses = maxPasses;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public boolean isWrapCompoundOperands() {
        return wrapCompoundOperands;
    }

    public void setWrapCompoundOperands(boolean wrapCompoundOperands) {
        this.wrapCompoundOperands = wrapCompoundOperands;
    }

    /**
     * 使用默认配置创建实例
     */
    public static RewriterConfig defaults() {
        return new RewriterConfig();
    }

    /**
     * 从JSON文件读取配置，未知字段视为错误
     */
    public static RewriterConfig load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper.readValue(path.toFile(), RewriterConfig.class);
    }
}
