package com.minireport.backend.loader;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 关联加载配置：策略、最大深度、必选与可选关联。
 */
public final class LoadConfig {

    public static final int DEFAULT_MAX_DEPTH = 3;

    private final LoadStrategy strategy;
    private final int maxDepth;
    private final List<Relationship> required;
    private final List<Relationship> optional;

    public LoadConfig(LoadStrategy strategy, int maxDepth, List<Relationship> required, List<Relationship> optional) {
        if(maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.strategy = strategy == null ? LoadStrategy.SELECTIVE : strategy;
        this.maxDepth = maxDepth;
        this.required = required == null ? ImmutableList.of() : ImmutableList.copyOf(required);
        this.optional = optional == null ? ImmutableList.of() : ImmutableList.copyOf(optional);
    }

    public static LoadConfig none() {
        return new LoadConfig(LoadStrategy.LAZY, DEFAULT_MAX_DEPTH, null, null);
    }

    public LoadStrategy getStrategy() {
        return strategy;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public List<Relationship> getRequired() {
        return required;
    }

    public List<Relationship> getOptional() {
        return optional;
    }

    @Override
    public String toString() {
        return "LoadConfig{strategy=" + strategy + ", maxDepth=" + maxDepth
                + ", required=" + required + ", optional=" + optional + "}";
    }
}
