package com.minireport.backend.aggregator;

/**
 * 分组表达式无法解析为字段名，对应的分组级别会被丢弃。
 */
public class FieldResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public FieldResolutionException(String message) {
        super(message);
    }

    public FieldResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
