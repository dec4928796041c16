package com.minireport.backend.aggregator;

/**
 * 由报表定义层注入：把分组表达式解析为记录中的字段名。
 */
@FunctionalInterface
public interface FieldResolver {

    String resolve(GroupDefinition definition) throws FieldResolutionException;

    /**
     * 表达式本身就是非空字段名字符串时直接使用，其他情况均视为无法解析。
     */
    static FieldResolver fieldNames() {
        return def -> {
            Object expr = def.getExpression();
            if(expr instanceof CharSequence && ((CharSequence) expr).length() > 0) {
                return expr.toString();
            }
            throw new FieldResolutionException("Cannot resolve field from expression: " + expr);
        };
    }
}
