package com.minireport.backend.loader;

import java.util.Locale;

public enum LoadStrategy {
    /** 预加载全部声明的关联（required + optional），深度不超过 maxDepth */
    EAGER,
    /** 不预加载，由调用方按需获取 */
    LAZY,
    /** 只预加载 required；optional 在较浅的深度内顺带加载 */
    SELECTIVE;

    public static LoadStrategy from(String s) {
        return LoadStrategy.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
