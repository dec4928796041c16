package com.minireport.backend.pipeline;

/**
 * 内存占用采样，producer 在每次拉取前调用。
 */
@FunctionalInterface
public interface MemoryProbe {

    long usedBytes();

    /** JVM 堆当前已用字节 */
    static MemoryProbe runtime() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            return rt.totalMemory() - rt.freeMemory();
        };
    }
}
