package com.minireport.backend.pipeline;

import java.time.Duration;

/**
 * 重试退避的等待方式，测试中替换为记录延迟而不真正睡眠的实现。
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
