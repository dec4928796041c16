package com.minireport.backend.pipeline;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * producer 在 chunk 边界检查的暂停 / 取消信号。
 */
final class PipelineControl {

    private final ReentrantLock lock = new ReentrantLock();

    /** 恢复或取消时唤醒 producer */
    private final Condition resumed = lock.newCondition();

    private boolean paused = false;
    private volatile boolean cancelled = false;

    void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    void resume() {
        lock.lock();
        try {
            paused = false;
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void cancel() {
        lock.lock();
        try {
            cancelled = true;
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 暂停期间阻塞。
     *
     * @return false 表示已取消
     */
    boolean awaitRunnable() throws InterruptedException {
        lock.lock();
        try {
            while (paused && !cancelled) {
                resumed.await();
            }
            return !cancelled;
        } finally {
            lock.unlock();
        }
    }

    boolean isCancelled() {
        return cancelled;
    }

    boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }
}
