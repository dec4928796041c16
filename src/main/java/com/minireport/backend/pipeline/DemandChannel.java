package com.minireport.backend.pipeline;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.minireport.common.Error;

/**
 * 基于信用（credit）的有界通道，连接流水线的两个阶段。
 * <p>
 * 接收方通过 {@link #grant(int)} 声明还能接收多少个元素，发送方只有拿到信用才能 {@link #send}。
 * 接收方先授予 maxDemand 个信用、此后每取走一个再授予一个，因此 缓冲元素数 + 剩余信用 <= capacity，
 * 通道里不存在无界队列。
 * </p>
 * 终止方式：
 * 1) complete：正常结束，缓冲中的元素取完后 take 返回 null
 * 2) fail：异常结束，缓冲中的元素取完后 take 抛出失败原因
 * 3) cancel：立即结束，丢弃缓冲，唤醒两端所有等待者
 */
public class DemandChannel<T> {

    private final String streamId;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();

    /** 有可用信用，发送方可以继续 */
    private final Condition creditAvailable = lock.newCondition();

    /** 缓冲中有元素或通道已结束，接收方可以继续 */
    private final Condition notEmpty = lock.newCondition();

    private final ArrayDeque<T> buffer;
    private int credits = 0;
    private boolean completed = false;
    private boolean cancelled = false;
    private Throwable failure;

    public DemandChannel(String streamId, int capacity) {
        if(capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.streamId = streamId;
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * 接收方授予 n 个信用。
     */
    public void grant(int n) {
        lock.lock();
        try {
            if(isClosed()) {
                return;
            }
            if(credits + n + buffer.size() > capacity) {
                throw new IllegalStateException("Demand exceeds channel capacity " + capacity
                        + " (credits=" + credits + ", buffered=" + buffer.size() + ", grant=" + n + ")");
            }
            credits += n;
            creditAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 发送方阻塞等待信用。
     *
     * @return false 表示通道已取消或已结束，发送方应退出
     */
    public boolean awaitCredit() throws InterruptedException {
        lock.lock();
        try {
            while (credits == 0 && !isClosed()) {
                creditAvailable.await();
            }
            return !isClosed();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 消耗一个信用并放入元素；没有信用时直接报错，发送方必须先 {@link #awaitCredit()}。
     *
     * @throws IllegalStateException 通道已关闭或没有信用
     */
    public void send(T item) {
        lock.lock();
        try {
            if(isClosed()) {
                throw Error.ChannelClosedException;
            }
            if(credits == 0) {
                throw new IllegalStateException("send without demand credit");
            }
            credits--;
            buffer.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 接收方阻塞取下一个元素。
     *
     * @return null 表示正常结束或已取消
     * @throws PipelineFailedException 上游以失败结束且缓冲已取空
     */
    public T take() throws InterruptedException {
        lock.lock();
        try {
            while (buffer.isEmpty() && !completed && failure == null && !cancelled) {
                notEmpty.await();
            }
            if(cancelled) {
                return null;
            }
            if(!buffer.isEmpty()) {
                return buffer.pollFirst();
            }
            if(failure != null) {
                if(failure instanceof PipelineFailedException) {
                    throw (PipelineFailedException) failure;
                }
                throw new PipelineFailedException(streamId, String.valueOf(failure.getMessage()), failure);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    public void complete() {
        lock.lock();
        try {
            completed = true;
            notEmpty.signalAll();
            creditAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void fail(Throwable cause) {
        lock.lock();
        try {
            if(failure == null) {
                failure = cause;
            }
            notEmpty.signalAll();
            creditAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void cancel() {
        lock.lock();
        try {
            cancelled = true;
            buffer.clear();
            notEmpty.signalAll();
            creditAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /** 正常结束且缓冲已取空 */
    public boolean isDrained() {
        lock.lock();
        try {
            return completed && failure == null && !cancelled && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 注意：调用方需持有 lock
     */
    private boolean isClosed() {
        return cancelled || completed || failure != null;
    }
}
