package com.projectgroup5.blobarena.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 单个连接的发送通道（独立写线程）
 * - 普通应答进入有界队列，满了丢弃最旧的
 * - 快照只保留最新一帧，慢客户端不会拖住广播线程
 */
class OutboundChannel {
    private static final Logger logger = LoggerFactory.getLogger(OutboundChannel.class);

    private final OutputStream out;
    private final int queueCapacity;
    private final Consumer<IOException> failureHandler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition ready = lock.newCondition();
    private final ArrayDeque<byte[]> pending = new ArrayDeque<>();
    private byte[] latestSnapshot;
    private long dropped;

    // 写线程和同步写共用，保证帧不会交错
    private final Object writeLock = new Object();

    private volatile boolean running;
    private Thread writer;

    OutboundChannel(OutputStream out, int queueCapacity, Consumer<IOException> failureHandler) {
        this.out = out;
        this.queueCapacity = queueCapacity;
        this.failureHandler = failureHandler;
    }

    void start(String threadName) {
        if (running) {
            return;
        }
        running = true;
        writer = new Thread(this::writerRun, threadName);
        writer.setDaemon(true);
        writer.start();
    }

    void stop() {
        running = false;
        lock.lock();
        try {
            ready.signalAll();
        } finally {
            lock.unlock();
        }
        if (writer != null && writer != Thread.currentThread()) {
            writer.interrupt();
        }
    }

    void offer(byte[] frame) {
        lock.lock();
        try {
            if (pending.size() >= queueCapacity) {
                pending.pollFirst();
                dropped++;
            }
            pending.addLast(frame);
            ready.signal();
        } finally {
            lock.unlock();
        }
    }

    void offerSnapshot(byte[] frame) {
        lock.lock();
        try {
            latestSnapshot = frame;
            ready.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在调用线程上直接写出（用于关闭前的最后一个应答）
     */
    void writeNow(byte[] frame) throws IOException {
        synchronized (writeLock) {
            out.write(frame);
            out.flush();
        }
    }

    long getDropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    private void writerRun() {
        List<byte[]> batch = new ArrayList<>();
        try {
            while (running) {
                byte[] snapshot;
                lock.lock();
                try {
                    while (running && pending.isEmpty() && latestSnapshot == null) {
                        ready.await();
                    }
                    batch.addAll(pending);
                    pending.clear();
                    snapshot = latestSnapshot;
                    latestSnapshot = null;
                } finally {
                    lock.unlock();
                }
                if (!running) {
                    break;
                }

                synchronized (writeLock) {
                    for (byte[] frame : batch) {
                        out.write(frame);
                    }
                    if (snapshot != null) {
                        out.write(snapshot);
                    }
                    out.flush();
                }
                batch.clear();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (running) {
                logger.debug("Writer {} failed: {}", Thread.currentThread().getName(), e.getMessage());
                failureHandler.accept(e);
            }
        }
    }
}
