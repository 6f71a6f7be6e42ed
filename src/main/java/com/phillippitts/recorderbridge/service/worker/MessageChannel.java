package com.phillippitts.recorderbridge.service.worker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO channel between the dispatcher and the audio worker.
 *
 * <p>Once closed, sends fail immediately while messages already queued remain receivable; a
 * receive on a closed, drained channel fails. Either side may close it, which is how a dead
 * worker becomes visible to callers.
 *
 * <p>Receives are not interruptible: a caller that has sent a command must consume its
 * response or the channel pair falls out of step. An interrupt arriving during a receive is
 * re-asserted on the calling thread when the receive returns.
 *
 * @param <T> message type
 */
public final class MessageChannel<T> {

    private final Lock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<T> queue = new ArrayDeque<>();
    private final String name;
    private boolean closed;

    public MessageChannel(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Enqueues a message.
     *
     * @throws ChannelClosedException if the channel has been closed
     */
    public void send(T message) throws ChannelClosedException {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            if (closed) {
                throw new ChannelClosedException(name + " channel is closed");
            }
            queue.addLast(message);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a message is available.
     *
     * @throws ChannelClosedException if the channel is closed and drained
     */
    public T receive() throws ChannelClosedException {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException(name + " channel closed without a message");
                }
                notEmpty.awaitUninterruptibly();
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a message is available or the timeout elapses.
     *
     * @return the message, or {@code null} on timeout
     * @throws ChannelClosedException if the channel is closed and drained
     */
    public T receive(Duration timeout) throws ChannelClosedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException(name + " channel closed without a message");
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return null;
                }
                try {
                    notEmpty.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Closes the channel and wakes every blocked receiver. Idempotent. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "MessageChannel[" + name + "]";
    }
}
