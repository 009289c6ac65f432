package com.asiainfo.kpietl.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 有限次数重试
 * 两种退避方式：
 * - 指数回退：initialDelay, initialDelay*2, initialDelay*4 ...（可设上限）
 * - 固定间隔：每次等待 initialDelay
 *
 * 全部尝试失败后抛出 {@link RetryExhaustedException}，cause 为最后一次异常
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    /**
     * 等待策略，测试中替换为不休眠的实现
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws Exception;
    }

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final boolean exponential;
    private final Sleeper sleeper;

    private RetryExecutor(int maxAttempts, long initialDelayMs, long maxDelayMs, boolean exponential, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = Math.max(0, initialDelayMs);
        this.maxDelayMs = maxDelayMs;
        this.exponential = exponential;
        this.sleeper = sleeper;
    }

    /**
     * 指数回退
     *
     * @param maxDelayMs 单次等待上限，<= 0 表示不设上限
     */
    public static RetryExecutor exponential(int maxAttempts, long initialDelayMs, long maxDelayMs) {
        return new RetryExecutor(maxAttempts, initialDelayMs, maxDelayMs, true, Thread::sleep);
    }

    /**
     * 固定间隔
     */
    public static RetryExecutor fixed(int maxAttempts, long delayMs) {
        return new RetryExecutor(maxAttempts, delayMs, 0, false, Thread::sleep);
    }

    public RetryExecutor withSleeper(Sleeper sleeper) {
        return new RetryExecutor(maxAttempts, initialDelayMs, maxDelayMs, exponential, sleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 第 retry 次重试前的等待时间（retry 从 1 开始）
     */
    public long delayBeforeRetry(int retry) {
        if (!exponential) {
            return initialDelayMs;
        }
        long delay = initialDelayMs << Math.min(retry - 1, 30);
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    public <T> T execute(String operation, Attempt<T> attempt) {
        Exception last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                return attempt.run();
            } catch (Exception e) {
                last = e;
                if (i == maxAttempts) {
                    log.error("[Retry] {} failed after {} attempt(s): {}", operation, maxAttempts, e.getMessage());
                    break;
                }
                long delay = delayBeforeRetry(i);
                log.warn("[Retry] {} failed (attempt {}/{}): {}. Waiting {}ms...",
                        operation, i, maxAttempts, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PipelineException("Interrupted while retrying " + operation, ie);
                }
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, last);
    }

    /**
     * 重试耗尽
     */
    public static class RetryExhaustedException extends PipelineException {

        private final int attempts;

        public RetryExhaustedException(String operation, int attempts, Throwable cause) {
            super(operation + " failed after " + attempts + " attempt(s)", cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
