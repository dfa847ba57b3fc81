package com.tttarena.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 单机内存版回合计时器，一个实例只服务一个业务键（一张牌桌）。
 *
 * 职责：
 *  - 使用共享的 ScheduledExecutorService 调度一次性到期任务；
 *  - start/reset 递增版本号，旧任务即使已经排队执行，也会因版本不一致被丢弃；
 *  - 到期后若上层没有 reset/stop，则按原时长重新计时（持续看守直到被停止）。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如选点落子）；
 *  - 回调时不持有本对象的锁，上层可在回调里安全地调用 reset/stop。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    // 调度线程池（多张牌桌可共享）
    private final ScheduledExecutorService scheduler;
    // 业务键，例如 "tictactoe:main"
    private final String key;

    // 版本号：每次 start/reset/stop 自增
    private final AtomicLong version = new AtomicLong();

    // 以下字段由 this 监视器保护
    private Duration duration;
    private TimeoutHandler onTimeout;
    private ScheduledFuture<?> task;

    /**
     * @param scheduler 调度线程池
     * @param key       业务键
     */
    public CountdownSchedulerImpl(ScheduledExecutorService scheduler, String key) {
        this.scheduler = scheduler;
        this.key = key;
    }

    @Override
    public synchronized void start(Duration duration, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        cancelTask();
        this.duration = duration;
        this.onTimeout = onTimeout;
        log.info("回合计时开始: key={}, duration={}", key, duration);
        schedule();
    }

    @Override
    public synchronized void reset() {
        // 未启动：没有可重置的计时
        if (onTimeout == null) return;
        cancelTask();
        log.debug("回合计时重置: key={}", key);
        schedule();
    }

    @Override
    public synchronized void stop() {
        boolean wasRunning = onTimeout != null;
        cancelTask();
        onTimeout = null;
        // 让已在排队的到期任务失效
        version.incrementAndGet();
        if (wasRunning) log.info("回合计时停止: key={}", key);
    }

    @Override
    public synchronized boolean isRunning() {
        return onTimeout != null;
    }

    @Override
    public boolean isCurrent(long v) {
        return version.get() == v;
    }

    /**
     * 调度一次到期任务（调用方持有 this 监视器）。
     */
    private void schedule() {
        long v = version.incrementAndGet();
        TimeoutHandler handler = onTimeout;
        task = scheduler.schedule(() -> fire(handler, v), duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 到期执行：版本仍有效才回调；回调后若无人重置/停止，则重新计时。
     */
    private void fire(TimeoutHandler handler, long v) {
        // 已被 reset/stop：丢弃
        if (!isCurrent(v)) return;
        log.info("回合计时到期: key={}, version={}", key, v);
        safeTimeout(handler, v);
        synchronized (this) {
            // 回调里没有 reset/stop，继续看守
            if (isCurrent(v) && onTimeout != null) schedule();
        }
    }

    /**
     * 安全触发到期回调，回调异常只记录日志，不影响调度线程。
     */
    private void safeTimeout(TimeoutHandler handler, long v) {
        if (handler == null) return;
        try {
            handler.onTimeout(key, v);
        } catch (RuntimeException e) {
            log.error("回合到期回调异常: key={}, version={}", key, v, e);
        }
    }

    private void cancelTask() {
        ScheduledFuture<?> f = task;
        task = null;
        // 取消调度，但不打断正在运行
        if (f != null) f.cancel(false);
    }
}
