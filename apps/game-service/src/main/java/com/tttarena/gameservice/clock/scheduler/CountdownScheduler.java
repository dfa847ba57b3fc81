package com.tttarena.gameservice.clock.scheduler;

import java.time.Duration;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 回合计时器（watchdog）接口，不关心具体棋类规则。
 *
 * 设计目标：
 *  - 提供 启动 / 重置 / 停止 三种操作；
 *  - 到期时回调一次 TimeoutHandler，由上层完成权威业务处理（如代走一步）；
 *  - 每次启动或重置都会产生新的版本号，上层可据此丢弃过期的到期回调。
 */
public interface CountdownScheduler {

    /**
     * TimeoutHandler
     * ---------------------------------------
     * 到期时回调，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * 倒计时到期时触发。
         * @param key     计时器业务键
         * @param version 触发本次到期的计时版本（用于上层幂等/保护）
         */
        void onTimeout(String key, long version);
    }

    /**
     * 以给定时长开始新一轮倒计时；已有倒计时会先被取消。
     * @param duration  单回合时长
     * @param onTimeout 到期回调
     */
    void start(Duration duration, TimeoutHandler onTimeout);

    /**
     * 取消当前倒计时并按原时长重新开始；未启动时忽略。
     */
    void reset();

    /**
     * 取消倒计时，不再重启；之后需要再次 start。
     */
    void stop();

    /** 是否处于计时中 */
    boolean isRunning();

    /**
     * 该版本是否仍是当前生效的倒计时。
     * @param version 到期回调携带的版本
     */
    boolean isCurrent(long version);
}
