package com.tttarena.gameservice.games.tictactoe.application;

import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * StateChangePublisher
 * -------------------------------------------------
 * 状态变更通知（fire-and-forget）：
 * - 未配置 sink 时直接丢弃通知；
 * - 已配置时把快照投递到通知线程池，publish 本身从不阻塞；
 * - sink 抛出的异常只记录日志，不回传给牌桌操作。
 */
@Slf4j
@Component
public class StateChangePublisher {

    private final ExecutorService executor;

    private volatile GameStateSink sink;

    public StateChangePublisher(@Qualifier("stateNotifyExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 替换当前 sink；传 null 表示关闭镜像。
     */
    public void configure(GameStateSink sink) {
        this.sink = sink;
        log.info("状态镜像已{}", sink == null ? "关闭" : "配置: " + sink.getClass().getSimpleName());
    }

    /**
     * 投递一份快照；sink 未配置时丢弃。
     */
    public void publish(GameSnapshot snapshot) {
        GameStateSink s = sink;
        if (s == null) return;
        try {
            executor.execute(() -> deliver(s, snapshot));
        } catch (RejectedExecutionException e) {
            log.warn("状态通知被拒绝（线程池已关闭）: status={}", snapshot.status);
        }
    }

    private void deliver(GameStateSink s, GameSnapshot snapshot) {
        try {
            s.onStateChanged(snapshot);
        } catch (RuntimeException e) {
            log.warn("状态镜像写入失败: round={}, status={}", snapshot.round, snapshot.status, e);
        }
    }
}
