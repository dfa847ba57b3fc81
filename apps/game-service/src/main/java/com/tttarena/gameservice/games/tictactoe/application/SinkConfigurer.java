package com.tttarena.gameservice.games.tictactoe.application;

import com.tttarena.gameservice.games.tictactoe.infrastructure.redis.RedisGameStateSink;
import com.tttarena.gameservice.games.tictactoe.service.TicTacToeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 应用启动完成后把 Redis 镜像接入牌桌（tictactoe.persistence.enabled=true 时生效）。
 * 未启用时牌桌照常运行，状态变更不做镜像。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tictactoe.persistence", name = "enabled", havingValue = "true")
public class SinkConfigurer {

    private final TicTacToeService ticTacToeService;
    private final RedisGameStateSink redisGameStateSink;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("启用 Redis 状态镜像");
        ticTacToeService.configureSink(redisGameStateSink);
    }
}
