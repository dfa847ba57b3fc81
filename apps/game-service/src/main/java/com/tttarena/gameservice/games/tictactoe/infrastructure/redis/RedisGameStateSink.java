package com.tttarena.gameservice.games.tictactoe.infrastructure.redis;

import com.tttarena.gameservice.games.tictactoe.application.GameStateSink;
import com.tttarena.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.repository.GameStateRepository;
import com.tttarena.gameservice.platform.config.TableProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 把每次状态变更镜像到 Redis。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisGameStateSink implements GameStateSink {

    private final GameStateRepository gameStateRepository;
    private final TableProperties props;

    @Override
    public void onStateChanged(GameSnapshot snapshot) {
        GameStateRecord rec = GameStateRecord.from(props.getTableId(), snapshot, System.currentTimeMillis());
        gameStateRepository.save(props.getTableId(), rec, props.getPersistence().getTtl());
        log.debug("状态已镜像到 Redis: tableId={}, round={}, status={}",
                props.getTableId(), rec.getRound(), rec.getStatus());
    }
}
