package com.tttarena.gameservice.games.tictactoe.infrastructure.redis.repo;

import com.tttarena.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tttarena.gameservice.games.tictactoe.domain.repository.GameStateRepository;
import com.tttarena.gameservice.games.tictactoe.infrastructure.redis.RedisKeys;
import com.tttarena.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;

/**
 * RedisGameStateRepository
 * -------------------------------------------------------
 * 牌桌状态镜像的 Redis 实现（JSON 存储，带 TTL）。
 */
@Repository
@RequiredArgsConstructor
public class RedisGameStateRepository implements GameStateRepository {

    private final RedisOps ops;

    @Override
    public void save(String tableId, GameStateRecord state, Duration ttl) {
        ops.setEx(RedisKeys.tableState(tableId), state, ttl);
    }
}
