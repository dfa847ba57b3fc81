package com.tttarena.gameservice.games.tictactoe.domain.repository;

import com.tttarena.gameservice.games.tictactoe.domain.dto.GameStateRecord;

import java.time.Duration;

/**
 * GameStateRepository
 * ----------------------------------------
 * 牌桌状态镜像仓储：只保存最新一份状态，不保证持久性。
 * 当前实现基于 Redis。
 * ----------------------------------------
 */
public interface GameStateRepository {

    /**
     * 覆盖保存牌桌状态
     * @param tableId 牌桌ID
     * @param state   状态记录
     * @param ttl     过期时间
     */
    void save(String tableId, GameStateRecord state, Duration ttl);
}
