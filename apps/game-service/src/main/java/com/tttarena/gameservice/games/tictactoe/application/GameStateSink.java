package com.tttarena.gameservice.games.tictactoe.application;

import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;

/**
 * 牌桌状态的外部镜像（持久化/推送）。每次状态变更后收到一份完整快照。
 * 在通知线程上调用，实现可以慢，但不应假设与牌桌操作同步。
 */
@FunctionalInterface
public interface GameStateSink {

    void onStateChanged(GameSnapshot snapshot);
}
