package com.tttarena.gameservice.games.tictactoe.domain.exception;

/**
 * 牌桌操作失败的基类。抛出时牌桌状态保持不变。
 */
public abstract class GameException extends RuntimeException {

    protected GameException(String message) {
        super(message);
    }
}
