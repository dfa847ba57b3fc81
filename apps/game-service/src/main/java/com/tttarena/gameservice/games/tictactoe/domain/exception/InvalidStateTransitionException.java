package com.tttarena.gameservice.games.tictactoe.domain.exception;

import com.tttarena.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;

/**
 * 在不允许推进的状态下调用了换人推进。
 * 属于调用时机错误，而非玩家操作错误。
 */
public class InvalidStateTransitionException extends GameException {

    private final GameStatus status;

    public InvalidStateTransitionException(GameStatus status) {
        super(GameMessages.formatInvalidTransition(status));
        this.status = status;
    }

    public GameStatus getStatus() {
        return status;
    }
}
