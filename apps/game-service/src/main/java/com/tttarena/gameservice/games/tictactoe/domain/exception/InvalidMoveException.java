package com.tttarena.gameservice.games.tictactoe.domain.exception;

import com.tttarena.gameservice.games.tictactoe.domain.constants.GameMessages;

/** 未轮到、格子已占、坐标越界，或不在对局中 */
public class InvalidMoveException extends GameException {

    public InvalidMoveException() {
        super(GameMessages.INVALID_MOVE);
    }
}
