package com.tttarena.gameservice.games.tictactoe.domain.exception;

import com.tttarena.gameservice.games.tictactoe.domain.constants.GameMessages;

/** 更新/移除一个既不在座位上也不在队列中的玩家 */
public class PlayerNotFoundException extends GameException {

    private final String playerId;

    public PlayerNotFoundException(String playerId) {
        super(GameMessages.PLAYER_NOT_FOUND);
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }
}
