package com.tttarena.gameservice.games.tictactoe.domain.exception;

/** 该 id 已入座或已在队列中 */
public class AlreadyRegisteredException extends GameException {

    private final String playerId;

    public AlreadyRegisteredException(String playerId, String message) {
        super(message);
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }
}
