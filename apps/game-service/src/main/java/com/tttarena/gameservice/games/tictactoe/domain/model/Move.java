package com.tttarena.gameservice.games.tictactoe.domain.model;

/**
 * 一步棋：playerId 在 (x,y) 落子。x 为列，y 为行，取值 0-2。
 */
public record Move(String playerId, int x, int y) {
}
