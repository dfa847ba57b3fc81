package com.tttarena.gameservice.games.tictactoe.domain.model;

/**
 * 棋子：带符号权重，一条线的权重和为 -3 / +3 即三连。
 * 约定：EMPTY='.'(0), MARK_A='X'(-1), MARK_B='O'(+1)
 */
public enum Piece {
    EMPTY(0, '.'),
    MARK_A(-1, 'X'),
    MARK_B(1, 'O');

    private final int weight;
    private final char symbol;

    Piece(int weight, char symbol) {
        this.weight = weight;
        this.symbol = symbol;
    }

    public int weight() { return weight; }

    public char symbol() { return symbol; }
}
