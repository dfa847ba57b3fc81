package com.tttarena.gameservice.games.tictactoe.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 牌桌状态：任一时刻只有一个值成立。
 * 由 {@link com.tttarena.gameservice.games.tictactoe.domain.rule.TicTacToeJudge} 根据座位与棋盘计算得出。
 * JSON 中使用 wire 名（如 "InProgress"）。
 */
public enum GameStatus {
    /** 至少有一个座位为空（优先于棋盘判定） */
    INSUFFICIENT_PLAYERS("InsufficientPlayers"),
    /** 座位齐全但没有棋盘 */
    NO_BOARD("NoBoard"),
    /** A 方三连 */
    A_WINS("XWins"),
    /** B 方三连 */
    B_WINS("OWins"),
    /** 棋盘下满且无人三连 */
    DRAW("Cats"),
    /** 对局中（允许落子） */
    IN_PROGRESS("InProgress");

    private final String wire;

    GameStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** 终局：触发换人推进 */
    public boolean terminal() {
        return this == A_WINS || this == B_WINS || this == DRAW;
    }
}
