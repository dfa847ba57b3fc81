package com.tttarena.gameservice.games.tictactoe.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 牌桌只读快照（棋盘、队列、座位、执子方、状态）。
 * board 为 null 表示 NO_BOARD；否则 board[y][x] 为棋子权重。
 * move 输出 "X"/"O"，无人执子时省略。
 */
public final class GameSnapshot {

    @JsonProperty("board")
    public final int[][] board;
    @JsonProperty("queue")
    public final List<Player> queue;
    @JsonProperty("player_x")
    public final Player seatA;
    @JsonProperty("player_o")
    public final Player seatB;
    @JsonIgnore
    public final Turn turn;
    @JsonProperty("status")
    public final GameStatus status;
    @JsonProperty("round")
    public final long round;

    public GameSnapshot(int[][] board,
                        List<Player> queue,
                        Player seatA,
                        Player seatB,
                        Turn turn,
                        GameStatus status,
                        long round) {
        this.board = board;
        this.queue = queue == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(queue));
        this.seatA = seatA;
        this.seatB = seatB;
        this.turn = turn;
        this.status = status;
        this.round = round;
    }

    @JsonProperty("move")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String move() {
        return turn == null ? null : turn.mark();
    }

    /** 在持锁状态下调用，拷贝出不可变快照 */
    public static GameSnapshot of(Table t) {
        return new GameSnapshot(
                t.getBoard() == null ? null : t.getBoard().weights(),
                new ArrayList<>(t.getQueue()),
                t.getSeatA(),
                t.getSeatB(),
                t.getTurn(),
                t.getStatus(),
                t.getRound());
    }
}
