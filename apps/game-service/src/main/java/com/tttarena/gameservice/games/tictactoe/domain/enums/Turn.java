package com.tttarena.gameservice.games.tictactoe.domain.enums;

/** 当前轮到谁：A / B / 无人 */
public enum Turn {
    A("X"),
    B("O"),
    NONE(null);

    /** 对外显示的执子标记，NONE 为 null */
    private final String mark;

    Turn(String mark) {
        this.mark = mark;
    }

    public String mark() {
        return mark;
    }

    /** NONE 返回 null */
    public Seat seat() {
        switch (this) {
            case A: return Seat.A;
            case B: return Seat.B;
            default: return null;
        }
    }
}
