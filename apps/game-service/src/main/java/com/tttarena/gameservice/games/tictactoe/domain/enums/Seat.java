package com.tttarena.gameservice.games.tictactoe.domain.enums;

import com.tttarena.gameservice.games.tictactoe.domain.model.Piece;

/** 两个座位：A 执 X（-1），B 执 O（+1） */
public enum Seat {
    A,
    B;

    public Seat opponent() {
        return this == A ? B : A;
    }

    public Piece piece() {
        return this == A ? Piece.MARK_A : Piece.MARK_B;
    }

    public Turn turn() {
        return this == A ? Turn.A : Turn.B;
    }
}
