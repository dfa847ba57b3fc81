package com.tttarena.gameservice.games.tictactoe.domain.rule;

import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.model.Board;
import com.tttarena.gameservice.games.tictactoe.domain.model.Piece;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TicTacToeJudgeTest {

    private static final Player P1 = Player.of("p1");
    private static final Player P2 = Player.of("p2");

    /** 按行描述棋盘：'X'=A，'O'=B，'.'=空 */
    private static Board board(String... rows) {
        Board b = new Board();
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length(); x++) {
                char c = rows[y].charAt(x);
                if (c == 'X') b.place(x, y, Piece.MARK_A);
                if (c == 'O') b.place(x, y, Piece.MARK_B);
            }
        }
        return b;
    }

    @Test
    void emptyBoardWithTwoPlayersIsInProgress() {
        assertEquals(GameStatus.IN_PROGRESS, TicTacToeJudge.evaluate(new Board(), P1, P2));
    }

    @Test
    void missingSeatTakesPrecedenceOverBoard() {
        Board won = board("XXX", "OO.", "...");
        assertEquals(GameStatus.INSUFFICIENT_PLAYERS, TicTacToeJudge.evaluate(won, null, P2));
        assertEquals(GameStatus.INSUFFICIENT_PLAYERS, TicTacToeJudge.evaluate(won, P1, null));
        assertEquals(GameStatus.INSUFFICIENT_PLAYERS, TicTacToeJudge.evaluate(null, null, null));
    }

    @Test
    void absentBoardIsNoBoard() {
        assertEquals(GameStatus.NO_BOARD, TicTacToeJudge.evaluate(null, P1, P2));
    }

    @Test
    void threeMarkAInAnyRowWins() {
        assertEquals(GameStatus.A_WINS, TicTacToeJudge.evaluate(board("XXX", "OO.", "..."), P1, P2));
        assertEquals(GameStatus.A_WINS, TicTacToeJudge.evaluate(board("OO.", "XXX", "..."), P1, P2));
        assertEquals(GameStatus.A_WINS, TicTacToeJudge.evaluate(board("OO.", "...", "XXX"), P1, P2));
    }

    @Test
    void threeMarkBInAnyColumnWins() {
        assertEquals(GameStatus.B_WINS, TicTacToeJudge.evaluate(board("OX.", "OX.", "O.X"), P1, P2));
        assertEquals(GameStatus.B_WINS, TicTacToeJudge.evaluate(board("XO.", "XO.", ".OX"), P1, P2));
        assertEquals(GameStatus.B_WINS, TicTacToeJudge.evaluate(board("X.O", "X.O", ".XO"), P1, P2));
    }

    @Test
    void diagonalsWin() {
        assertEquals(GameStatus.A_WINS, TicTacToeJudge.evaluate(board("XO.", "OX.", "..X"), P1, P2));
        assertEquals(GameStatus.B_WINS, TicTacToeJudge.evaluate(board("XXO", "XO.", "O.."), P1, P2));
    }

    @Test
    void fullBoardWithoutLineIsDraw() {
        // rows [A,B,A],[A,B,B],[B,A,B]
        Board b = board("XOX", "XOO", "OXO");
        assertEquals(GameStatus.DRAW, TicTacToeJudge.evaluate(b, P1, P2));
    }

    @Test
    void fullBoardWithLineIsWinNotDraw() {
        assertEquals(GameStatus.A_WINS, TicTacToeJudge.evaluate(board("XXX", "OOX", "XOO"), P1, P2));
    }

    @Test
    void mixedLineDoesNotWin() {
        assertEquals(GameStatus.IN_PROGRESS, TicTacToeJudge.evaluate(board("XOX", "...", "..."), P1, P2));
    }

    @Test
    void evaluationIsPureAndRepeatable() {
        Board b = board("XO.", ".X.", "O..");
        String before = b.compact();
        GameStatus first = TicTacToeJudge.evaluate(b, P1, P2);
        GameStatus second = TicTacToeJudge.evaluate(b, P1, P2);
        assertEquals(first, second);
        assertEquals(before, b.compact());
    }
}
