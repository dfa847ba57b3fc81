package com.tttarena.gameservice.games.tictactoe.domain.rule;

import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.model.Board;
import com.tttarena.gameservice.games.tictactoe.domain.model.Piece;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;

/**
 * 井字棋状态判定。
 * 纯函数：只读棋盘与座位，不修改任何状态，可随时调用。
 * 判定基于带符号权重：一条线的和为 -3 为 A 胜，+3 为 B 胜。
 */
public final class TicTacToeJudge {

    static final int A_LINE = 3 * Piece.MARK_A.weight();
    static final int B_LINE = 3 * Piece.MARK_B.weight();

    private TicTacToeJudge() {}

    /**
     * 根据座位与棋盘计算状态。
     * 顺序：缺人 → 无棋盘 → 行（自上而下） → 列 → 主对角 → 反对角 → 下满和棋 → 对局中。
     */
    public static GameStatus evaluate(Board b, Player seatA, Player seatB) {
        if (seatA == null || seatB == null) return GameStatus.INSUFFICIENT_PLAYERS;
        if (b == null) return GameStatus.NO_BOARD;

        int filled = 0;
        int[] colSums = new int[Board.SIZE];

        for (int y = 0; y < Board.SIZE; y++) {
            int rowSum = 0;
            for (int x = 0; x < Board.SIZE; x++) {
                Piece p = b.get(x, y);
                if (p != Piece.EMPTY) filled++;
                rowSum += p.weight();
                colSums[x] += p.weight();
            }
            GameStatus s = lineResult(rowSum);
            if (s != null) return s;
        }

        for (int sum : colSums) {
            GameStatus s = lineResult(sum);
            if (s != null) return s;
        }

        int diagonal = b.get(0, 0).weight() + b.get(1, 1).weight() + b.get(2, 2).weight();
        GameStatus s = lineResult(diagonal);
        if (s != null) return s;

        diagonal = b.get(2, 0).weight() + b.get(1, 1).weight() + b.get(0, 2).weight();
        s = lineResult(diagonal);
        if (s != null) return s;

        if (filled == Board.SIZE * Board.SIZE) return GameStatus.DRAW;
        return GameStatus.IN_PROGRESS;
    }

    private static GameStatus lineResult(int sum) {
        if (sum == A_LINE) return GameStatus.A_WINS;
        if (sum == B_LINE) return GameStatus.B_WINS;
        return null;
    }
}
