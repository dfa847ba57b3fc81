package com.tttarena.gameservice.games.tictactoe.domain.dto;

import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.model.Piece;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * GameStateRecord
 * -------------------------------------------------------
 * 牌桌状态镜像（用于 Redis 持久化）。
 * - board 用 3x3=9 长度的紧凑字符串（'.','X','O'），按行；无棋盘时为 null。
 * -------------------------------------------------------
 */
@Data
public class GameStateRecord {
    /** 牌桌ID（冗余保存） */
    private String tableId;
    /** 棋盘紧凑字符串 */
    private String board;
    /** 排队玩家 id，队首在前 */
    private List<String> queue = new ArrayList<>();
    /** A 座（X）玩家 id */
    private String seatA;
    private String seatAName;
    /** B 座（O）玩家 id */
    private String seatB;
    private String seatBName;
    /** 轮到谁："A"/"B"/"NONE" */
    private String turn;
    /** 状态名 */
    private String status;
    /** 盘号 */
    private long round;
    /** 写入时间（毫秒） */
    private long updatedAt;

    public static GameStateRecord from(String tableId, GameSnapshot s, long now) {
        GameStateRecord rec = new GameStateRecord();
        rec.setTableId(tableId);
        rec.setBoard(compact(s.board));
        for (Player p : s.queue) rec.getQueue().add(p.id());
        if (s.seatA != null) {
            rec.setSeatA(s.seatA.id());
            rec.setSeatAName(s.seatA.name());
        }
        if (s.seatB != null) {
            rec.setSeatB(s.seatB.id());
            rec.setSeatBName(s.seatB.name());
        }
        rec.setTurn(s.turn.name());
        rec.setStatus(s.status.name());
        rec.setRound(s.round);
        rec.setUpdatedAt(now);
        return rec;
    }

    private static String compact(int[][] weights) {
        if (weights == null) return null;
        StringBuilder sb = new StringBuilder(9);
        for (int[] row : weights) {
            for (int w : row) {
                sb.append(w == Piece.MARK_A.weight() ? Piece.MARK_A.symbol()
                        : w == Piece.MARK_B.weight() ? Piece.MARK_B.symbol()
                        : Piece.EMPTY.symbol());
            }
        }
        return sb.toString();
    }
}
