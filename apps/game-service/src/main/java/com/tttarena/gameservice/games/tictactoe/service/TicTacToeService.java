package com.tttarena.gameservice.games.tictactoe.service;

import com.tttarena.gameservice.games.tictactoe.application.GameStateSink;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.model.Move;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;

/**
 * 轮换井字棋牌桌：赢家留座，输家回到队尾，和棋随机淘汰一方，超时自动代走。
 * 所有操作互斥执行；失败时抛出 {@link com.tttarena.gameservice.games.tictactoe.domain.exception.GameException}
 * 的子类，且牌桌状态不变。
 */
public interface TicTacToeService {

    /**
     * 加入牌桌：先坐 A，再坐 B，都满后排到队尾。
     * @param player 玩家；id 为空时自动生成
     * @return 实际登记的玩家（含生成的 id）
     */
    Player addPlayer(Player player);

    /**
     * 按 id 更新玩家资料（依次查找 A、B、队列），原位替换。
     */
    void updatePlayer(Player player);

    /**
     * 移除玩家：入座玩家离座后清盘并立即从队首补位；排队玩家直接出队。
     */
    void removePlayer(String playerId);

    /**
     * 落子：仅在对局中、轮到该玩家、格子为空时有效。
     * @param x 列（0-2）
     * @param y 行（0-2）
     */
    void placeMove(String playerId, int x, int y);

    default void place(Move move) {
        placeMove(move.playerId(), move.x(), move.y());
    }

    /**
     * 推进到下一盘（终局换人 / 对局中补空座）。
     */
    void advance();

    /**
     * 清空牌桌，回到刚创建时的状态。
     */
    void reset();

    GameStatus status();

    /** 完整牌桌快照 */
    GameSnapshot snapshot();

    /** 快照的 JSON 表示 */
    String toJson();

    /**
     * 配置状态镜像；配置前的状态变更不会被镜像。
     */
    void configureSink(GameStateSink sink);
}
