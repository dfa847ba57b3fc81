package com.tttarena.gameservice.games.tictactoe.domain.constants;

/**
 * 牌桌相关的错误消息常量
 * 统一管理返回给调用方的提示，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 玩家 ==========

    /** 更新/移除时找不到该玩家 */
    public static final String PLAYER_NOT_FOUND = "player not found";

    /** 已在座位上 */
    public static final String ALREADY_PLAYING = "already playing";

    /** 已在队列中 */
    public static final String ALREADY_QUEUED = "already queued";

    // ========== 落子 ==========

    /** 非法落子（非对局中、未轮到、格子已占、越界） */
    public static final String INVALID_MOVE = "invalid move";

    // ========== 状态推进 ==========

    /** 当前状态不能推进到下一盘 */
    public static final String INVALID_STATE_TRANSITION = "invalid state transition: %s";

    public static String formatInvalidTransition(Object status) {
        return String.format(INVALID_STATE_TRANSITION, status);
    }
}
