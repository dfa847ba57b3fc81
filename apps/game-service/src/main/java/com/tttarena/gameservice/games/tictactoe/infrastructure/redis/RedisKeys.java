package com.tttarena.gameservice.games.tictactoe.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "tictactoe:";

    private RedisKeys() {}

    // ---- 牌桌状态镜像 ----
    public static String tableState(String tableId) {
        return PFX + "table:" + tableId + ":state";
    }
}
