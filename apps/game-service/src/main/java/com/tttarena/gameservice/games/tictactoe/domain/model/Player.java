package com.tttarena.gameservice.games.tictactoe.domain.model;

/**
 * 玩家：身份只认 id，name 可为空，仅作展示。
 */
public record Player(String id, String name) {

    public static Player of(String id) {
        return new Player(id, null);
    }

    /** 同一玩家（按 id 比较，忽略 name） */
    public boolean sameAs(String otherId) {
        return id != null && id.equals(otherId);
    }
}
