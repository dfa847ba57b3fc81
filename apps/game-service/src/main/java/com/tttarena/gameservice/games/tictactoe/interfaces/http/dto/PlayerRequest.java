package com.tttarena.gameservice.games.tictactoe.interfaces.http.dto;

import lombok.Data;

/** 加入/更新/离开请求；加入时 id 可省略 */
@Data
public class PlayerRequest {
    private String id;
    private String name;
}
