package com.tttarena.gameservice.games.tictactoe.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** 落子请求 */
@Data
public class MoveRequest {
    @JsonProperty("player_id")
    private String playerId;
    /** 列 */
    @JsonProperty("x_axis")
    private int xAxis;
    /** 行 */
    @JsonProperty("y_axis")
    private int yAxis;
}
