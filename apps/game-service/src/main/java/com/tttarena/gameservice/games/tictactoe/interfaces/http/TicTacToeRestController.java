package com.tttarena.gameservice.games.tictactoe.interfaces.http;

import com.tttarena.gameservice.games.tictactoe.application.GameStateSink;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;
import com.tttarena.gameservice.games.tictactoe.interfaces.http.dto.MoveRequest;
import com.tttarena.gameservice.games.tictactoe.interfaces.http.dto.PlayerRequest;
import com.tttarena.gameservice.games.tictactoe.service.TicTacToeService;
import com.tttarena.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 牌桌 HTTP 接口：只做请求解析与转发，规则全部在 TicTacToeService。
 * 异常由 {@link com.tttarena.gameservice.common.WebExceptionAdvice} 统一映射。
 */
@RestController
@RequestMapping("/api/tictactoe")
@RequiredArgsConstructor
public class TicTacToeRestController {

    private final TicTacToeService ticTacToeService;
    private final GameStateSink gameStateSink;

    /** 当前牌桌完整状态 */
    @GetMapping("/game")
    public ApiResponse<GameSnapshot> game() {
        return ApiResponse.success(ticTacToeService.snapshot());
    }

    /** 落子 */
    @PostMapping("/move")
    public ApiResponse<Void> move(@RequestBody MoveRequest req) {
        ticTacToeService.placeMove(req.getPlayerId(), req.getXAxis(), req.getYAxis());
        return ApiResponse.success();
    }

    /** 加入牌桌，返回登记的玩家 id */
    @PostMapping("/subscribe")
    public ApiResponse<Map<String, String>> subscribe(@RequestBody PlayerRequest req) {
        Player p = ticTacToeService.addPlayer(new Player(req.getId(), req.getName()));
        return ApiResponse.success(Map.of("id", p.id()));
    }

    /** 离开牌桌 */
    @PostMapping("/unsubscribe")
    public ApiResponse<Void> unsubscribe(@RequestBody PlayerRequest req) {
        ticTacToeService.removePlayer(req.getId());
        return ApiResponse.success();
    }

    /** 更新玩家资料 */
    @PutMapping("/player")
    public ApiResponse<Void> updatePlayer(@RequestBody PlayerRequest req) {
        ticTacToeService.updatePlayer(new Player(req.getId(), req.getName()));
        return ApiResponse.success();
    }

    /** 运行时开启状态镜像，并立即写入一份当前状态 */
    @PostMapping("/sink")
    public ApiResponse<Void> enableSink() {
        ticTacToeService.configureSink(gameStateSink);
        return ApiResponse.success();
    }

    /** 关闭状态镜像 */
    @DeleteMapping("/sink")
    public ApiResponse<Void> disableSink() {
        ticTacToeService.configureSink(null);
        return ApiResponse.success();
    }

    /** 清空牌桌 */
    @PostMapping("/reset")
    public ApiResponse<GameSnapshot> reset() {
        ticTacToeService.reset();
        return ApiResponse.success(ticTacToeService.snapshot());
    }
}
