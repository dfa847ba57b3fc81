package com.tttarena.gameservice.common;

import com.tttarena.gameservice.games.tictactoe.domain.exception.AlreadyRegisteredException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.InvalidStateTransitionException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.PlayerNotFoundException;
import com.tttarena.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 非法落子（未轮到、格子已占、不在对局中）。
     * @return HTTP 400
     */
    @ExceptionHandler(InvalidMoveException.class)
    public ResponseEntity<ApiResponse<Object>> invalidMove(InvalidMoveException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 找不到玩家。
     * @return HTTP 404
     */
    @ExceptionHandler(PlayerNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> playerNotFound(PlayerNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    /**
     * 重复加入、状态推进时机错误。
     * @return HTTP 409
     */
    @ExceptionHandler({AlreadyRegisteredException.class, InvalidStateTransitionException.class})
    public ResponseEntity<ApiResponse<Object>> conflict(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 请求体无法解析或参数不合法。
     * @return HTTP 400
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiResponse<Object>> badRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }
}
