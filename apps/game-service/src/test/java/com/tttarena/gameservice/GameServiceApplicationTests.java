package com.tttarena.gameservice;

import com.tttarena.gameservice.games.tictactoe.application.SinkConfigurer;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.service.TicTacToeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class GameServiceApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private TicTacToeService ticTacToeService;

    @Test
    void contextLoadsWithMirroringDisabled() {
        assertEquals(GameStatus.INSUFFICIENT_PLAYERS, ticTacToeService.status());
        assertTrue(context.getBeansOfType(SinkConfigurer.class).isEmpty());
    }
}
