package com.tttarena.gameservice.games.tictactoe.interfaces.http;

import com.tttarena.gameservice.games.tictactoe.application.GameStateSink;
import com.tttarena.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Turn;
import com.tttarena.gameservice.games.tictactoe.domain.exception.AlreadyRegisteredException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.PlayerNotFoundException;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;
import com.tttarena.gameservice.games.tictactoe.service.TicTacToeService;
import com.tttarena.gameservice.platform.config.TableProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TicTacToeRestController.class)
@Import(TableProperties.class)
class TicTacToeRestControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TicTacToeService ticTacToeService;

    @MockBean
    private GameStateSink gameStateSink;

    @Test
    void gameReturnsSnapshotWithWireNames() throws Exception {
        when(ticTacToeService.snapshot()).thenReturn(new GameSnapshot(new int[3][3], List.of(Player.of("p3")),
                Player.of("p1"), Player.of("p2"), Turn.A, GameStatus.IN_PROGRESS, 0));

        mvc.perform(get("/api/tictactoe/game"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.player_x.id").value("p1"))
                .andExpect(jsonPath("$.data.player_o.id").value("p2"))
                .andExpect(jsonPath("$.data.queue[0].id").value("p3"))
                .andExpect(jsonPath("$.data.move").value("X"))
                .andExpect(jsonPath("$.data.status").value("InProgress"));
    }

    @Test
    void moveIsForwarded() throws Exception {
        mvc.perform(post("/api/tictactoe/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"player_id\":\"p1\",\"x_axis\":2,\"y_axis\":1}"))
                .andExpect(status().isOk());

        verify(ticTacToeService).placeMove("p1", 2, 1);
    }

    @Test
    void invalidMoveIsBadRequest() throws Exception {
        doThrow(new InvalidMoveException()).when(ticTacToeService).placeMove("p1", 0, 0);

        mvc.perform(post("/api/tictactoe/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"player_id\":\"p1\",\"x_axis\":0,\"y_axis\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("invalid move"));
    }

    @Test
    void subscribeReturnsRegisteredId() throws Exception {
        when(ticTacToeService.addPlayer(any())).thenReturn(new Player("generated", "Alice"));

        mvc.perform(post("/api/tictactoe/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("generated"));
    }

    @Test
    void duplicateSubscribeIsConflict() throws Exception {
        when(ticTacToeService.addPlayer(any()))
                .thenThrow(new AlreadyRegisteredException("p1", GameMessages.ALREADY_PLAYING));

        mvc.perform(post("/api/tictactoe/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"p1\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void unsubscribeUnknownIsNotFound() throws Exception {
        doThrow(new PlayerNotFoundException("nobody")).when(ticTacToeService).removePlayer("nobody");

        mvc.perform(post("/api/tictactoe/unsubscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"nobody\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void updatePlayerIsForwarded() throws Exception {
        mvc.perform(put("/api/tictactoe/player")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"p1\",\"name\":\"Bob\"}"))
                .andExpect(status().isOk());

        verify(ticTacToeService).updatePlayer(new Player("p1", "Bob"));
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/tictactoe/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sinkCanBeEnabledAndDisabledAtRuntime() throws Exception {
        mvc.perform(post("/api/tictactoe/sink"))
                .andExpect(status().isOk());
        verify(ticTacToeService).configureSink(gameStateSink);

        mvc.perform(delete("/api/tictactoe/sink"))
                .andExpect(status().isOk());
        verify(ticTacToeService).configureSink(null);
    }

    @Test
    void crossOriginCallsAreAllowed() throws Exception {
        mvc.perform(options("/api/tictactoe/game")
                        .header("Origin", "http://localhost:3000")
                        .header("Access-Control-Request-Method", "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }
}
