package com.tttarena.gameservice.games.tictactoe.infrastructure.redis.repo;

import com.tttarena.gameservice.games.tictactoe.domain.dto.GameStateRecord;
import com.tttarena.gameservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisGameStateRepositoryTest {

    @Mock
    private RedisOps ops;

    @InjectMocks
    private RedisGameStateRepository repository;

    @Test
    void saveWritesUnderTableKeyWithTtl() {
        GameStateRecord rec = new GameStateRecord();

        repository.save("main", rec, Duration.ofHours(1));

        verify(ops).setEx("tictactoe:table:main:state", rec, Duration.ofHours(1));
    }

    @Test
    void eachTableHasItsOwnKey() {
        GameStateRecord rec = new GameStateRecord();

        repository.save("t2", rec, Duration.ofMinutes(5));

        verify(ops).setEx("tictactoe:table:t2:state", rec, Duration.ofMinutes(5));
    }
}
