package com.tttarena.gameservice.games.tictactoe.application;

import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Turn;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StateChangePublisherTest {

    @Mock
    private GameStateSink sink;

    private ExecutorService executor;
    private StateChangePublisher publisher;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        publisher = new StateChangePublisher(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static GameSnapshot snapshot(long round) {
        return new GameSnapshot(new int[3][3], List.of(), null, null, Turn.NONE,
                GameStatus.INSUFFICIENT_PLAYERS, round);
    }

    @Test
    void dropsNotificationsUntilConfigured() {
        publisher.publish(snapshot(0));

        publisher.configure(sink);
        GameSnapshot s = snapshot(1);
        publisher.publish(s);

        verify(sink, timeout(1000)).onStateChanged(s);
        verifyNoMoreInteractions(sink);
    }

    @Test
    void sinkFailureIsContained() {
        doThrow(new IllegalStateException("redis down"))
                .doNothing()
                .when(sink).onStateChanged(any());
        publisher.configure(sink);

        assertDoesNotThrow(() -> publisher.publish(snapshot(1)));
        publisher.publish(snapshot(2));

        verify(sink, timeout(1000).times(2)).onStateChanged(any());
    }

    @Test
    void publishAfterShutdownIsIgnored() {
        publisher.configure(sink);
        executor.shutdown();

        assertDoesNotThrow(() -> publisher.publish(snapshot(1)));
        verifyNoInteractions(sink);
    }

    @Test
    void configuringNullDisablesMirroring() throws InterruptedException {
        publisher.configure(sink);
        publisher.configure(null);

        publisher.publish(snapshot(1));
        Thread.sleep(100);

        verifyNoInteractions(sink);
    }
}
