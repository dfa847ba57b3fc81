package com.tttarena.gameservice.games.tictactoe.domain.model;

import com.tttarena.gameservice.clock.scheduler.CountdownScheduler;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Seat;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Turn;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * 牌桌实体：棋盘、排队队列、A/B 两个座位、轮到谁、状态。
 * 不做线程同步，由服务层持有的锁保护；回合计时器与待执行的换人任务随牌桌一起创建和丢弃。
 */
@Getter
@Setter
public class Table {

    // ---- 棋盘（为 null 时状态为 NO_BOARD）----
    private Board board = new Board();

    // ---- 排队（FIFO，不含已入座玩家）----
    private final Deque<Player> queue = new ArrayDeque<>();

    // ---- 座位 ----
    private Player seatA;
    private Player seatB;

    private Turn turn = Turn.NONE;
    private GameStatus status = GameStatus.INSUFFICIENT_PLAYERS;

    /** 单步限时 */
    private final Duration turnTimeout;

    /** 盘号：每次换人推进/移除入座玩家都会自增，用于识别过期的延迟任务 */
    private long round;

    /** 本桌的回合计时器 */
    private final CountdownScheduler watchdog;

    /** 终局后延迟执行的换人任务（方便取消） */
    private volatile ScheduledFuture<?> pendingAdvance;

    public Table(Duration turnTimeout, CountdownScheduler watchdog) {
        this.turnTimeout = turnTimeout;
        this.watchdog = watchdog;
    }

    public Player seat(Seat seat) {
        return seat == Seat.A ? seatA : seatB;
    }

    public void seat(Seat seat, Player player) {
        if (seat == Seat.A) seatA = player; else seatB = player;
    }

    public boolean bothSeated() {
        return seatA != null && seatB != null;
    }

    /** 该 id 所在座位；不在座位上返回 empty */
    public Optional<Seat> seatOf(String playerId) {
        if (seatA != null && seatA.sameAs(playerId)) return Optional.of(Seat.A);
        if (seatB != null && seatB.sameAs(playerId)) return Optional.of(Seat.B);
        return Optional.empty();
    }

    public boolean queued(String playerId) {
        for (Player p : queue) {
            if (p.sameAs(playerId)) return true;
        }
        return false;
    }

    /**
     * 轮换队列：先把离座玩家放到队尾，再弹出队首。
     * 先入后出保证刚被淘汰的玩家排在所有等待者之后。
     * @param outgoing 离座玩家，可为 null
     * @return 下一个入座的玩家，队列为空时返回 null
     */
    public Player advanceQueue(Player outgoing) {
        if (outgoing != null) queue.addLast(outgoing);
        return queue.pollFirst();
    }

    /** 从队列中摘除，保持其余顺序 */
    public boolean dequeue(String playerId) {
        Iterator<Player> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().sameAs(playerId)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /** 用新记录替换队列中同 id 的玩家，位置不变 */
    public boolean replaceQueued(Player player) {
        boolean found = false;
        Deque<Player> rebuilt = new ArrayDeque<>(queue.size());
        for (Player p : queue) {
            if (!found && p.sameAs(player.id())) {
                rebuilt.addLast(player);
                found = true;
            } else {
                rebuilt.addLast(p);
            }
        }
        if (found) {
            queue.clear();
            queue.addAll(rebuilt);
        }
        return found;
    }

    public void clearBoard() {
        board = new Board();
    }

    /** 自增盘号并返回新值 */
    public long nextRound() {
        return ++round;
    }
}
