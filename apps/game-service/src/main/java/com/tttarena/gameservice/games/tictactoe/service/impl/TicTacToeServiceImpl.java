package com.tttarena.gameservice.games.tictactoe.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tttarena.gameservice.clock.scheduler.CountdownSchedulerImpl;
import com.tttarena.gameservice.games.tictactoe.application.GameStateSink;
import com.tttarena.gameservice.games.tictactoe.application.StateChangePublisher;
import com.tttarena.gameservice.games.tictactoe.domain.constants.GameMessages;
import com.tttarena.gameservice.games.tictactoe.domain.enums.GameStatus;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Seat;
import com.tttarena.gameservice.games.tictactoe.domain.enums.Turn;
import com.tttarena.gameservice.games.tictactoe.domain.exception.AlreadyRegisteredException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.GameException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.InvalidMoveException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.InvalidStateTransitionException;
import com.tttarena.gameservice.games.tictactoe.domain.exception.PlayerNotFoundException;
import com.tttarena.gameservice.games.tictactoe.domain.model.Board;
import com.tttarena.gameservice.games.tictactoe.domain.model.GameSnapshot;
import com.tttarena.gameservice.games.tictactoe.domain.model.Player;
import com.tttarena.gameservice.games.tictactoe.domain.model.Table;
import com.tttarena.gameservice.games.tictactoe.domain.rule.TicTacToeJudge;
import com.tttarena.gameservice.games.tictactoe.service.TicTacToeService;
import com.tttarena.gameservice.platform.config.TableProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;


@Slf4j
@Service
public class TicTacToeServiceImpl implements TicTacToeService {

    // 唯一的互斥域：玩家操作、超时代走、延迟换人都在这把锁下修改牌桌
    private final ReentrantLock lock = new ReentrantLock();

    private final TableProperties props;
    private final ScheduledExecutorService clockScheduler;
    private final ScheduledExecutorService roundScheduler;
    private final StateChangePublisher publisher;
    private final Random drawRandom;
    private final ObjectMapper objectMapper;

    // 当前牌桌（reset 时整体替换）
    private Table table;

    public TicTacToeServiceImpl(TableProperties props,
                                @Qualifier("turnClockScheduler") ScheduledExecutorService clockScheduler,
                                @Qualifier("roundScheduler") ScheduledExecutorService roundScheduler,
                                StateChangePublisher publisher,
                                @Qualifier("drawRandom") Random drawRandom,
                                ObjectMapper objectMapper) {
        this.props = props;
        this.clockScheduler = clockScheduler;
        this.roundScheduler = roundScheduler;
        this.publisher = publisher;
        this.drawRandom = drawRandom;
        this.objectMapper = objectMapper;
        this.table = newTable();
    }

    // ====================== 玩家 ======================

    /**
     * 加入牌桌：A 空坐 A，否则 B 空坐 B，否则排队。凑齐两人即开局。
     */
    @Override
    public Player addPlayer(Player player) {
        // 未带 id 时生成
        Player p = (player.id() == null || player.id().isBlank())
                ? new Player(UUID.randomUUID().toString(), player.name())
                : player;
        lock.lock();
        try {
            Table t = table;
            if (t.queued(p.id())) {
                log.warn("玩家已在队列中: playerId={}", p.id());
                throw new AlreadyRegisteredException(p.id(), GameMessages.ALREADY_QUEUED);
            }
            if (t.seatOf(p.id()).isPresent()) {
                log.warn("玩家已在座位上: playerId={}", p.id());
                throw new AlreadyRegisteredException(p.id(), GameMessages.ALREADY_PLAYING);
            }

            if (t.getSeatA() == null) {
                seatPlayer(t, Seat.A, p);
            } else if (t.getSeatB() == null) {
                seatPlayer(t, Seat.B, p);
            } else {
                t.getQueue().addLast(p);
                log.info("玩家进入队列: playerId={}, position={}", p.id(), t.getQueue().size());
            }
            publish(t);
            return p;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按 A → B → 队列 的顺序查找并原位替换玩家资料。
     */
    @Override
    public void updatePlayer(Player player) {
        lock.lock();
        try {
            Table t = table;
            Optional<Seat> seat = t.seatOf(player.id());
            if (seat.isPresent()) {
                t.seat(seat.get(), player);
                log.info("更新座位玩家: seat={}, playerId={}, name={}", seat.get(), player.id(), player.name());
            } else if (t.replaceQueued(player)) {
                log.info("更新排队玩家: playerId={}, name={}", player.id(), player.name());
            } else {
                log.warn("更新失败，找不到玩家: playerId={}", player.id());
                throw new PlayerNotFoundException(player.id());
            }
            publish(t);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 入座玩家：离座、清盘，立即从队首补位；排队玩家：出队，其余顺序不变。
     */
    @Override
    public void removePlayer(String playerId) {
        lock.lock();
        try {
            Table t = table;
            Optional<Seat> seat = t.seatOf(playerId);
            if (seat.isPresent()) {
                t.seat(seat.get(), null);
                t.clearBoard();
                log.info("玩家离座: seat={}, playerId={}", seat.get(), playerId);
                // 视为对局被中断：只补空座，不按胜负换人
                advanceFrom(t, GameStatus.IN_PROGRESS);
                return;
            }
            if (!t.dequeue(playerId)) {
                log.warn("移除失败，玩家不在座位也不在队列: playerId={}", playerId);
                throw new PlayerNotFoundException(playerId);
            }
            log.info("玩家离开队列: playerId={}", playerId);
            publish(t);
        } finally {
            lock.unlock();
        }
    }

    // ====================== 落子 ======================

    @Override
    public void placeMove(String playerId, int x, int y) {
        lock.lock();
        try {
            placeLocked(table, playerId, x, y);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 落子主体（调用方持锁）。人工落子与超时代走共用这一条路径。
     */
    private void placeLocked(Table t, String playerId, int x, int y) {
        GameStatus status = t.getStatus();
        // 只有对局中可以落子
        if (status != GameStatus.IN_PROGRESS) {
            log.warn("非对局中，拒绝落子: playerId={}, x={}, y={}, status={}", playerId, x, y, status);
            throw new InvalidMoveException();
        }
        // 回合锁：必须是当前执子方
        Seat mover = t.getTurn().seat();
        Player expected = mover == null ? null : t.seat(mover);
        if (expected == null || !expected.sameAs(playerId)) {
            log.warn("未轮到该玩家: playerId={}, x={}, y={}, turn={}", playerId, x, y, t.getTurn());
            throw new InvalidMoveException();
        }
        Board b = t.getBoard();
        if (!b.inBounds(x, y)) {
            log.warn("坐标越界: playerId={}, x={}, y={}", playerId, x, y);
            throw new InvalidMoveException();
        }
        if (!b.isEmpty(x, y)) {
            log.warn("格子已被占用: playerId={}, x={}, y={}", playerId, x, y);
            throw new InvalidMoveException();
        }

        b.place(x, y, mover.piece());
        t.setTurn(mover.opponent().turn());
        refreshStatus(t);
        log.info("落子: seat={}, playerId={}, x={}, y={}, status={}", mover, playerId, x, y, t.getStatus());

        if (t.getStatus().terminal()) {
            // 本盘结束：停表，换人时再重新计时
            t.getWatchdog().stop();
            scheduleAdvance(t);
        } else {
            // 对手拿到完整的一步时限
            t.getWatchdog().reset();
        }
        publish(t);
    }

    // ====================== 换人推进 ======================

    @Override
    public void advance() {
        lock.lock();
        try {
            Table t = table;
            advanceFrom(t, t.getStatus());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按给定状态推进牌桌（调用方持锁）。
     * <pre>
     * A_WINS               → B 先走，B 座换人（A 留座），清盘
     * B_WINS               → A 先走，A 座换人（B 留座），清盘
     * DRAW                 → 抛硬币选出输家换人，新上座一方先走，清盘
     * IN_PROGRESS          → 空座从队首补位
     * INSUFFICIENT_PLAYERS → 不变
     * </pre>
     */
    private void advanceFrom(Table t, GameStatus from) {
        switch (from) {
            case A_WINS:
                rotateLoser(t, Seat.B);
                break;
            case B_WINS:
                rotateLoser(t, Seat.A);
                break;
            case DRAW:
                // 不加权的 50/50
                rotateLoser(t, drawRandom.nextBoolean() ? Seat.B : Seat.A);
                break;
            case IN_PROGRESS:
                // 有人离座：补空座
                if (t.getSeatA() == null) t.setSeatA(t.advanceQueue(null));
                if (t.getSeatB() == null) t.setSeatB(t.advanceQueue(null));
                // 补不满时由留下的一方先走，与首次入座一致
                if (t.getSeatA() == null || t.getSeatB() == null) {
                    t.setTurn(t.getSeatA() != null ? Turn.A : t.getSeatB() != null ? Turn.B : Turn.NONE);
                }
                break;
            case INSUFFICIENT_PLAYERS:
                break;
            default:
                log.warn("当前状态不能推进: status={}, snapshot={}", from, describe(t));
                throw new InvalidStateTransitionException(from);
        }

        long round = t.nextRound();
        cancelPendingAdvance(t);
        t.getWatchdog().stop();
        if (t.bothSeated()) {
            if (t.getTurn() == Turn.NONE) t.setTurn(Turn.A);
            startWatchdog(t);
        }
        refreshStatus(t);
        log.info("牌桌推进: from={}, round={}, seatA={}, seatB={}, queued={}, status={}",
                from, round, idOf(t.getSeatA()), idOf(t.getSeatB()), t.getQueue().size(), t.getStatus());
        publish(t);
    }

    /**
     * 输家回到队尾、队首上座，新上座一方先走。
     */
    private void rotateLoser(Table t, Seat loser) {
        t.setTurn(loser.turn());
        t.clearBoard();
        t.seat(loser, t.advanceQueue(t.seat(loser)));
    }

    /**
     * 终局后延迟换人，让观察者先看到终局棋盘。
     */
    private void scheduleAdvance(Table t) {
        long round = t.getRound();
        Duration grace = props.getRoundGraceDelay();
        log.info("本盘结束: status={}, round={}, {} 后换人", t.getStatus(), round, grace);
        cancelPendingAdvance(t);
        t.setPendingAdvance(roundScheduler.schedule(
                () -> advanceIfCurrent(t, round), grace.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * 延迟换人任务：牌桌已被重置或已被其他推进抢先时不做任何事。
     */
    private void advanceIfCurrent(Table t, long round) {
        lock.lock();
        try {
            if (table != t || t.getRound() != round) {
                log.debug("延迟换人已过期，忽略: round={}, currentRound={}", round, t.getRound());
                return;
            }
            advanceFrom(t, t.getStatus());
        } catch (GameException e) {
            log.error("延迟换人失败: round={}, status={}", round, t.getStatus(), e);
        } finally {
            lock.unlock();
        }
    }

    private void cancelPendingAdvance(Table t) {
        ScheduledFuture<?> f = t.getPendingAdvance();
        t.setPendingAdvance(null);
        if (f != null) f.cancel(false);
    }

    // ====================== 回合计时 ======================

    private void startWatchdog(Table t) {
        t.getWatchdog().start(t.getTurnTimeout(), (key, version) -> onTurnTimeout(t, version));
    }

    /**
     * 计时器到期回调：与人工落子抢同一把锁，版本过期（期间有人落子/停表/重置）则忽略。
     */
    private void onTurnTimeout(Table t, long version) {
        lock.lock();
        try {
            if (table != t || !t.getWatchdog().isCurrent(version)) {
                log.debug("过期的回合到期回调，忽略: version={}", version);
                return;
            }
            autoMove(t);
        } finally {
            lock.unlock();
        }
    }

    /** 立即为当前执子方代走一步（测试入口） */
    void autoMove() {
        lock.lock();
        try {
            autoMove(table);
        } finally {
            lock.unlock();
        }
    }

    /** 回合计时是否在运行（测试入口） */
    boolean turnClockRunning() {
        lock.lock();
        try {
            return table.getWatchdog().isRunning();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 超时代走：从左到右、从上到下的第一个空位。
     * 找不到执子方或没有空位时只记录日志。
     */
    private void autoMove(Table t) {
        Seat mover = t.getStatus() == GameStatus.IN_PROGRESS ? t.getTurn().seat() : null;
        Player p = mover == null ? null : t.seat(mover);
        if (p == null) {
            log.error("无法自动落子：找不到当前执子玩家: status={}, turn={}", t.getStatus(), t.getTurn());
            return;
        }
        int[] cell = t.getBoard() == null ? null : t.getBoard().firstEmpty();
        if (cell == null) {
            log.error("无法自动落子：棋盘没有空位: playerId={}", p.id());
            return;
        }
        log.info("超时代走: seat={}, playerId={}, x={}, y={}", mover, p.id(), cell[0], cell[1]);
        try {
            placeLocked(t, p.id(), cell[0], cell[1]);
        } catch (GameException e) {
            log.error("超时代走失败: playerId={}, x={}, y={}", p.id(), cell[0], cell[1], e);
        }
    }

    // ====================== 重置 / 查询 ======================

    @Override
    public void reset() {
        lock.lock();
        try {
            Table old = table;
            old.getWatchdog().stop();
            cancelPendingAdvance(old);
            table = newTable();
            log.info("牌桌已重置");
            publish(table);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GameStatus status() {
        lock.lock();
        try {
            return table.getStatus();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GameSnapshot snapshot() {
        lock.lock();
        try {
            return GameSnapshot.of(table);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toJson() {
        try {
            return objectMapper.writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("牌桌快照序列化失败", e);
        }
    }

    /**
     * 配置镜像后立即推送一份当前状态。
     */
    @Override
    public void configureSink(GameStateSink sink) {
        lock.lock();
        try {
            publisher.configure(sink);
            publish(table);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            table.getWatchdog().stop();
            cancelPendingAdvance(table);
        } finally {
            lock.unlock();
        }
    }

    // ====================== private helpers ======================

    private Table newTable() {
        return new Table(props.getTurnTimeout(),
                new CountdownSchedulerImpl(clockScheduler, "tictactoe:" + props.getTableId()));
    }

    /**
     * 入座；另一座为空时由本座先走，否则凑齐开局。
     */
    private void seatPlayer(Table t, Seat seat, Player p) {
        t.seat(seat, p);
        log.info("玩家入座: seat={}, playerId={}", seat, p.id());
        if (t.seat(seat.opponent()) == null) {
            t.setTurn(seat.turn());
            refreshStatus(t);
            return;
        }
        if (t.getTurn() == Turn.NONE) t.setTurn(Turn.A);
        refreshStatus(t);
        log.info("开局: seatA={}, seatB={}, turn={}, status={}",
                idOf(t.getSeatA()), idOf(t.getSeatB()), t.getTurn(), t.getStatus());
        startWatchdog(t);
    }

    private void refreshStatus(Table t) {
        t.setStatus(TicTacToeJudge.evaluate(t.getBoard(), t.getSeatA(), t.getSeatB()));
    }

    private void publish(Table t) {
        publisher.publish(GameSnapshot.of(t));
    }

    private String describe(Table t) {
        return "board=" + t.getBoard() + ", turn=" + t.getTurn() + ", round=" + t.getRound();
    }

    private static String idOf(Player p) {
        return p == null ? null : p.id();
    }
}
