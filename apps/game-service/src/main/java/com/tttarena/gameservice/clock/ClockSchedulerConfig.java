package com.tttarena.gameservice.clock;

import com.tttarena.gameservice.platform.config.TableProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 回合计时线程池配置。
 *
 * 功能说明：
 * 1. 核心线程数取自 tictactoe.scheduler.core-pool-size；
 * 2. 线程命名为 countdown-N，便于调试；
 * 3. 守护线程，JVM 退出时自动结束；
 * 4. 拒绝策略 DiscardPolicy（关闭后提交的任务直接丢弃）；
 * 5. setRemoveOnCancelPolicy(true)，每步落子都会取消旧任务，需及时清出队列。
 */
@Configuration
public class ClockSchedulerConfig {

    @Bean(name = "turnClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor turnClockScheduler(TableProperties props) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "countdown-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                props.getScheduler().getCorePoolSize(), tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
