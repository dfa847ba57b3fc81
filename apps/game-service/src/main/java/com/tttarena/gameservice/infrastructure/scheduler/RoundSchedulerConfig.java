package com.tttarena.gameservice.infrastructure.scheduler;

import com.tttarena.gameservice.platform.config.TableProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 换人推进与状态通知的线程池，与回合计时的调度器分开，避免相互影响计时的准确性。
 */
@Configuration
public class RoundSchedulerConfig {

	/** 终局后延迟换人 */
	@Bean(name = "roundScheduler", destroyMethod = "shutdownNow")
	public ScheduledExecutorService roundScheduler() {
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, daemon("round-advance-"));
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}

	/**
	 * 状态变更通知：单线程顺序投递，有界队列，满了丢弃最旧的一条，调用方永不阻塞。
	 */
	@Bean(name = "stateNotifyExecutor", destroyMethod = "shutdown")
	public ExecutorService stateNotifyExecutor(TableProperties props) {
		return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
				new ArrayBlockingQueue<>(props.getScheduler().getNotifyQueueCapacity()),
				daemon("state-notify-"),
				new ThreadPoolExecutor.DiscardOldestPolicy());
	}

	/** 和棋时抛硬币用 */
	@Bean("drawRandom")
	public Random drawRandom() {
		return new SecureRandom();
	}

	private static ThreadFactory daemon(String prefix) {
		return new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, prefix + idx.getAndIncrement());
				t.setDaemon(true);
				return t;
			}
		};
	}
}
