package com.tttarena.gameservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 牌桌相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖（如 TICTACTOE_TURN_TIMEOUT=10s）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "tictactoe")
public class TableProperties {

    /** 牌桌标识，用作计时器业务键与持久化键 */
    private String tableId = "main";

    /** 单步限时，到期自动代走 */
    private Duration turnTimeout = Duration.ofSeconds(5);

    /** 终局后保留棋盘的时长，之后换人开下一盘 */
    private Duration roundGraceDelay = Duration.ofSeconds(3);

    private Scheduler scheduler = new Scheduler();

    private Persistence persistence = new Persistence();

    private Cors cors = new Cors();

    @Data
    public static class Scheduler {
        /** 回合计时线程池核心线程数 */
        private int corePoolSize = 2;
        /** 状态通知队列容量，满了丢弃最旧的通知 */
        private int notifyQueueCapacity = 64;
    }

    @Data
    public static class Persistence {
        /** 是否在启动后把 Redis 作为状态镜像 */
        private boolean enabled = false;
        /** 状态镜像过期时间 */
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Cors {
        /** 允许跨域访问 /api/** 的来源 */
        private List<String> allowedOrigins = List.of("*");
    }
}
