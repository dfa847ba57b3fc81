package com.tttarena.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 公用 Redis 工具类：
 * - 仅提供“原语级”方法；业务键名放在 RedisKeys / Repo 层组织
 * - 便于在测试中整体替换
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：值以 JSON 存储 */
    private final RedisTemplate<String, Object> redis;

    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }
}
