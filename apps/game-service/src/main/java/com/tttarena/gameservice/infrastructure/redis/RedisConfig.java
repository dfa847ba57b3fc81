package com.tttarena.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 序列化配置（通用基础设施层）
 * -------------------------------------------------------
 *  - Key 采用 StringRedisSerializer，保证键名可读；
 *  - Value 使用 GenericJackson2JsonRedisSerializer，携带类型信息，读回时还原为原对象类型。
 * 连接参数走标准的 spring.data.redis.*，连接工厂由 Spring Boot 自动配置（Lettuce），
 * 只有真正读写时才会建立连接。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为任意对象，自动 JSON 序列化）
     *
     * @param factory Spring Data Redis 提供的连接工厂
     * @return RedisTemplate<String, Object> Bean
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }
}
