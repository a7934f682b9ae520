package com.quantbacktest.factorbacktester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis wiring for the shared snapshot cache. Only active with {@code backtest.replay.cache-type=redis}.
 */
@Configuration
@ConditionalOnProperty(prefix = "backtest.replay", name = "cache-type", havingValue = "redis")
public class RedisConfig {

        @Bean
        public RedisTemplate<String, DataSnapshot> snapshotRedisTemplate(RedisConnectionFactory connectionFactory,
                        ObjectMapper objectMapper) {
                RedisTemplate<String, DataSnapshot> template = new RedisTemplate<>();
                template.setConnectionFactory(connectionFactory);

                // Use String serializer for keys
                template.setKeySerializer(new StringRedisSerializer());

                // Snapshots as plain JSON, read back with the application's ObjectMapper
                template.setValueSerializer(new Jackson2JsonRedisSerializer<>(objectMapper, DataSnapshot.class));

                template.afterPropertiesSet();
                return template;
        }
}
