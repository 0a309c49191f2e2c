package com.example.clipflow.config;

import com.example.clipflow.broadcast.BroadcastChannel;
import com.example.clipflow.broadcast.InMemoryBroadcastChannel;
import com.example.clipflow.broadcast.ProgressCoalescer;
import com.example.clipflow.broadcast.RedisBroadcastChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Selects the broadcast transport. {@code memory} (default) serves a single process;
 * {@code redis} lets workers and gateways run as separate processes.
 */
@Configuration
public class BroadcastConfig {

    private static final Logger log = LoggerFactory.getLogger(BroadcastConfig.class);

    @Bean
    public ProgressCoalescer progressCoalescer() {
        return new ProgressCoalescer();
    }

    @Configuration
    @ConditionalOnProperty(name = "clipflow.broadcast.type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryBroadcastConfig {

        @Bean
        public BroadcastChannel broadcastChannel() {
            log.info("Using in-memory broadcast channel");
            return new InMemoryBroadcastChannel();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "clipflow.broadcast.type", havingValue = "redis")
    static class RedisBroadcastConfig {

        @Bean
        public RedisBroadcastChannel broadcastChannel(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
            log.info("Using Redis broadcast channel on pattern {}", RedisBroadcastChannel.TOPIC_PATTERN);
            return new RedisBroadcastChannel(redisTemplate, objectMapper, new InMemoryBroadcastChannel());
        }

        @Bean
        public RedisMessageListenerContainer progressListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       RedisBroadcastChannel broadcastChannel) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(broadcastChannel, new PatternTopic(RedisBroadcastChannel.TOPIC_PATTERN));
            return container;
        }
    }
}
