package com.example.clipflow.broadcast;

import com.example.clipflow.events.ProgressEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Cross-process fan-out over Redis pub/sub. Every process publishes to {@code clipflow:progress:<target>}
 * and listens on the pattern; received events are handed to the local listeners. Events published by
 * this process also arrive through Redis, so local listeners see each event exactly once per publish.
 */
public class RedisBroadcastChannel implements BroadcastChannel, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisBroadcastChannel.class);
    public static final String TOPIC_PREFIX = "clipflow:progress:";
    public static final String TOPIC_PATTERN = TOPIC_PREFIX + "*";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final InMemoryBroadcastChannel localDelivery;

    public RedisBroadcastChannel(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                 InMemoryBroadcastChannel localDelivery) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.localDelivery = localDelivery;
    }

    @Override
    public void publish(String channel, ProgressEvent event) {
        try {
            redisTemplate.convertAndSend(TOPIC_PREFIX + channel, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize progress event for channel " + channel, e);
        }
    }

    @Override
    public BroadcastSubscription subscribe(String channel, BroadcastListener listener) {
        return localDelivery.subscribe(channel, listener);
    }

    @Override
    public int subscriberCount(String channel) {
        return localDelivery.subscriberCount(channel);
    }

    @Override
    public void onMessage(@NonNull Message message, @Nullable byte[] pattern) {
        String topic = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!topic.startsWith(TOPIC_PREFIX)) {
            log.warn("Ignoring Redis message on unexpected topic {}", topic);
            return;
        }
        String channel = topic.substring(TOPIC_PREFIX.length());
        try {
            ProgressEvent event = objectMapper.readValue(message.getBody(), ProgressEvent.class);
            localDelivery.publish(channel, event);
        } catch (IOException e) {
            log.error("Dropping malformed progress message on {}: {}", topic, e.getMessage());
        }
    }
}
