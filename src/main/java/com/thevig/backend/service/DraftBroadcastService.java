package com.thevig.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thevig.backend.config.AppProperties;
import com.thevig.backend.dto.events.DraftEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes draft changes on Redis Pub/Sub for the live standings broadcast.
 * Channel is the configured prefix plus the event type, e.g. {@code draft:pick_made}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftBroadcastService {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public void publish(DraftEvent event) {
        AppProperties.Broadcast config = appProperties.getDraft().getBroadcast();
        if (!config.isEnabled()) {
            return;
        }
        String channel = config.getChannelPrefix() + event.getEventType();
        try {
            String json = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(channel, json);
            log.debug("📢 [Pub/Sub] {} published for draft {}", channel, event.getDraftId());
        } catch (JsonProcessingException e) {
            log.error("❌ [Pub/Sub] Failed to serialize DraftEvent for draft {}", event.getDraftId(), e);
        } catch (Exception e) {
            log.error("❌ [Pub/Sub] Failed to publish {} for draft {}", channel, event.getDraftId(), e);
        }
    }
}
