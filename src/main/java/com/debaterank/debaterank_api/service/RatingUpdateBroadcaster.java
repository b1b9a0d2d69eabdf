package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.WebSocketConfig;
import com.debaterank.debaterank_api.controller.dto.RatingEventResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes each committed rating event to /topic/ratings. Runs after commit
 * so subscribers never see an event that was rolled back.
 */
@Component
public class RatingUpdateBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RatingUpdateBroadcaster.class);

    private final SimpMessagingTemplate messagingTemplate;

    public RatingUpdateBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRecorded(RatingEventRecorded recorded) {
        RatingEventResponse payload = RatingEventResponse.from(recorded.event());
        try {
            messagingTemplate.convertAndSend(WebSocketConfig.RATINGS_TOPIC, payload);
        } catch (MessagingException e) {
            log.warn("Could not broadcast rating event {}: {}", payload.id(), e.getMessage());
        }
    }
}
