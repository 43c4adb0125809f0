package com.ai.trainingstudio.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes state snapshots to STOMP subscribers. A failed push is logged and
 * dropped; the same state stays readable over REST.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StudioEventPublisher {

    public static final String WORKFLOW_TOPIC_PREFIX = "/topic/workflows/";
    public static final String CONFIGURATION_TOPIC = "/topic/configuration";
    public static final String SESSION_TOPIC = "/topic/session";
    public static final String PERSONALIZED_TOPIC = "/topic/personalized";

    private final SimpMessagingTemplate messagingTemplate;

    public void workflowChanged(String feature, Object snapshot) {
        send(WORKFLOW_TOPIC_PREFIX + feature, snapshot);
    }

    public void configurationChanged(Object view) {
        send(CONFIGURATION_TOPIC, view);
    }

    public void sessionChanged(Object overview) {
        send(SESSION_TOPIC, overview);
    }

    public void personalizedChanged(Object view) {
        send(PERSONALIZED_TOPIC, view);
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("Could not publish to {}: {}", destination, e.getMessage());
        }
    }
}
