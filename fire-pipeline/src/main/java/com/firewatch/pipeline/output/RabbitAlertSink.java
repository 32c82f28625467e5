package com.firewatch.pipeline.output;

import com.firewatch.pipeline.config.FirewatchProperties;
import com.firewatch.pipeline.model.AlertMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts to a fanout exchange; every bound queue (mail, chat, webhooks) gets a copy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RabbitAlertSink implements AlertSink {

    private final RabbitTemplate rabbitTemplate;
    private final FirewatchProperties properties;

    @Override
    public void publish(AlertMessage message) {
        log.info("Publishing alert: region={} fires={}", message.region(), message.fireCount());
        rabbitTemplate.convertAndSend(properties.getMessaging().getAlertExchange(), "", message);
    }
}
