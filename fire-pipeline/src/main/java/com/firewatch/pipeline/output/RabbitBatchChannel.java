package com.firewatch.pipeline.output;

import com.firewatch.pipeline.config.FirewatchProperties;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.service.ChannelUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RabbitBatchChannel implements BatchChannel {

    private final RabbitTemplate rabbitTemplate;
    private final FirewatchProperties properties;

    @Override
    public void publish(FireBatch batch) {
        String queue = properties.getMessaging().getIngestQueue();
        try {
            rabbitTemplate.convertAndSend("", queue, batch);
            log.debug("Queued batch {} ({} fires) on {}", batch.batchId(), batch.size(), queue);
        } catch (AmqpException e) {
            throw new ChannelUnavailableException("Could not queue batch " + batch.batchId(), e);
        }
    }
}
