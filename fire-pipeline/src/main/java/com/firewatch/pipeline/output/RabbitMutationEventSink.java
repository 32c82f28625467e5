package com.firewatch.pipeline.output;

import com.firewatch.pipeline.config.FirewatchProperties;
import com.firewatch.pipeline.model.FireMutationEvent;
import com.firewatch.pipeline.service.ChannelUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RabbitMutationEventSink implements MutationEventSink {

    private final RabbitTemplate rabbitTemplate;
    private final FirewatchProperties properties;

    @Override
    public void emit(FireMutationEvent event) {
        try {
            rabbitTemplate.convertAndSend("", properties.getMessaging().getMutationQueue(), event);
        } catch (AmqpException e) {
            throw new ChannelUnavailableException(
                    "Mutation stream unavailable for " + event.record().getFireId(), e);
        }
    }
}
