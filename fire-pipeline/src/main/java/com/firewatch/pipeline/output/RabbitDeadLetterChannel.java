package com.firewatch.pipeline.output;

import com.firewatch.pipeline.config.FirewatchProperties;
import com.firewatch.pipeline.model.DeadLetter;
import com.firewatch.pipeline.service.ChannelUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RabbitDeadLetterChannel implements DeadLetterChannel {

    private final RabbitTemplate rabbitTemplate;
    private final FirewatchProperties properties;

    @Override
    public void publish(DeadLetter deadLetter) {
        try {
            rabbitTemplate.convertAndSend("", properties.getMessaging().getDeadLetterQueue(), deadLetter);
        } catch (AmqpException e) {
            throw new ChannelUnavailableException("Dead-letter queue unavailable", e);
        }
    }
}
