package com.firewatch.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology.
 *
 *   fetch ──► firewatch.fires.ingest ──► process ──► firewatch.fires.dead-letter
 *                    │ (rejected after listener retries)
 *                    └──► firewatch.fires.ingest.parked
 *   store ──► firewatch.fires.mutations ──► change detector ──► firewatch.alerts (fanout)
 */
@Configuration
public class RabbitConfig {

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public Queue ingestQueue(FirewatchProperties properties) {
        FirewatchProperties.Messaging messaging = properties.getMessaging();
        return QueueBuilder.durable(messaging.getIngestQueue())
                .deadLetterExchange("")
                .deadLetterRoutingKey(messaging.getParkedQueue())
                .build();
    }

    @Bean
    public Queue parkedQueue(FirewatchProperties properties) {
        return QueueBuilder.durable(properties.getMessaging().getParkedQueue()).build();
    }

    @Bean
    public Queue deadLetterQueue(FirewatchProperties properties) {
        return QueueBuilder.durable(properties.getMessaging().getDeadLetterQueue()).build();
    }

    @Bean
    public Queue mutationQueue(FirewatchProperties properties) {
        return QueueBuilder.durable(properties.getMessaging().getMutationQueue()).build();
    }

    @Bean
    public FanoutExchange alertExchange(FirewatchProperties properties) {
        return new FanoutExchange(properties.getMessaging().getAlertExchange(), true, false);
    }

    /**
     * Hands the mutation listener up to {@code mutationCycleSize} events per call, or whatever
     * arrived within {@code mutationCycleTimeout}. Each call is one change-detection cycle.
     */
    @Bean
    public SimpleRabbitListenerContainerFactory mutationCycleContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            FirewatchProperties properties) {
        FirewatchProperties.Messaging messaging = properties.getMessaging();

        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        // cycles are never replayed, a failed alert is logged and dropped
        factory.setAdviceChain();
        factory.setBatchListener(true);
        factory.setConsumerBatchEnabled(true);
        factory.setBatchSize(messaging.getMutationCycleSize());
        factory.setReceiveTimeout(messaging.getMutationCycleTimeout().toMillis());
        return factory;
    }
}
