package com.firewatch.pipeline.listener;

import com.firewatch.pipeline.model.FireMutationEvent;
import com.firewatch.pipeline.service.ChangeDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class MutationStreamListener {

    private final ChangeDetector changeDetector;

    @RabbitListener(
            queues = "${firewatch.messaging.mutation-queue:firewatch.fires.mutations}",
            containerFactory = "mutationCycleContainerFactory")
    public void onCycle(List<FireMutationEvent> cycle) {
        log.debug("Mutation cycle of {} event(s)", cycle.size());
        changeDetector.onCycle(cycle);
    }
}
