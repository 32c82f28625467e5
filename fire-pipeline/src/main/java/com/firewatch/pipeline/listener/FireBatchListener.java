package com.firewatch.pipeline.listener;

import com.firewatch.pipeline.model.BatchOutcome;
import com.firewatch.pipeline.model.FireBatch;
import com.firewatch.pipeline.service.ProcessStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumes batches queued by the fetch stage. A failure that escapes {@link ProcessStage}
 * is rethrown so the container retries the whole batch and finally parks it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FireBatchListener {

    private final ProcessStage processStage;

    @RabbitListener(queues = "${firewatch.messaging.ingest-queue:firewatch.fires.ingest}")
    public void onBatch(FireBatch batch) {
        log.debug("Received batch {} ({} fires)", batch.batchId(), batch.size());
        BatchOutcome outcome = processStage.process(batch);
        log.debug("Batch {} done: {} persisted, {} dead-lettered",
                outcome.batchId(), outcome.persisted(), outcome.deadLettered());
    }
}
