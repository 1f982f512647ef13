package com.sbe.adapter.in.eventbus;

import com.sbe.adapter.out.eventbus.EventBusIntentDispatcher;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.application.service.admission.IntakeCapacity;
import com.sbe.application.service.batching.ChunkOutcome;
import com.sbe.application.service.batching.Chunker;
import com.sbe.application.service.batching.SettlementPipeline;
import com.sbe.application.service.batching.SettlementQueue;
import com.sbe.application.service.batching.WindowPairGrouper;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.TransactionIntent;
import com.sbe.domain.model.TransactionState;
import com.sbe.domain.model.TransactionStatus;
import com.sbe.infrastructure.config.SettlementModule;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns every settlement queue. Intents arrive over the event bus; a queue is drained when
 * it fills up or, on the periodic tick, when its oldest member has waited out the timeout.
 *
 * All queue state is touched on this verticle's context only. Chunks are solved on worker
 * threads and their outcomes are applied back on the context.
 */
@Slf4j
public class BatchingVerticle extends AbstractVerticle {

    private final SettlementPipeline pipeline;
    private final Chunker chunker;
    private final IntakeCapacity capacity;
    private final TransactionStatusRepository statusRepository;
    private final Clock clock;
    private final int maxDeferralAttempts;
    private final Duration tickInterval;
    private final WindowPairGrouper grouper = new WindowPairGrouper();

    private MessageConsumer<TransactionIntent> consumer;
    private long tickTimerId = -1;

    public BatchingVerticle(SettlementModule module) {
        this.pipeline = module.getPipeline();
        this.chunker = module.getChunker();
        this.capacity = module.getIntakeCapacity();
        this.statusRepository = module.getStatusRepository();
        this.clock = module.getClock();
        this.maxDeferralAttempts = module.getProperties().getMaxDeferralAttempts();
        this.tickInterval = module.getProperties().getTickInterval();
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting Batching Verticle...");
        consumer = vertx.eventBus().localConsumer(EventBusIntentDispatcher.INTENT_ADDRESS, this::onIntent);
        tickTimerId = vertx.setPeriodic(tickInterval.toMillis(), id -> grouper.queues().forEach(this::drain));

        consumer.completionHandler(ar -> {
            if (ar.succeeded()) {
                log.info("Batching Verticle listening on {} (tick {} ms)",
                        EventBusIntentDispatcher.INTENT_ADDRESS, tickInterval.toMillis());
            }
            startPromise.handle(ar);
        });
    }

    @Override
    public void stop() {
        if (tickTimerId >= 0) {
            vertx.cancelTimer(tickTimerId);
        }
        if (consumer != null) {
            consumer.unregister();
        }
        log.info("Batching Verticle stopped ({} transactions still queued)", grouper.totalQueued());
    }

    private void onIntent(Message<TransactionIntent> message) {
        TransactionIntent intent = message.body();
        Optional<SettlementQueue> routed = grouper.route(intent, clock.instant());
        if (routed.isEmpty()) {
            log.error("Transaction {} is already in progress, dropping the second copy", intent.getTransactionId());
            capacity.release(1);
            return;
        }
        SettlementQueue queue = routed.get();
        log.debug("Queued {} on {} ({} pending)", intent.getTransactionId(), queue.getKey(), queue.size());
        drain(queue);
    }

    private void drain(SettlementQueue queue) {
        if (queue.isBusy()) {
            return;
        }
        chunker.cut(queue, clock.instant()).ifPresent(chunk -> {
            queue.markBusy();
            pipeline.process(chunk)
                    .onComplete(ar -> context.runOnContext(v -> onChunkDone(queue, chunk, ar)));
        });
    }

    private void onChunkDone(SettlementQueue queue, Chunk chunk, AsyncResult<ChunkOutcome> result) {
        queue.markIdle();
        Instant now = clock.instant();

        if (result.succeeded()) {
            ChunkOutcome outcome = result.result();
            String deferredBatchId = null;
            for (Batch batch : outcome.batches()) {
                if (batch.getStatus() == BatchStatus.INFEASIBLE) {
                    deferredBatchId = batch.getBatchId();
                } else {
                    queue.forget(batch.getMemberIds());
                }
            }
            abandon(queue.requeueDeferred(outcome.deferred(), now, maxDeferralAttempts), deferredBatchId, now);
        } else {
            log.error("Chunk {} failed, requeueing its {} members", chunk.getChunkId(), chunk.size(), result.cause());
            abandon(queue.requeueDeferred(chunk.getMembers(), now, maxDeferralAttempts), null, now);
        }

        drain(queue);
    }

    private void abandon(List<TransactionIntent> exhausted, String batchId, Instant now) {
        if (exhausted.isEmpty()) {
            return;
        }
        log.warn("{} transactions exceeded {} deferral attempts and are infeasible: {}",
                exhausted.size(), maxDeferralAttempts,
                exhausted.stream().map(TransactionIntent::getTransactionId).collect(Collectors.toList()));
        statusRepository.saveAll(exhausted.stream()
                .map(intent -> new TransactionState(intent.getTransactionId(), TransactionStatus.INFEASIBLE, batchId, now))
                .collect(Collectors.toList()));
        capacity.release(exhausted.size());
    }
}
