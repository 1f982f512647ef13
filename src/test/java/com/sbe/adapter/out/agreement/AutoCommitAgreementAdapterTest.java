package com.sbe.adapter.out.agreement;

import com.sbe.application.port.out.AgreementService.AgreementOutcome;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.NettingResult;
import io.vertx.core.Future;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AutoCommitAgreementAdapterTest {

    private final AutoCommitAgreementAdapter adapter = new AutoCommitAgreementAdapter();

    private final Batch batch = Batch.builder()
            .batchId("c1-b01")
            .memberIds(List.of("T1"))
            .status(BatchStatus.FALLBACK)
            .build();

    @Test
    void propose_shouldCommitNettedBatch() {
        Batch netted = batch.withNetting(new NettingResult("c1-b01", List.of(), Map.of(), Map.of(), 0));

        Future<AgreementOutcome> outcome = adapter.propose(netted);

        assertEquals(AgreementOutcome.COMMITTED, outcome.result());
    }

    @Test
    void propose_shouldRefuseBatchThatWasNotNetted() {
        Future<AgreementOutcome> outcome = adapter.propose(batch);

        assertTrue(outcome.failed());
        assertInstanceOf(IllegalArgumentException.class, outcome.cause());
    }
}
