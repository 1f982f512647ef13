package com.sbe.adapter.out.agreement;

import com.sbe.application.port.out.AgreementService;
import com.sbe.domain.model.Batch;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Agreement stage stand-in: every proposed batch is committed.
 * Replace with a client of the consensus service once it exists.
 */
@Slf4j
public class AutoCommitAgreementAdapter implements AgreementService {

    @Override
    public Future<AgreementOutcome> propose(Batch batch) {
        if (!batch.isNetted()) {
            return Future.failedFuture(new IllegalArgumentException(
                    "Only netted batches can be proposed: " + batch.getBatchId()));
        }
        log.debug("Auto-committing batch {}", batch.getBatchId());
        return Future.succeededFuture(AgreementOutcome.COMMITTED);
    }
}
