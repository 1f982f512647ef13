package com.sbe.application.port.out;

import com.sbe.domain.model.Batch;
import io.vertx.core.Future;

/**
 * Output port for the external multi-party agreement stage. Opaque to the core.
 */
public interface AgreementService {

    Future<AgreementOutcome> propose(Batch batch);

    enum AgreementOutcome {
        COMMITTED,
        ABORTED
    }
}
