package com.sbe.application.port.out;

import com.sbe.domain.model.Batch;
import io.vertx.core.Future;

/**
 * Output port for the execution store. Write-once per batch id.
 */
public interface SettlementStore {

    /**
     * @return true when stored, false when the batch id was already stored (nothing overwritten)
     */
    Future<Boolean> saveConfirmed(Batch batch);
}
