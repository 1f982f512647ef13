package com.sbe.application.port.out;

import com.sbe.domain.model.Batch;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for batch state served by status queries
 */
public interface BatchRepository {

    Future<Void> save(Batch batch);

    Future<Optional<Batch>> findById(String batchId);
}
