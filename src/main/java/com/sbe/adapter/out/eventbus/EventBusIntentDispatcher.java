package com.sbe.adapter.out.eventbus;

import com.sbe.application.port.out.IntentDispatcher;
import com.sbe.domain.model.TransactionIntent;
import io.vertx.core.eventbus.EventBus;
import lombok.RequiredArgsConstructor;

/**
 * Publishes accepted intents to the batching verticle over the local event bus
 */
@RequiredArgsConstructor
public class EventBusIntentDispatcher implements IntentDispatcher {

    public static final String INTENT_ADDRESS = "settlement.intent.accepted";

    private final EventBus eventBus;

    @Override
    public void dispatch(TransactionIntent intent) {
        eventBus.send(INTENT_ADDRESS, intent);
    }
}
