package com.sbe.application.port.out;

import com.sbe.domain.model.TransactionIntent;

/**
 * Output port handing accepted intents to the batching side
 */
public interface IntentDispatcher {

    void dispatch(TransactionIntent intent);
}
