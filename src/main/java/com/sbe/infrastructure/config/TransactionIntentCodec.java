package com.sbe.infrastructure.config;

import com.sbe.domain.model.SettlementDirection;
import com.sbe.domain.model.SettlementWindow;
import com.sbe.domain.model.TransactionIntent;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Message codec for TransactionIntent so accepted intents can travel over the event bus
 */
public class TransactionIntentCodec implements MessageCodec<TransactionIntent, TransactionIntent> {

    @Override
    public void encodeToWire(Buffer buffer, TransactionIntent intent) {
        Buffer encoded = new JsonObject()
                .put("transactionId", intent.getTransactionId())
                .put("amount", intent.getAmount().toPlainString())
                .put("sourceCurrency", intent.getSourceCurrency())
                .put("destinationCurrency", intent.getDestinationCurrency())
                .put("sourceAccount", intent.getSourceAccount())
                .put("destinationAccount", intent.getDestinationAccount())
                .put("counterpartyId", intent.getCounterpartyId())
                .put("window", intent.getWindow().getValue())
                .put("direction", intent.getDirection().getValue())
                .put("idempotencyKey", intent.getIdempotencyKey())
                .put("submittedAt", intent.getSubmittedAt().toString())
                .toBuffer();

        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public TransactionIntent decodeFromWire(int position, Buffer buffer) {
        int length = buffer.getInt(position);
        int offset = position + 4;
        JsonObject json = new JsonObject(buffer.getBuffer(offset, offset + length));

        return TransactionIntent.builder()
                .transactionId(json.getString("transactionId"))
                .amount(new BigDecimal(json.getString("amount")))
                .sourceCurrency(json.getString("sourceCurrency"))
                .destinationCurrency(json.getString("destinationCurrency"))
                .sourceAccount(json.getString("sourceAccount"))
                .destinationAccount(json.getString("destinationAccount"))
                .counterpartyId(json.getString("counterpartyId"))
                .window(SettlementWindow.fromValue(json.getString("window")))
                .direction(SettlementDirection.fromValue(json.getString("direction")))
                .idempotencyKey(json.getString("idempotencyKey"))
                .submittedAt(Instant.parse(json.getString("submittedAt")))
                .build();
    }

    @Override
    public TransactionIntent transform(TransactionIntent intent) {
        // immutable, safe to share locally
        return intent;
    }

    @Override
    public String name() {
        return "TransactionIntentCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
