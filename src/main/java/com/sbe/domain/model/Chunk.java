package com.sbe.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered, bounded slice of one queue, handed to the solver as a unit
 */
@Value
public class Chunk {
    String chunkId;
    QueueKey queueKey;
    List<TransactionIntent> members;
    Instant formedAt;

    public Chunk(String chunkId, QueueKey queueKey, List<TransactionIntent> members, Instant formedAt) {
        for (TransactionIntent member : members) {
            if (!queueKey.equals(QueueKey.of(member))) {
                throw new IllegalArgumentException("Transaction " + member.getTransactionId()
                        + " does not belong to queue " + queueKey);
            }
        }
        this.chunkId = chunkId;
        this.queueKey = queueKey;
        this.members = List.copyOf(members);
        this.formedAt = formedAt;
    }

    public int size() {
        return members.size();
    }

    public SettlementWindow getWindow() {
        return queueKey.getWindow();
    }

    public List<String> memberIds() {
        return members.stream().map(TransactionIntent::getTransactionId).collect(Collectors.toList());
    }

    public Map<String, TransactionIntent> membersById() {
        return members.stream().collect(Collectors.toMap(TransactionIntent::getTransactionId, Function.identity()));
    }
}
