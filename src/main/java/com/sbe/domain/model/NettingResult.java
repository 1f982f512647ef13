package com.sbe.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Net obligations of one batch. For every currency the sum of net positions
 * equals the sum of gross positions.
 */
@Value
public class NettingResult {
    String batchId;
    List<NetTransfer> transfers;
    Map<String, BigDecimal> grossPositionTotals;
    Map<String, BigDecimal> netPositionTotals;
    int grossTransferCount;

    public int getNetTransferCount() {
        return transfers.size();
    }
}
