package com.sbe.adapter.in.web.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.CostBreakdown;
import com.sbe.domain.model.NetTransfer;
import com.sbe.domain.model.NettingResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Batch state as served by GET /api/batches/:batchId.
 * Amounts are rendered as plain decimal strings so no precision is lost in JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchQueryResponse(
        String batchId,
        String chunkId,
        String window,
        String currencyPair,
        String status,
        int memberCount,
        List<String> memberIds,
        Map<String, String> grossSubtotals,
        CostView cost,
        Map<String, String> deferralReasons,
        NettingView netting
) {

    public static BatchQueryResponse from(Batch batch) {
        Map<String, String> reasons = batch.getDeferralReasons() == null || batch.getDeferralReasons().isEmpty()
                ? null
                : batch.getDeferralReasons().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().name(), (a, b) -> a, TreeMap::new));

        return new BatchQueryResponse(
                batch.getBatchId(),
                batch.getChunkId(),
                batch.getWindow().getValue(),
                batch.getPair().toString(),
                batch.getStatus().name(),
                batch.size(),
                batch.getMemberIds(),
                plain(batch.getGrossSubtotals()),
                CostView.from(batch.getCost()),
                reasons,
                batch.isNetted() ? NettingView.from(batch.getNetting()) : null
        );
    }

    private static Map<String, String> plain(Map<String, BigDecimal> amounts) {
        Map<String, String> result = new TreeMap<>();
        amounts.forEach((currency, amount) -> result.put(currency, amount.toPlainString()));
        return result;
    }

    public record CostView(String fxSpreadCost, String wireCost, String consolidationDiscount, int wireCount,
                           String totalCost) {
        static CostView from(CostBreakdown cost) {
            return new CostView(
                    cost.getFxSpreadCost().toPlainString(),
                    cost.getWireCost().toPlainString(),
                    cost.getConsolidationDiscount().toPlainString(),
                    cost.getWireCount(),
                    cost.getTotalCost().toPlainString()
            );
        }
    }

    public record NettingView(List<TransferView> transfers, Map<String, String> grossPositionTotals,
                              Map<String, String> netPositionTotals, int grossTransferCount, int netTransferCount) {
        static NettingView from(NettingResult netting) {
            return new NettingView(
                    netting.getTransfers().stream().map(TransferView::from).collect(Collectors.toList()),
                    plain(netting.getGrossPositionTotals()),
                    plain(netting.getNetPositionTotals()),
                    netting.getGrossTransferCount(),
                    netting.getNetTransferCount()
            );
        }
    }

    public record TransferView(String counterpartyId, String currency, String amount, String direction,
                               int grossFlowCount) {
        static TransferView from(NetTransfer transfer) {
            return new TransferView(
                    transfer.getCounterpartyId(),
                    transfer.getCurrency(),
                    transfer.getAmount().toPlainString(),
                    transfer.getDirection().getValue(),
                    transfer.getGrossFlowCount()
            );
        }
    }
}
