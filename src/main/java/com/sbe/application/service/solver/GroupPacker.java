package com.sbe.application.service.solver;

import com.sbe.domain.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits the members of one wire key into groups, each bounded by the counterparty's
 * exposure cap and the batch size, at the lowest cost it can find.
 *
 * Candidates are the incumbent grouping, first-fit-decreasing, and for small groups an
 * exact branch-and-bound search. A candidate replaces the incumbent only when strictly cheaper.
 */
@Slf4j
class GroupPacker {

    private final CostModel costModel;
    private final int maxBatchSize;
    private final int maxExactGroupSize;

    GroupPacker(CostModel costModel, int maxBatchSize, int maxExactGroupSize) {
        this.costModel = costModel;
        this.maxBatchSize = maxBatchSize;
        this.maxExactGroupSize = maxExactGroupSize;
    }

    List<List<TransactionIntent>> bestGrouping(List<TransactionIntent> members,
                                               List<List<TransactionIntent>> incumbent,
                                               BigDecimal exposureCap,
                                               Map<String, Integer> arrival,
                                               SearchBudget budget) throws SolverTimeoutException {
        List<List<TransactionIntent>> best = incumbent;
        BigDecimal bestCost = cost(incumbent);

        List<List<TransactionIntent>> ffd = firstFitDecreasing(members, exposureCap, arrival);
        BigDecimal ffdCost = cost(ffd);
        if (ffdCost.compareTo(bestCost) < 0) {
            best = ffd;
            bestCost = ffdCost;
        }

        BigDecimal fxTotal = BigDecimal.ZERO;
        for (TransactionIntent intent : members) {
            fxTotal = fxTotal.add(costModel.fxCost(intent));
        }
        int minGroups = minGroups(members, exposureCap);
        if (bestCost.compareTo(costModel.groupingFloor(minGroups, fxTotal)) <= 0) {
            return sorted(best, arrival);
        }

        if (members.size() <= maxExactGroupSize && !budget.isExhausted()) {
            Search search = new Search(sortedByAmount(members, arrival), exposureCap, minGroups, fxTotal, bestCost, budget);
            search.run(0);
            if (search.bestGroups != null) {
                log.debug("Exact search improved grouping of {} members from {} to {}",
                        members.size(), bestCost, search.bestCost);
                best = search.bestGroups;
            }
        }
        return sorted(best, arrival);
    }

    BigDecimal cost(List<List<TransactionIntent>> groups) {
        BigDecimal total = BigDecimal.ZERO;
        for (List<TransactionIntent> group : groups) {
            total = total.add(costModel.priceGroup(group).getTotalCost());
        }
        return total;
    }

    List<List<TransactionIntent>> firstFitDecreasing(List<TransactionIntent> members, BigDecimal exposureCap,
                                                     Map<String, Integer> arrival) {
        List<List<TransactionIntent>> groups = new ArrayList<>();
        List<BigDecimal> sums = new ArrayList<>();
        for (TransactionIntent intent : sortedByAmount(members, arrival)) {
            boolean placed = false;
            for (int i = 0; i < groups.size(); i++) {
                BigDecimal sum = sums.get(i).add(intent.getAmount());
                if (groups.get(i).size() < maxBatchSize && sum.compareTo(exposureCap) <= 0) {
                    groups.get(i).add(intent);
                    sums.set(i, sum);
                    placed = true;
                    break;
                }
            }
            if (!placed) {
                List<TransactionIntent> group = new ArrayList<>();
                group.add(intent);
                groups.add(group);
                sums.add(intent.getAmount());
            }
        }
        return groups;
    }

    private int minGroups(List<TransactionIntent> members, BigDecimal exposureCap) {
        BigDecimal total = BigDecimal.ZERO;
        for (TransactionIntent intent : members) {
            total = total.add(intent.getAmount());
        }
        int byExposure = exposureCap.signum() > 0
                ? total.divide(exposureCap, 0, RoundingMode.CEILING).intValueExact()
                : members.size();
        int bySize = (members.size() + maxBatchSize - 1) / maxBatchSize;
        return Math.max(1, Math.max(byExposure, bySize));
    }

    private static List<TransactionIntent> sortedByAmount(List<TransactionIntent> members, Map<String, Integer> arrival) {
        List<TransactionIntent> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparing(TransactionIntent::getAmount).reversed()
                .thenComparing(intent -> arrival.get(intent.getTransactionId())));
        return sorted;
    }

    private static List<List<TransactionIntent>> sorted(List<List<TransactionIntent>> groups, Map<String, Integer> arrival) {
        Comparator<TransactionIntent> byArrival = Comparator.comparing(intent -> arrival.get(intent.getTransactionId()));
        List<List<TransactionIntent>> result = new ArrayList<>(groups.size());
        for (List<TransactionIntent> group : groups) {
            List<TransactionIntent> copy = new ArrayList<>(group);
            copy.sort(byArrival);
            result.add(copy);
        }
        result.sort(Comparator.comparing(group -> arrival.get(group.get(0).getTransactionId())));
        return result;
    }

    /**
     * Depth-first assignment of items (largest first) to open groups or a new group
     */
    private final class Search {
        private final List<TransactionIntent> items;
        private final BigDecimal exposureCap;
        private final int minGroups;
        private final BigDecimal fxTotal;
        private final SearchBudget budget;
        private final List<List<TransactionIntent>> open = new ArrayList<>();
        private final List<BigDecimal> sums = new ArrayList<>();
        private BigDecimal bestCost;
        private List<List<TransactionIntent>> bestGroups;
        private boolean stopped;

        Search(List<TransactionIntent> items, BigDecimal exposureCap, int minGroups, BigDecimal fxTotal,
               BigDecimal bestCost, SearchBudget budget) {
            this.items = items;
            this.exposureCap = exposureCap;
            this.minGroups = minGroups;
            this.fxTotal = fxTotal;
            this.bestCost = bestCost;
            this.budget = budget;
        }

        void run(int index) throws SolverTimeoutException {
            if (stopped) {
                return;
            }
            if (!budget.visit()) {
                stopped = true;
                return;
            }
            if (index == items.size()) {
                BigDecimal candidate = cost(open);
                if (candidate.compareTo(bestCost) < 0) {
                    bestCost = candidate;
                    bestGroups = copy(open);
                }
                return;
            }
            if (costModel.groupingFloor(Math.max(open.size(), minGroups), fxTotal).compareTo(bestCost) >= 0) {
                return;
            }

            TransactionIntent item = items.get(index);
            Set<String> tried = new HashSet<>();
            for (int i = 0; i < open.size(); i++) {
                List<TransactionIntent> group = open.get(i);
                BigDecimal sum = sums.get(i).add(item.getAmount());
                if (group.size() >= maxBatchSize || sum.compareTo(exposureCap) > 0) {
                    continue;
                }
                // groups with equal size and sum are interchangeable
                if (!tried.add(group.size() + ":" + sums.get(i).toPlainString())) {
                    continue;
                }
                BigDecimal previous = sums.get(i);
                group.add(item);
                sums.set(i, sum);
                run(index + 1);
                group.remove(group.size() - 1);
                sums.set(i, previous);
            }

            List<TransactionIntent> fresh = new ArrayList<>();
            fresh.add(item);
            open.add(fresh);
            sums.add(item.getAmount());
            run(index + 1);
            open.remove(open.size() - 1);
            sums.remove(sums.size() - 1);
        }

        private List<List<TransactionIntent>> copy(List<List<TransactionIntent>> groups) {
            List<List<TransactionIntent>> result = new ArrayList<>(groups.size());
            for (List<TransactionIntent> group : groups) {
                result.add(new ArrayList<>(group));
            }
            return result;
        }
    }
}
