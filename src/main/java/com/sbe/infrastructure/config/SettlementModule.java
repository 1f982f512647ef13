package com.sbe.infrastructure.config;

import com.sbe.adapter.out.agreement.AutoCommitAgreementAdapter;
import com.sbe.adapter.out.config.ConfiguredFxSpreadAdapter;
import com.sbe.adapter.out.config.ConfiguredSettlementLimitAdapter;
import com.sbe.adapter.out.eventbus.EventBusIntentDispatcher;
import com.sbe.adapter.out.persistence.InMemoryBatchRepository;
import com.sbe.adapter.out.persistence.InMemoryDedupStore;
import com.sbe.adapter.out.persistence.InMemoryLedgerLog;
import com.sbe.adapter.out.persistence.InMemorySettlementStore;
import com.sbe.adapter.out.persistence.InMemoryTransactionStatusRepository;
import com.sbe.application.config.BatchingProperties;
import com.sbe.application.port.in.AdmissionOutcome.Accepted;
import com.sbe.application.port.in.SettlementQueryUseCase;
import com.sbe.application.port.in.TransactionAdmissionUseCase;
import com.sbe.application.port.out.FxSpreadProvider;
import com.sbe.application.port.out.SettlementLimitProvider;
import com.sbe.application.service.admission.DedupRetentionService;
import com.sbe.application.service.admission.IdempotencyGate;
import com.sbe.application.service.admission.IntakeCapacity;
import com.sbe.application.service.admission.TransactionValidator;
import com.sbe.application.service.batching.Chunker;
import com.sbe.application.service.batching.SettlementPipeline;
import com.sbe.application.service.ledger.LedgerEmitter;
import com.sbe.application.service.netting.NettingCalculator;
import com.sbe.application.service.query.SettlementQueryService;
import com.sbe.application.service.solver.BatchAssembler;
import com.sbe.application.service.solver.ConstraintScreen;
import com.sbe.application.service.solver.CostModel;
import com.sbe.application.service.solver.CostSolver;
import com.sbe.application.service.solver.FallbackAssigner;
import com.sbe.application.service.solver.SolverInvoker;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Wires adapters, services and use cases from the loaded configuration.
 * Both verticles are handed the same module, so they share one set of stores.
 */
@Slf4j
@Getter
public class SettlementModule {

    private final BatchingProperties properties;
    private final Clock clock;

    private final InMemoryDedupStore<Accepted> dedupStore;
    private final InMemoryLedgerLog ledgerLog;
    private final InMemoryBatchRepository batchRepository;
    private final InMemoryTransactionStatusRepository statusRepository;
    private final InMemorySettlementStore settlementStore;

    private final IntakeCapacity intakeCapacity;
    private final LedgerEmitter ledgerEmitter;
    private final TransactionAdmissionUseCase admissionUseCase;
    private final SettlementQueryUseCase queryUseCase;
    private final DedupRetentionService retentionService;
    private final Chunker chunker;
    private final SettlementPipeline pipeline;

    private SettlementModule(Vertx vertx, JsonObject config, Clock clock) {
        this.properties = AppConfigLoader.batchingProperties(config);
        this.clock = clock;

        // Output ports (adapters)
        FxSpreadProvider spreads = ConfiguredFxSpreadAdapter.fromConfig(config);
        SettlementLimitProvider limits = ConfiguredSettlementLimitAdapter.fromConfig(config);
        this.dedupStore = new InMemoryDedupStore<>();
        this.ledgerLog = new InMemoryLedgerLog();
        this.batchRepository = new InMemoryBatchRepository();
        this.statusRepository = new InMemoryTransactionStatusRepository();
        this.settlementStore = new InMemorySettlementStore();

        // Admission side
        this.intakeCapacity = new IntakeCapacity(properties.getMaxInFlightTransactions());
        this.ledgerEmitter = new LedgerEmitter(vertx, ledgerLog, clock,
                properties.getMaxAppendAttempts(), properties.getInitialAppendBackoff());
        this.admissionUseCase = new IdempotencyGate(
                new TransactionValidator(),
                dedupStore,
                intakeCapacity,
                ledgerEmitter,
                statusRepository,
                new EventBusIntentDispatcher(vertx.eventBus()),
                clock,
                properties.getDedupRetention()
        );
        this.retentionService = new DedupRetentionService(vertx, dedupStore, ledgerEmitter, clock,
                properties.getDedupPurgeInterval());
        this.queryUseCase = new SettlementQueryService(batchRepository, statusRepository, ledgerLog);

        // Batching side
        CostModel costModel = new CostModel(spreads, properties.getWireCost(), properties.getConsolidationDiscountRate());
        ConstraintScreen screen = new ConstraintScreen(limits);
        BatchAssembler assembler = new BatchAssembler(costModel);
        FallbackAssigner fallback = new FallbackAssigner(screen, limits, assembler, properties.getMaxBatchSize());
        CostSolver solver = new CostSolver(screen, fallback, assembler, costModel, limits,
                properties.getMaxBatchSize(), properties.getMaxSearchNodes(), properties.getMaxExactGroupSize());

        this.chunker = new Chunker(properties.getMaxChunkSize(), properties.getBatchTimeout());
        this.pipeline = new SettlementPipeline(
                new SolverInvoker(vertx, solver, properties.getSolverTimeBudget()),
                fallback,
                new NettingCalculator(),
                ledgerEmitter,
                batchRepository,
                statusRepository,
                new AutoCommitAgreementAdapter(),
                settlementStore,
                intakeCapacity,
                properties.getMaxBatchSize(),
                clock
        );

        log.info("Services wired up: maxBatchSize={}, maxChunkSize={}, solver budget={}ms",
                properties.getMaxBatchSize(), properties.getMaxChunkSize(), properties.getSolverTimeBudget().toMillis());
    }

    public static SettlementModule create(Vertx vertx, JsonObject config) {
        return new SettlementModule(vertx, config, Clock.systemUTC());
    }

    public static SettlementModule create(Vertx vertx, JsonObject config, Clock clock) {
        return new SettlementModule(vertx, config, clock);
    }
}
