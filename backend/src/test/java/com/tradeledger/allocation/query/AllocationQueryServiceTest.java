package com.tradeledger.allocation.query;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.allocation.engine.FifoAllocationEngine;
import com.tradeledger.allocation.run.AllocationRunRequest;
import com.tradeledger.allocation.run.AllocationRunService;
import com.tradeledger.allocation.validation.AllocationValidator;
import com.tradeledger.allocation.validation.ValidationService;
import com.tradeledger.allocation.version.InMemoryAllocationVersionStore;
import com.tradeledger.allocation.version.VersionManager;
import com.tradeledger.allocation.version.VersionNotFoundException;
import com.tradeledger.domain.VersionStatus;
import com.tradeledger.ledger.InMemoryTradeLedger;
import com.tradeledger.review.ManualReviewQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.tradeledger.TradeFixtures.buy;
import static com.tradeledger.TradeFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@ExtendWith(MockitoExtension.class)
class AllocationQueryServiceTest {

    private static final String NS = "default";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    ManualReviewQueue manualReviewQueue;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private InMemoryTradeLedger ledger;
    private AllocationRunService runService;
    private AllocationQueryService queryService;

    @BeforeEach
    void setUp() {
        InMemoryAllocationVersionStore store = new InMemoryAllocationVersionStore();
        ledger = new InMemoryTradeLedger(
                buy("B1", "BTC-USD", "10", "100", 1),
                buy("B2", "BTC-USD", "5", "110", 2),
                sell("S1", "BTC-USD", "12", "120", 3),
                buy("E1", "ETH-USD", "4", "2000", 1),
                sell("E2", "ETH-USD", "1", "2100", 2),
                sell("D1", "DOGE-USD", "5", "1", 4));
        AllocationProperties properties = new AllocationProperties();
        VersionManager versionManager = new VersionManager(store, properties, CLOCK);
        ValidationService validationService = new ValidationService(store, versionManager, ledger, new AllocationValidator());
        runService = new AllocationRunService(versionManager, store, ledger, new FifoAllocationEngine(),
                validationService, manualReviewQueue, properties, applicationEventPublisher, CLOCK);
        queryService = new AllocationQueryService(versionManager, store);
    }

    @Test
    @DisplayName("P&L of the current version aggregates allocations, residue and open lots per symbol")
    void pnl_currentVersion() {
        runService.run(AllocationRunRequest.all(NS, "test"));

        PnlReport report = queryService.pnl(NS, null);

        assertThat(report.versionNumber()).isEqualTo(1L);
        assertThat(report.status()).isEqualTo(VersionStatus.VALID);
        assertThat(report.hasUnmatchedResidue()).isTrue();
        assertThat(report.totalRealizedPnl()).isEqualByComparingTo("320");
        assertThat(report.symbols())
                .extracting(SymbolPnl::symbol, SymbolPnl::allocationCount)
                .containsExactly(tuple("BTC-USD", 2), tuple("DOGE-USD", 0), tuple("ETH-USD", 1));

        SymbolPnl btc = report.symbols().get(0);
        assertThat(btc.matchedQuantity()).isEqualByComparingTo("12");
        assertThat(btc.costBasis()).isEqualByComparingTo("1220");
        assertThat(btc.netProceeds()).isEqualByComparingTo("1440");
        assertThat(btc.realizedPnl()).isEqualByComparingTo("220");
        assertThat(btc.openQuantity()).isEqualByComparingTo("3");

        SymbolPnl doge = report.symbols().get(1);
        assertThat(doge.realizedPnl()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(doge.unmatchedQuantity()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("explicit version number reads a superseded version unchanged")
    void pnl_supersededVersion() {
        runService.run(AllocationRunRequest.all(NS, "test"));
        ledger.append(buy("D0", "DOGE-USD", "5", "0.5", 0));
        runService.run(AllocationRunRequest.all(NS, "test"));

        PnlReport v1 = queryService.pnl(NS, 1L);
        PnlReport v2 = queryService.pnl(NS, null);

        assertThat(v1.status()).isEqualTo(VersionStatus.SUPERSEDED);
        assertThat(v1.totalRealizedPnl()).isEqualByComparingTo("320");
        assertThat(v2.versionNumber()).isEqualTo(2L);
        assertThat(v2.hasUnmatchedResidue()).isFalse();
        // DOGE 5 * (1 - 0.5)
        assertThat(v2.totalRealizedPnl()).isEqualByComparingTo("322.5");
        assertThat(queryService.residues(NS, 1L)).hasSize(1);
        assertThat(queryService.residues(NS, 2L)).isEmpty();
    }

    @Test
    @DisplayName("rows of a version can be filtered by symbol")
    void allocations_bySymbol() {
        runService.run(AllocationRunRequest.all(NS, "test"));

        assertThat(queryService.allocations(NS, 1L, List.of("BTC-USD")))
                .extracting(a -> a.getBuyOrderId())
                .containsExactly("B1", "B2");
        assertThat(queryService.openLots(NS, 1L))
                .extracting(lot -> lot.getBuyOrderId())
                .containsExactlyInAnyOrder("B2", "E1");
    }

    @Test
    void unknownVersion_notFound() {
        assertThatThrownBy(() -> queryService.pnl(NS, 7L)).isInstanceOf(VersionNotFoundException.class);
        assertThatThrownBy(() -> queryService.pnl(NS, null)).isInstanceOf(VersionNotFoundException.class);
    }
}
