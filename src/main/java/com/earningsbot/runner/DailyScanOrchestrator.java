package com.earningsbot.runner;

import com.earningsbot.core.ItemOutcome;
import com.earningsbot.core.PhaseReport;
import com.earningsbot.data.MarketDataSource;
import com.earningsbot.data.RateLimitException;
import com.earningsbot.model.AlertDraft;
import com.earningsbot.model.AlertType;
import com.earningsbot.model.DailyJobResult;
import com.earningsbot.model.EntrySignal;
import com.earningsbot.model.ExitSignal;
import com.earningsbot.model.Position;
import com.earningsbot.model.PricePair;
import com.earningsbot.store.SignalStore;
import com.earningsbot.strategy.AlertMessages;
import com.earningsbot.strategy.EventKeys;
import com.earningsbot.strategy.SignalEvaluator;
import com.earningsbot.universe.SymbolUniverseCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the daily job: entry scan, then exit scan, both for the same date.
 * <p>
 * Each symbol (or open position) is one unit of work committed on its own. A failing unit is
 * reported and skipped; the rest of the batch and the other phase still run. Rerunning a date
 * replays every unit, and the unique keys in storage turn repeats into no-ops.
 */
public final class DailyScanOrchestrator {
    private static final Logger LOG = LogManager.getLogger(DailyScanOrchestrator.class);

    public static final String PHASE_ENTRIES = "entries";
    public static final String PHASE_EXITS = "exits";

    private final SymbolUniverseCache universeCache;
    private final MarketDataSource marketData;
    private final SignalStore store;
    private final Clock clock;
    private final Duration universeTtl;

    public DailyScanOrchestrator(
            SymbolUniverseCache universeCache,
            MarketDataSource marketData,
            SignalStore store,
            Clock clock,
            Duration universeTtl
    ) {
        this.universeCache = universeCache;
        this.marketData = marketData;
        this.store = store;
        this.clock = clock;
        this.universeTtl = universeTtl;
    }

    public DailyJobResult runDailyJob(LocalDate asOf) {
        LOG.info("Daily job started: as_of={}", asOf);
        PhaseReport entries = scanEntries(asOf);
        logSummary(entries);
        PhaseReport exits = scanExits(asOf);
        logSummary(exits);
        return new DailyJobResult(asOf, entries.newAlerts(), exits.newAlerts());
    }

    private static void logSummary(PhaseReport report) {
        LOG.info("Scan phase done: {}", report.summary());
        for (ItemOutcome failure : report.failures()) {
            LOG.warn("  failed: phase={} symbol={} status={} detail={}",
                    report.phase(), failure.symbol(), failure.status().label(), failure.detail());
        }
    }

    public PhaseReport scanEntries(LocalDate asOf) {
        PhaseReport report = new PhaseReport(PHASE_ENTRIES);

        Set<String> universe;
        List<String> reporting;
        try {
            universe = universeCache.getUniverse(OffsetDateTime.now(clock), universeTtl);
            if (universe.isEmpty()) {
                LOG.debug("Universe is empty, entry scan skipped: as_of={}", asOf);
                return report;
            }
            reporting = marketData.earningsOn(asOf);
        } catch (Exception e) {
            LOG.error("Entry scan aborted before candidates were known: as_of={} cause={}", asOf, describe(e), e);
            return report;
        }

        List<String> candidates = new ArrayList<>();
        for (String symbol : reporting) {
            if (universe.contains(symbol)) {
                candidates.add(symbol);
            }
        }
        LOG.info("Entry candidates: as_of={} earnings={} in_universe={}", asOf, reporting.size(), candidates.size());

        for (String symbol : candidates) {
            report.add(processEntry(symbol, asOf));
        }
        return report;
    }

    public PhaseReport scanExits(LocalDate asOf) {
        PhaseReport report = new PhaseReport(PHASE_EXITS);

        List<Position> open;
        try {
            open = store.inTransaction((positions, alerts) -> positions.listOpen());
        } catch (Exception e) {
            LOG.error("Exit scan aborted, open positions unavailable: as_of={} cause={}", asOf, describe(e), e);
            return report;
        }
        LOG.info("Exit candidates: as_of={} open_positions={}", asOf, open.size());

        for (Position position : open) {
            report.add(processExit(position, asOf));
        }
        return report;
    }

    private ItemOutcome processEntry(String symbol, LocalDate asOf) {
        try {
            Optional<PricePair> pair = marketData.priceAndPrevClose(symbol, asOf);
            if (pair.isEmpty()) {
                LOG.debug("No price pair: symbol={} as_of={}", symbol, asOf);
                return ItemOutcome.noData(symbol, "price pair absent");
            }
            BigDecimal close = pair.get().close();
            Optional<EntrySignal> signal = SignalEvaluator.evaluateEntry(close, pair.get().prevClose());
            if (signal.isEmpty()) {
                return ItemOutcome.noSignal(symbol, "");
            }

            BigDecimal earningsReturn = signal.get().earningsReturn();
            AlertDraft draft = new AlertDraft(
                    EventKeys.entry(symbol, asOf),
                    AlertType.ENTRY,
                    symbol,
                    asOf,
                    AlertMessages.entry(symbol, asOf, earningsReturn, close)
            );
            boolean inserted = store.inTransaction((positions, alerts) -> {
                positions.openIfAbsent(symbol, asOf, close);
                return alerts.recordIfAbsent(draft);
            });
            if (!inserted) {
                return ItemOutcome.duplicate(symbol, draft.eventKey());
            }
            LOG.info("Entry signal: symbol={} as_of={} return={} close={}", symbol, asOf, earningsReturn, close);
            return ItemOutcome.newAlert(symbol, draft.eventKey());
        } catch (RateLimitException e) {
            LOG.warn("Rate limited, symbol skipped: symbol={} as_of={}", symbol, asOf);
            return ItemOutcome.rateLimited(symbol, describe(e));
        } catch (Exception e) {
            LOG.error("Entry evaluation failed: symbol={} as_of={} cause={}", symbol, asOf, describe(e), e);
            return ItemOutcome.error(symbol, describe(e));
        }
    }

    private ItemOutcome processExit(Position position, LocalDate asOf) {
        String symbol = position.getSymbol();
        if (asOf.isBefore(position.getEntryDate())) {
            LOG.debug("As-of date precedes entry: symbol={} entry_date={} as_of={}",
                    symbol, position.getEntryDate(), asOf);
            return ItemOutcome.noData(symbol, "as_of before entry date");
        }
        try {
            Optional<BigDecimal> close = marketData.closeOn(symbol, asOf);
            if (close.isEmpty()) {
                LOG.debug("No close: symbol={} as_of={}", symbol, asOf);
                return ItemOutcome.noData(symbol, "close absent");
            }
            Optional<ExitSignal> signal = SignalEvaluator.evaluateExit(
                    position.getEntryPrice(),
                    close.get(),
                    position.getEntryDate(),
                    asOf
            );
            if (signal.isEmpty()) {
                return ItemOutcome.noSignal(symbol, "");
            }

            ExitSignal exit = signal.get();
            AlertDraft draft = new AlertDraft(
                    EventKeys.exit(symbol, position.getEntryDate(), asOf, exit.reason()),
                    AlertType.EXIT,
                    symbol,
                    asOf,
                    AlertMessages.exit(symbol, asOf, exit.reason(), exit.pnl(), close.get(), exit.holdingDays())
            );
            boolean inserted = store.inTransaction((positions, alerts) -> {
                // Another run closed it first; that run owns the exit alert.
                if (!positions.close(position.getId(), asOf, close.get(), exit.reason())) {
                    return false;
                }
                return alerts.recordIfAbsent(draft);
            });
            if (!inserted) {
                return ItemOutcome.duplicate(symbol, draft.eventKey());
            }
            LOG.info("Exit signal: symbol={} as_of={} reason={} pnl={} holding_days={}",
                    symbol, asOf, exit.reason(), exit.pnl(), exit.holdingDays());
            return ItemOutcome.newAlert(symbol, draft.eventKey());
        } catch (RateLimitException e) {
            LOG.warn("Rate limited, position skipped: symbol={} as_of={}", symbol, asOf);
            return ItemOutcome.rateLimited(symbol, describe(e));
        } catch (Exception e) {
            LOG.error("Exit evaluation failed: symbol={} as_of={} cause={}", symbol, asOf, describe(e), e);
            return ItemOutcome.error(symbol, describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
