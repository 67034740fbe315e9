package in.signalbridge.service.trade;

import in.signalbridge.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveTradeIndex - the in-memory set of ACTIVE trades.
 *
 * STRUCTURE:
 * - Map<tradeId, Trade> holding the latest ACTIVE version of each trade
 * - Map<symbol, Set<tradeId>> so the monitor can price each symbol once
 *
 * Owned by one TradeLifecycleEngine and mutated only by it (on activation, close
 * and startup recovery). Readers get snapshots.
 */
public final class ActiveTradeIndex {
    private static final Logger log = LoggerFactory.getLogger(ActiveTradeIndex.class);

    private final Map<Long, Trade> trades = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> symbolToTrades = new ConcurrentHashMap<>();

    /**
     * Replace the index contents (startup).
     */
    public void rebuild(List<Trade> activeTrades) {
        trades.clear();
        symbolToTrades.clear();
        for (Trade trade : activeTrades) {
            put(trade);
        }
        log.info("ActiveTradeIndex rebuilt: {} symbols, {} active trades",
            symbolToTrades.size(), trades.size());
    }

    public void put(Trade trade) {
        if (trade.id() == null) {
            throw new IllegalArgumentException("Cannot index a trade without id");
        }
        Trade previous = trades.put(trade.id(), trade);
        if (previous != null && !previous.symbol().equals(trade.symbol())) {
            unlinkSymbol(trade.id(), previous.symbol());
        }
        symbolToTrades.computeIfAbsent(trade.symbol(), k -> ConcurrentHashMap.newKeySet()).add(trade.id());
        log.debug("Trade added to index: {} → {}", trade.id(), trade.symbol());
    }

    public Optional<Trade> remove(long tradeId) {
        Trade removed = trades.remove(tradeId);
        if (removed != null) {
            unlinkSymbol(tradeId, removed.symbol());
            log.debug("Trade removed from index: {} (was {})", tradeId, removed.symbol());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Trade> get(long tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    public boolean contains(long tradeId) {
        return trades.containsKey(tradeId);
    }

    /**
     * All active trades ordered by id.
     */
    public List<Trade> snapshot() {
        List<Trade> list = new ArrayList<>(trades.values());
        list.sort(Comparator.comparing(Trade::id));
        return list;
    }

    public Set<Long> tradesFor(String symbol) {
        Set<Long> ids = symbolToTrades.get(symbol);
        return ids != null ? new HashSet<>(ids) : Collections.emptySet();
    }

    public Set<String> symbols() {
        return new HashSet<>(symbolToTrades.keySet());
    }

    public int size() {
        return trades.size();
    }

    private void unlinkSymbol(long tradeId, String symbol) {
        Set<Long> ids = symbolToTrades.get(symbol);
        if (ids != null) {
            ids.remove(tradeId);
            if (ids.isEmpty()) {
                symbolToTrades.remove(symbol);
            }
        }
    }
}
