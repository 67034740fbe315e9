package in.signalbridge.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.application.port.output.TradeRepository;
import in.signalbridge.domain.exception.RepositoryException;
import in.signalbridge.domain.trade.CloseReason;
import in.signalbridge.domain.trade.Trade;
import in.signalbridge.domain.trade.TradeEvent;
import in.signalbridge.domain.trade.TradeSide;
import in.signalbridge.domain.trade.TradeStatus;
import in.signalbridge.domain.trade.TradingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of TradeRepository.
 *
 * Tables trades and trade_events are created by migrations outside this service.
 */
public final class PostgresTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeRepository.class);

    private static final String TRADE_COLUMNS = """
            id, symbol, side, quantity, signal_entry_price, stop_loss, take_profit,
            signal_payload, simulated, status, actual_entry_price, exchange_order_id,
            pnl, fees, fail_reason, exit_price, close_reason, created_at, open_time, close_time
            """;

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresTradeRepository(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public Trade saveTrade(Trade t) {
        String sql = """
                INSERT INTO trades (
                    symbol, side, quantity, signal_entry_price, stop_loss, take_profit,
                    signal_payload, simulated, status, actual_entry_price, exchange_order_id,
                    pnl, fees, fail_reason, exit_price, close_reason, created_at, open_time, close_time,
                    updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, new String[] {"id"})) {

            ps.setString(1, t.symbol());
            ps.setString(2, t.side() == null ? null : t.side().name());
            ps.setBigDecimal(3, t.quantity());
            ps.setBigDecimal(4, t.signalEntryPrice());
            ps.setBigDecimal(5, t.stopLoss());
            ps.setBigDecimal(6, t.takeProfit());
            ps.setString(7, t.signalPayload());
            ps.setBoolean(8, t.simulated());
            ps.setString(9, t.status().name());
            bindLifecycle(ps, 10, t);
            ps.setTimestamp(17, timestamp(t.createdAt() != null ? t.createdAt() : Instant.now()));
            ps.setTimestamp(18, timestamp(t.openTime()));
            ps.setTimestamp(19, timestamp(t.closeTime()));
            ps.setTimestamp(20, timestamp(Instant.now()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new RepositoryException("No id generated for trade on " + t.symbol());
                }
                Trade saved = t.withId(keys.getLong(1));
                log.debug("Trade saved: {} {} {}", saved.id(), saved.symbol(), saved.status());
                return saved;
            }
        } catch (SQLException e) {
            log.error("Failed to save trade for {}: {}", t.symbol(), e.getMessage(), e);
            throw new RepositoryException("Failed to save trade", e);
        }
    }

    @Override
    public void updateTrade(Trade t) {
        String sql = """
                UPDATE trades SET
                    symbol = ?, stop_loss = ?, take_profit = ?, status = ?,
                    actual_entry_price = ?, exchange_order_id = ?, pnl = ?, fees = ?,
                    fail_reason = ?, exit_price = ?, close_reason = ?,
                    open_time = ?, close_time = ?, updated_at = ?
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, t.symbol());
            ps.setBigDecimal(2, t.stopLoss());
            ps.setBigDecimal(3, t.takeProfit());
            ps.setString(4, t.status().name());
            bindLifecycle(ps, 5, t);
            ps.setTimestamp(12, timestamp(t.openTime()));
            ps.setTimestamp(13, timestamp(t.closeTime()));
            ps.setTimestamp(14, timestamp(Instant.now()));
            ps.setLong(15, t.id());

            int rows = ps.executeUpdate();
            if (rows == 0) {
                throw new RepositoryException("Trade not found for update: " + t.id());
            }
        } catch (SQLException e) {
            log.error("Failed to update trade {}: {}", t.id(), e.getMessage(), e);
            throw new RepositoryException("Failed to update trade " + t.id(), e);
        }
    }

    @Override
    public Optional<Trade> getTrade(long id) {
        String sql = "SELECT " + TRADE_COLUMNS + " FROM trades WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTrade(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to load trade {}: {}", id, e.getMessage(), e);
            throw new RepositoryException("Failed to load trade " + id, e);
        }
    }

    @Override
    public List<Trade> getActiveTrades() {
        return findByStatus(TradeStatus.ACTIVE);
    }

    @Override
    public List<Trade> findByStatus(TradeStatus status) {
        String sql = "SELECT " + TRADE_COLUMNS + " FROM trades WHERE status = ? ORDER BY created_at ASC, id ASC";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            List<Trade> trades = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    trades.add(mapTrade(rs));
                }
            }
            return trades;
        } catch (SQLException e) {
            log.error("Failed to list {} trades: {}", status, e.getMessage(), e);
            throw new RepositoryException("Failed to list trades by status", e);
        }
    }

    @Override
    public TradeEvent addTradeEvent(TradeEvent event) {
        String sql = """
                INSERT INTO trade_events (trade_id, action, details, created_at)
                VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, new String[] {"id"})) {

            ps.setLong(1, event.tradeId());
            ps.setString(2, event.action());
            ps.setString(3, event.details() == null ? null : mapper.writeValueAsString(event.details()));
            ps.setTimestamp(4, timestamp(event.timestamp()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                Long id = keys.next() ? keys.getLong(1) : null;
                return new TradeEvent(id, event.tradeId(), event.action(), event.details(), event.timestamp());
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to append {} event for trade {}: {}", event.action(), event.tradeId(), e.getMessage(), e);
            throw new RepositoryException("Failed to append trade event", e);
        }
    }

    @Override
    public List<TradeEvent> getTradeEvents(long tradeId) {
        String sql = """
                SELECT id, trade_id, action, details, created_at
                FROM trade_events
                WHERE trade_id = ?
                ORDER BY created_at ASC, id ASC
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, tradeId);
            List<TradeEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String details = rs.getString("details");
                    JsonNode json = details == null ? null : mapper.readTree(details);
                    events.add(new TradeEvent(rs.getLong("id"), rs.getLong("trade_id"),
                        rs.getString("action"), json, rs.getTimestamp("created_at").toInstant()));
                }
            }
            return events;
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to load events for trade {}: {}", tradeId, e.getMessage(), e);
            throw new RepositoryException("Failed to load trade events", e);
        }
    }

    @Override
    public TradingStats getTradingStats() {
        String sql = """
                SELECT
                    COUNT(*) AS total_trades,
                    SUM(CASE WHEN status = 'CLOSED' THEN 1 ELSE 0 END) AS closed_trades,
                    SUM(CASE WHEN status = 'ACTIVE' THEN 1 ELSE 0 END) AS active_trades,
                    SUM(CASE WHEN status = 'FAILED' THEN 1 ELSE 0 END) AS failed_trades,
                    SUM(CASE WHEN status = 'CLOSED' AND pnl > 0 THEN 1 ELSE 0 END) AS winning_trades,
                    SUM(CASE WHEN status = 'CLOSED' AND pnl < 0 THEN 1 ELSE 0 END) AS losing_trades,
                    COALESCE(SUM(CASE WHEN status = 'CLOSED' THEN pnl END), 0) AS total_pnl,
                    COALESCE(AVG(CASE WHEN status = 'CLOSED' THEN pnl END), 0) AS avg_pnl,
                    COALESCE(MAX(CASE WHEN status = 'CLOSED' THEN pnl END), 0) AS max_win,
                    COALESCE(MIN(CASE WHEN status = 'CLOSED' THEN pnl END), 0) AS max_loss
                FROM trades
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (!rs.next()) {
                return TradingStats.empty();
            }
            return new TradingStats(
                rs.getLong("total_trades"),
                rs.getLong("closed_trades"),
                rs.getLong("active_trades"),
                rs.getLong("failed_trades"),
                rs.getLong("winning_trades"),
                rs.getLong("losing_trades"),
                rs.getBigDecimal("total_pnl"),
                rs.getBigDecimal("avg_pnl"),
                rs.getBigDecimal("max_win"),
                rs.getBigDecimal("max_loss"));
        } catch (SQLException e) {
            log.error("Failed to compute trading stats: {}", e.getMessage(), e);
            throw new RepositoryException("Failed to compute trading stats", e);
        }
    }

    /**
     * Binds actual_entry_price .. close_reason (7 columns) starting at index.
     */
    private static void bindLifecycle(PreparedStatement ps, int index, Trade t) throws SQLException {
        ps.setBigDecimal(index, t.actualEntryPrice());
        ps.setString(index + 1, t.exchangeOrderId());
        ps.setBigDecimal(index + 2, t.pnl());
        ps.setBigDecimal(index + 3, t.fees());
        ps.setString(index + 4, t.failReason());
        ps.setBigDecimal(index + 5, t.exitPrice());
        if (t.closeReason() == null) {
            ps.setNull(index + 6, Types.VARCHAR);
        } else {
            ps.setString(index + 6, t.closeReason().code());
        }
    }

    private static Trade mapTrade(ResultSet rs) throws SQLException {
        String side = rs.getString("side");
        String closeReason = rs.getString("close_reason");
        return new Trade(
            rs.getLong("id"),
            rs.getString("symbol"),
            side == null ? null : TradeSide.valueOf(side),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("signal_entry_price"),
            rs.getBigDecimal("stop_loss"),
            rs.getBigDecimal("take_profit"),
            rs.getString("signal_payload"),
            rs.getBoolean("simulated"),
            TradeStatus.valueOf(rs.getString("status")),
            rs.getBigDecimal("actual_entry_price"),
            rs.getString("exchange_order_id"),
            rs.getBigDecimal("pnl"),
            zeroIfNull(rs.getBigDecimal("fees")),
            rs.getString("fail_reason"),
            rs.getBigDecimal("exit_price"),
            closeReason == null ? null : CloseReason.fromCode(closeReason),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("open_time")),
            instant(rs.getTimestamp("close_time")));
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
