package in.signalbridge.infrastructure.persistence;

import in.signalbridge.application.port.output.ProductRepository;
import in.signalbridge.domain.exception.RepositoryException;
import in.signalbridge.domain.product.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of ProductRepository.
 *
 * saveProducts replaces the whole table in one transaction.
 */
public final class PostgresProductRepository implements ProductRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresProductRepository.class);

    private static final String COLUMNS =
        "product_id, symbol, underlying_asset, quoting_asset, tick_size, min_size, max_size, last_updated";

    private final DataSource dataSource;

    public PostgresProductRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void saveProducts(List<Product> products) {
        String insert = "INSERT INTO products (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement delete = conn.createStatement();
                 PreparedStatement ps = conn.prepareStatement(insert)) {

                delete.executeUpdate("DELETE FROM products");
                for (Product p : products) {
                    ps.setLong(1, p.productId());
                    ps.setString(2, p.symbol());
                    ps.setString(3, p.underlyingAsset());
                    ps.setString(4, p.quotingAsset());
                    ps.setBigDecimal(5, p.tickSize());
                    ps.setBigDecimal(6, p.minSize());
                    ps.setBigDecimal(7, p.maxSize());
                    ps.setTimestamp(8, Timestamp.from(p.lastUpdated() != null ? p.lastUpdated() : Instant.now()));
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
                log.info("Saved {} products", products.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to save products: {}", e.getMessage(), e);
            throw new RepositoryException("Failed to save products", e);
        }
    }

    @Override
    public Optional<Product> getProductBySymbol(String symbol) {
        String sql = "SELECT " + COLUMNS + " FROM products WHERE symbol = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, symbol);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProduct(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to load product {}: {}", symbol, e.getMessage(), e);
            throw new RepositoryException("Failed to load product " + symbol, e);
        }
    }

    @Override
    public List<Product> getAllProducts() {
        String sql = "SELECT " + COLUMNS + " FROM products ORDER BY symbol";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Product> products = new ArrayList<>();
            while (rs.next()) {
                products.add(mapProduct(rs));
            }
            return products;
        } catch (SQLException e) {
            log.error("Failed to list products: {}", e.getMessage(), e);
            throw new RepositoryException("Failed to list products", e);
        }
    }

    @Override
    public Optional<Instant> getProductsLastUpdated() {
        String sql = "SELECT MAX(last_updated) AS last_updated FROM products";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                Timestamp ts = rs.getTimestamp("last_updated");
                return Optional.ofNullable(ts).map(Timestamp::toInstant);
            }
            return Optional.empty();
        } catch (SQLException e) {
            log.error("Failed to read products last-updated: {}", e.getMessage(), e);
            throw new RepositoryException("Failed to read products last-updated", e);
        }
    }

    private static Product mapProduct(ResultSet rs) throws SQLException {
        return new Product(
            rs.getLong("product_id"),
            rs.getString("symbol"),
            rs.getString("underlying_asset"),
            rs.getString("quoting_asset"),
            rs.getBigDecimal("tick_size"),
            rs.getBigDecimal("min_size"),
            rs.getBigDecimal("max_size"),
            rs.getTimestamp("last_updated").toInstant());
    }
}
