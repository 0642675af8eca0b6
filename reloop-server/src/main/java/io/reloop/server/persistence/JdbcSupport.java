package io.reloop.server.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Small JDBC helper for the store implementations.
///
/// SQL lives in `static final` constants and parameters are always bound through a
/// {@link StatementPreparer}, so statements are never built by concatenation.
///
/// Single statements run on their own pooled connection. Multi-statement work that
/// must commit atomically goes through {@link #inTransaction}, whose callback
/// receives the connection and uses the connection-scoped overloads.
///
/// ### Contracts
/// - **Precondition**: {@link DataSource} is a valid Agroal-managed pool
/// - **Postcondition**: every acquired connection is released via try-with-resources
/// - **Postcondition**: a transaction is rolled back when its callback throws
///
/// @implNote Thread-safe. Stateless beyond the injected {@link DataSource}.
///
/// @see JdbcCheckpointStore
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT, UPDATE, or DELETE statement on its own connection.
    ///
    /// @param sql the SQL statement, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return update(conn, sql, preparer);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Executes a SELECT returning zero or one mapped row on its own connection.
    ///
    /// @param <T> the domain type produced by the mapper
    /// @param sql the SELECT statement, not null
    /// @param preparer binds parameters to the statement, not null
    /// @param mapper converts a {@link ResultSet} row to a domain object, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return the mapped row if present, empty otherwise, never null
    /// @throws PersistenceException if the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return queryOne(conn, sql, preparer, mapper);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Runs a unit of work in a single transaction.
    ///
    /// Commits when the callback returns. Rolls back and rethrows when it throws,
    /// so domain exceptions raised inside the callback reach the caller unchanged.
    ///
    /// @param <T> the result type
    /// @param work the transactional work, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return the callback's result, may be null
    /// @throws PersistenceException if a statement, the commit or the rollback fails
    <T> T inTransaction(TransactionWork<T> work, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    static int update(Connection conn, String sql, StatementPreparer preparer)
            throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        }
    }

    static <T> Optional<T> queryOne(
            Connection conn, String sql, StatementPreparer preparer, RowMapper<T> mapper)
            throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    static <T> List<T> queryList(
            Connection conn, String sql, StatementPreparer preparer, RowMapper<T> mapper)
            throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        }
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    ///
    /// {@snippet :
    /// StatementPreparer binder = ps -> {
    ///     ps.setString(1, taskId);
    ///     ps.setLong(2, sequence);
    /// };
    /// }
    @FunctionalInterface
    interface StatementPreparer {

        /// Binds parameters to the prepared statement.
        ///
        /// @param ps the statement to bind parameters to, not null
        /// @throws SQLException if parameter binding fails
        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps a single {@link ResultSet} row to a domain object.
    ///
    /// @param <T> the domain type to produce
    @FunctionalInterface
    interface RowMapper<T> {

        /// Maps the current row to a domain object.
        ///
        /// @param rs positioned at the current row, not null
        /// @return the mapped domain object, not null
        /// @throws SQLException if column access fails
        T map(ResultSet rs) throws SQLException;
    }

    /// Work executed inside {@link #inTransaction}.
    ///
    /// @param <T> the result type
    @FunctionalInterface
    interface TransactionWork<T> {

        /// Performs the work on the transaction's connection.
        ///
        /// @param conn connection with auto-commit disabled, not null
        /// @return the result, may be null
        /// @throws SQLException if a statement fails
        T execute(Connection conn) throws SQLException;
    }
}
