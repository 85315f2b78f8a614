package com.crossfire.service;

import com.crossfire.materializer.JdbcTabularCursor;
import com.crossfire.materializer.TabularCursor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.function.Function;

/**
 * {@link QueryExecutor} that sends query text to a pooled JDBC data source.
 *
 * <p>Connection failures (SQLSTATE class {@code 08}, or a pool that cannot hand out a connection)
 * surface as {@link ModelServerConnectionException}.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {
    private final DataSource dataSource;

    public JdbcQueryExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <R> R execute(String queryText, Function<TabularCursor, R> handler) {
        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            boolean hasResultSet = st.execute(queryText);
            if (!hasResultSet) {
                return handler.apply(null);
            }
            try (ResultSet rs = st.getResultSet()) {
                R result = handler.apply(rs != null ? new JdbcTabularCursor(rs) : null);
                log.debug("Query executed: duration_ms={}", System.currentTimeMillis() - startTime);
                return result;
            }
        } catch (SQLException e) {
            if (isConnectionFailure(e)) {
                throw new ModelServerConnectionException("Model server unavailable: " + e.getMessage(), e);
            }
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e);
        }
    }

    static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("08");
    }
}
