package com.crossfire.service;

import com.crossfire.api.OutputFormat;
import com.crossfire.materializer.ResultMaterializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcQueryExecutorTest {
    private static HikariDataSource dataSource;

    private final ResultMaterializer materializer = new ResultMaterializer(new ObjectMapper());

    @BeforeAll
    static void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:executor;DB_CLOSE_DELAY=-1");
        config.setMaximumPoolSize(2);
        dataSource = new HikariDataSource(config);
    }

    @AfterAll
    static void tearDown() {
        dataSource.close();
    }

    @Test
    void handsResultSetToHandler() {
        JdbcQueryExecutor executor = new JdbcQueryExecutor(dataSource);
        String sql = "SELECT * FROM (VALUES ('Apple', 10), ('Pear', 7)) "
                + "AS t(\"[Product].[Product].[Product].[MEMBER_CAPTION]\", \"[Measures].[Sales Amount]\")";

        Map<String, List<String>> dictionary = executor.execute(sql, materializer::toDictionary);

        assertThat(dictionary.get("Product")).containsExactly("Apple", "Pear");
        assertThat(dictionary.get("Sales Amount")).containsExactly("10", "7");
    }

    @Test
    void statementWithoutResultSetGivesEmptyResponse() {
        JdbcQueryExecutor executor = new JdbcQueryExecutor(dataSource);

        String result = executor.execute("CREATE TABLE IF NOT EXISTS scratch (id INT)",
                cursor -> materializer.materialize(cursor, OutputFormat.TABLE));

        assertThat(result).isEqualTo(ResultMaterializer.EMPTY_RESPONSE);
    }

    @Test
    void backendErrorsAreWrapped() {
        JdbcQueryExecutor executor = new JdbcQueryExecutor(dataSource);

        assertThatThrownBy(() -> executor.execute("SELECT * FROM missing_table", cursor -> cursor))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageStartingWith("Failed to execute query");
    }

    @Test
    void unreachableServerIsReportedAsConnectionFailure() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:tcp://localhost:1/unreachable");
        config.setConnectionTimeout(250);
        config.setInitializationFailTimeout(-1);
        config.setMaximumPoolSize(1);
        try (HikariDataSource unreachable = new HikariDataSource(config)) {
            JdbcQueryExecutor executor = new JdbcQueryExecutor(unreachable);

            assertThatThrownBy(() -> executor.execute("SELECT 1", cursor -> cursor))
                    .isInstanceOf(ModelServerConnectionException.class)
                    .hasMessageStartingWith("Model server unavailable");
        }
    }

    @Test
    void connectionFailuresAreRecognizedBySqlState() {
        assertThat(JdbcQueryExecutor.isConnectionFailure(new SQLException("refused", "08001"))).isTrue();
        assertThat(JdbcQueryExecutor.isConnectionFailure(new SQLTransientConnectionException("pool timeout"))).isTrue();
        assertThat(JdbcQueryExecutor.isConnectionFailure(new SQLException("no such table", "42S02"))).isFalse();
        assertThat(JdbcQueryExecutor.isConnectionFailure(new SQLException("unknown"))).isFalse();
    }
}
