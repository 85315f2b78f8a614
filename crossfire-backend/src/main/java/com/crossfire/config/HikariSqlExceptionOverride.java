package com.crossfire.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Keeps pooled connections alive for SQL errors that say nothing about the connection itself.
 *
 * <p>Two classes of error are expected during normal operation:
 * <ul>
 *   <li>feature not supported (SQLSTATE {@code 0A}), reported by OLAP drivers for statements they
 *   do not implement;</li>
 *   <li>integrity constraint violations (SQLSTATE {@code 23}), hit when two cache writers insert the
 *   same group key and session id concurrently.</li>
 * </ul>
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLIntegrityConstraintViolationException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("23"))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
