package com.catdb.registry;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps pooled connections alive through errors that belong to the statement, not the connection.
 *
 * <p>User SQL fails all the time in an interactive client: syntax errors, missing tables,
 * constraint violations, unsupported features. None of those should cost a physical connection.
 */
public class LiveConnectionExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }
        String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return Override.CONTINUE_EVICT;
        }
        switch (sqlState.substring(0, 2)) {
            case "0A": // feature not supported
            case "22": // data exception
            case "23": // integrity constraint violation
            case "42": // syntax error or access rule violation
                return Override.DO_NOT_EVICT;
            default:
                return Override.CONTINUE_EVICT;
        }
    }
}
