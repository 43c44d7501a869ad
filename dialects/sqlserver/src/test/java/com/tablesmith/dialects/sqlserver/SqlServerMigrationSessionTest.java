package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.TablesmithException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SqlServerMigrationSessionTest {

    private Connection connection;
    private Statement statement;
    private SqlServerMigrationSession session;

    @BeforeEach
    void setUp() throws SQLException {
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
        session = new SqlServerMigrationSession(connection);
    }

    @Test
    void transactionTogglesAutoCommit() throws SQLException {
        session.beginTransaction();
        assertTrue(session.isInTransaction());

        session.commit();

        assertFalse(session.isInTransaction());
        verify(connection).setAutoCommit(false);
        verify(connection).commit();
        verify(connection).setAutoCommit(true);
    }

    @Test
    void nestedTransactionsAreRejected() {
        session.beginTransaction();

        assertThrows(IllegalStateException.class, () -> session.beginTransaction());
    }

    @Test
    void commitWithoutTransactionIsRejected() {
        assertThrows(IllegalStateException.class, () -> session.commit());
    }

    @Test
    void rollbackOutsideTransactionDoesNothing() throws SQLException {
        session.rollback();

        verify(connection, never()).rollback();
    }

    @Test
    void rollbackFailureIsNotRethrown() throws SQLException {
        doThrow(new SQLException("link down")).when(connection).rollback();
        session.beginTransaction();

        session.rollback();

        assertFalse(session.isInTransaction());
        verify(connection).setAutoCommit(true);
    }

    @Test
    void nonQuerySumsUpdateCountsAndAppliesTimeout() throws SQLException {
        when(statement.execute("UPDATE x;")).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(2, 3, -1);
        when(statement.getMoreResults()).thenReturn(false);

        assertEquals(5, session.executeNonQuery("UPDATE x;", 45));

        verify(statement).setQueryTimeout(45);
        verify(statement).close();
    }

    @Test
    void nonQueryDrainsResultSets() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(statement.execute("EXEC p;")).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(statement.getMoreResults()).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(-1);

        assertEquals(0, session.executeNonQuery("EXEC p;", 10));

        verify(rs).close();
    }

    @Test
    void failedBatchRollsBackAndReportsTheServerError() throws SQLException {
        when(statement.execute("BAD;")).thenThrow(new SQLException("Incorrect syntax near 'BAD'.", "S0001", 102));
        session.beginTransaction();

        TablesmithException e = assertThrows(TablesmithException.class, () -> session.executeNonQuery("BAD;", 30));

        assertTrue(e.getMessage().contains("error 102"), e.getMessage());
        assertTrue(e.getMessage().contains("BAD;"), e.getMessage());
        assertFalse(session.isInTransaction());
        verify(connection).rollback();
    }

    @Test
    void scalarReadsTheFirstColumnOfTheFirstRow() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(statement.execute(anyString())).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(0);

        assertEquals(0, session.executeScalar("SELECT 0;", 5));
    }

    @Test
    void scalarSkipsLeadingUpdateCounts() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(1);
        when(statement.getMoreResults()).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getObject(1)).thenReturn(1);

        assertEquals(1, session.executeScalar("DECLARE @r INT; EXEC @r = p; SELECT @r;", 5));
    }

    @Test
    void scalarWithoutRowsIsNull() throws SQLException {
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(-1);

        assertNull(session.executeScalar("EXEC p;", 5));
    }

    @Test
    void queryStringsReadsEveryRow() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(statement.execute(anyString())).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getString(1)).thenReturn("001_A", "002_B");

        assertEquals(List.of("001_A", "002_B"), session.queryStrings("SELECT id;", 5));
    }

    @Test
    void cancelStopsTheNextStatement() throws SQLException {
        session.beginTransaction();
        session.cancel();

        assertThrows(CancellationException.class, () -> session.executeNonQuery("SELECT 1;", 5));

        verify(connection, never()).createStatement();
        verify(connection).rollback();
        assertFalse(session.isInTransaction());
    }

    @Test
    void cancelDuringAStatementIsReportedAsCancellation() throws SQLException {
        when(statement.execute(anyString())).thenAnswer(invocation -> {
            session.cancel();
            throw new SQLException("The query was canceled.");
        });

        CancellationException e = assertThrows(CancellationException.class,
                () -> session.executeNonQuery("WAITFOR DELAY '00:01';", 5));

        assertInstanceOf(SQLException.class, e.getCause());
        verify(statement).cancel();
    }

    @Test
    void closeRollsBackAnOpenTransaction() throws SQLException {
        session.beginTransaction();

        session.close();

        verify(connection).rollback();
        verify(connection).close();
    }
}
