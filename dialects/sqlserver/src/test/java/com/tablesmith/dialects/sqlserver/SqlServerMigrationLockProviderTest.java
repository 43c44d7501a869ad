package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.MigrationLockException;
import com.tablesmith.core.TablesmithException;
import com.tablesmith.core.migration.MigrationLock;
import com.tablesmith.core.migration.MigrationSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SqlServerMigrationLockProviderTest {

    private MigrationSession session;
    private SqlServerMigrationLockProvider provider;

    @BeforeEach
    void setUp() {
        session = mock(MigrationSession.class);
        provider = new SqlServerMigrationLockProvider(session, 5000);
    }

    @Test
    void acquiresAnExclusiveSessionLock() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(0);

        MigrationLock lock = provider.acquire("App.Migrations");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(session).executeScalar(sql.capture(), eq(35));
        assertTrue(sql.getValue().contains("sp_getapplock"));
        assertTrue(sql.getValue().contains("@Resource = N'App.Migrations'"));
        assertTrue(sql.getValue().contains("@LockMode = 'Exclusive'"));
        assertTrue(sql.getValue().contains("@LockOwner = 'Session'"));
        assertTrue(sql.getValue().contains("@LockTimeout = 5000"));
        assertEquals("App.Migrations", lock.scope());
    }

    @Test
    void grantedAfterWaitingIsStillALock() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(1);

        assertNotNull(provider.acquire("App.Migrations"));
    }

    @Test
    void timeoutIsALockFailure() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(-1);

        MigrationLockException e = assertThrows(MigrationLockException.class, () -> provider.acquire("App.Migrations"));

        assertEquals("App.Migrations", e.getScope());
        assertTrue(e.getMessage().contains("code=-1"), e.getMessage());
        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
    }

    @Test
    void deadlockIsALockFailure() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(-3);

        MigrationLockException e = assertThrows(MigrationLockException.class, () -> provider.acquire("S"));

        assertTrue(e.getMessage().contains("deadlock"), e.getMessage());
    }

    @Test
    void missingResultIsALockFailure() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(null);

        assertThrows(MigrationLockException.class, () -> provider.acquire("S"));
    }

    @Test
    void sqlErrorsAreWrapped() {
        TablesmithException failure = new TablesmithException("permission denied");
        when(session.executeScalar(anyString(), anyInt())).thenThrow(failure);

        MigrationLockException e = assertThrows(MigrationLockException.class, () -> provider.acquire("S"));

        assertSame(failure, e.getCause());
    }

    @Test
    void releaseRunsOnceOnly() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(0);
        MigrationLock lock = provider.acquire("App.Migrations");

        lock.close();
        lock.close();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(session, times(1)).executeNonQuery(sql.capture(), anyInt());
        assertTrue(sql.getValue().contains("sp_releaseapplock"));
        assertTrue(sql.getValue().contains("@Resource = N'App.Migrations'"));
    }

    @Test
    void scopeIsEscaped() {
        when(session.executeScalar(anyString(), anyInt())).thenReturn(0);

        provider.acquire("it's");

        verify(session).executeScalar(contains("N'it''s'"), anyInt());
    }
}
