package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.migration.MigrationSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SqlServerMigrationHistoryRepositoryTest {

    @Mock
    private MigrationSession session;
    private SqlServerMigrationHistoryRepository history;

    @BeforeEach
    void setUp() {
        history = new SqlServerMigrationHistoryRepository(session);
    }

    @Test
    void ensureCreatedGuardsSchemaAndTable() {
        history.ensureCreated();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(session, times(2)).executeNonQuery(sql.capture(), anyInt());

        String schema = sql.getAllValues().get(0);
        assertEquals("IF NOT EXISTS (SELECT 1 FROM sys.schemas WHERE name = N'dbo')\n"
                + "    EXEC(N'CREATE SCHEMA [dbo]');", schema);

        String table = sql.getAllValues().get(1);
        assertTrue(table.startsWith("IF OBJECT_ID(N'[dbo].[__TablesmithMigrationsHistory]', N'U') IS NULL"), table);
        assertTrue(table.contains("CREATE TABLE [dbo].[__TablesmithMigrationsHistory]"), table);
        assertTrue(table.contains("[MigrationId]    NVARCHAR(150) NOT NULL"), table);
        assertTrue(table.contains("CONSTRAINT [PK___TablesmithMigrationsHistory] PRIMARY KEY ([MigrationId])"), table);
    }

    @Test
    void customLocationIsQuoted() {
        new SqlServerMigrationHistoryRepository(session, "ops", "Schema History").ensureCreated();

        verify(session).executeNonQuery(contains("CREATE TABLE [ops].[Schema History]"), anyInt());
    }

    @Test
    void appliedIdsAreSorted() {
        when(session.queryStrings(anyString(), anyInt())).thenReturn(List.of("002_B", "001_A"));

        assertEquals(List.of("001_A", "002_B"), List.copyOf(history.getAppliedIds()));
        verify(session).queryStrings(
                eq("SELECT [MigrationId] FROM [dbo].[__TablesmithMigrationsHistory] ORDER BY [MigrationId];"), anyInt());
    }

    @Test
    void insertWritesAnEscapedRowInUtc() {
        history.insert("001_O'Brien", "AddOBrien", "Tablesmith", Instant.parse("2024-03-01T10:15:30.5Z"));

        verify(session).executeNonQuery(eq(
                "INSERT INTO [dbo].[__TablesmithMigrationsHistory] ([MigrationId], [Name], [ProductVersion], [AppliedAtUtc])\n"
                        + "VALUES (N'001_O''Brien', N'AddOBrien', N'Tablesmith', '2024-03-01T10:15:30.5000000');"),
                anyInt());
    }

    @Test
    void insertRejectsMissingValuesBeforeTouchingTheSession() {
        Instant at = Instant.parse("2024-03-01T10:15:30Z");

        NullPointerException e = assertThrows(NullPointerException.class,
                () -> history.insert("001_Init", "Init", null, at));
        assertTrue(e.getMessage().contains("productVersion"), e.getMessage());
        assertThrows(NullPointerException.class, () -> history.insert(null, "Init", "Tablesmith", at));
        assertThrows(NullPointerException.class, () -> history.insert("001_Init", null, "Tablesmith", at));
        verifyNoInteractions(session);
    }
}
