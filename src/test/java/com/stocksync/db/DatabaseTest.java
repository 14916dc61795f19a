package com.stocksync.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DatabaseTest {

    @Test
    void dialectFollowsJdbcUrl() {
        assertEquals(Database.Dialect.SQLSERVER, Database.dialectOf("jdbc:sqlserver://erp:1433;databaseName=x3"));
        assertEquals(Database.Dialect.POSTGRES, Database.dialectOf("JDBC:POSTGRESQL://localhost:5432/x3"));
        assertThrows(IllegalArgumentException.class, () -> Database.dialectOf("jdbc:mysql://localhost/x3"));
    }

    @Test
    void schemaDefaultsPerDialect() {
        Database sqlServer = new Database("jdbc:sqlserver://erp:1433;databaseName=x3", "x3", "secret", null);
        Database postgres = new Database("jdbc:postgresql://localhost:5432/x3", "x3", "secret", " ");

        assertEquals("dbo", sqlServer.schema());
        assertEquals("public", postgres.schema());
    }

    @Test
    void passwordIsMaskedInUrl() {
        Database database = new Database("jdbc:sqlserver://erp:1433;databaseName=x3;user=x3;password=s3cr3t", null, null, "X3PROD");

        String masked = database.maskedJdbcUrl();

        assertFalse(masked.contains("s3cr3t"));
        assertEquals("jdbc:sqlserver://erp:1433;databaseName=x3;user=x3;password=***", masked);
        assertEquals("X3PROD", database.schema());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Database(" ", "x3", "secret", "dbo"));
        assertThrows(IllegalArgumentException.class, () -> new Database("jdbc:sqlserver://erp:1433", "x3", "secret", "dbo; drop"));
    }
}
