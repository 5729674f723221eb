package com.example.roadcare.config;

import io.r2dbc.postgresql.client.SSLMode;
import org.junit.Test;

import static org.junit.Assert.*;

public class DatabaseConfigTest {

    @Test
    public void testParseFullUrl() {
        DatabaseConfig.DatabaseUrlInfo info = DatabaseConfig.parseR2dbcUrl(
                "r2dbc:postgresql://db.internal:5433/rcp_cd16?schema=roads&sslMode=require");

        assertEquals("db.internal", info.host);
        assertEquals(5433, info.port);
        assertEquals("rcp_cd16", info.database);
        assertEquals("roads", info.schema);
        assertEquals(SSLMode.REQUIRE, info.sslMode);
    }

    @Test
    public void testDefaultPortAndSchema() {
        DatabaseConfig.DatabaseUrlInfo info = DatabaseConfig.parseR2dbcUrl("r2dbc:postgres://localhost/roadcare");

        assertEquals("localhost", info.host);
        assertEquals(5432, info.port);
        assertEquals("roadcare", info.database);
        assertEquals("public", info.schema);
        assertEquals(SSLMode.DISABLE, info.sslMode);
    }

    @Test
    public void testUnparseableUrlFallsBackToDefaults() {
        DatabaseConfig.DatabaseUrlInfo info = DatabaseConfig.parseR2dbcUrl("jdbc:mysql://localhost:3306/x");

        assertEquals("localhost", info.host);
        assertEquals(5432, info.port);
        assertEquals("roadcare", info.database);
    }

    @Test
    public void testInvalidSslModeFallsBackToDefaults() {
        DatabaseConfig.DatabaseUrlInfo info = DatabaseConfig.parseR2dbcUrl(
                "r2dbc:postgresql://db:6000/other?sslMode=bogus");

        assertEquals("roadcare", info.database);
        assertEquals(SSLMode.DISABLE, info.sslMode);
    }
}
