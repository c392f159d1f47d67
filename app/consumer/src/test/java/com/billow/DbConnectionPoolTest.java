package com.billow;

import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.SQLException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DbConnectionPoolTest {
    private DbConnectionPool dbConnectionPool;

    @BeforeEach
    public void setUp() {
        dbConnectionPool = new DbConnectionPool("dummy");
    }

    @Test
    public void testGetConnectionNewConnection() {
        assertThrows(SQLException.class, () -> dbConnectionPool.getConnection());
    }

    @Test
    public void testExecuteWithoutConnection() {
        assertThrows(SQLException.class, () -> dbConnectionPool.execute(connection -> 1));
    }

    @Test
    public void testCloseEmptyPool() throws SQLException {
        dbConnectionPool.close();
        assertThrows(SQLException.class, () -> dbConnectionPool.getConnection());
    }
}
