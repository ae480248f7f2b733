package org.iceforge.efsguard.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a physical connection to the protected database.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @param loginTimeoutSeconds the data source's login timeout; 0 means driver default
     */
    Connection open(int loginTimeoutSeconds) throws SQLException;
}
