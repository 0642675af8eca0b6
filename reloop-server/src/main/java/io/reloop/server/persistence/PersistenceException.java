package io.reloop.server.persistence;

import java.io.Serial;

/// Unchecked exception for database persistence failures.
///
/// Wraps {@link java.sql.SQLException} so that
/// {@link io.reloop.core.checkpoint.CheckpointStore}, which declares no checked
/// exceptions, can be backed by JDBC.
///
/// @see JdbcCheckpointStore
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3518840263715209174L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
