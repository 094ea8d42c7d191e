package com.earningsbot.db;

import com.earningsbot.db.mybatis.MyBatisSupport;
import com.earningsbot.store.SignalStore;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * PostgreSQL-backed {@link SignalStore}. Each unit of work runs on its own connection and
 * commits once; any failure rolls the whole unit back.
 */
public final class PgSignalStore implements SignalStore {
    private static final Logger LOG = LogManager.getLogger(PgSignalStore.class);

    private final Database database;
    private final Clock clock;

    public PgSignalStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public <T> T inTransaction(Work<T> work) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(new PositionDao(session, clock), new AlertDao(session, clock));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            LOG.warn("rollback failed: {}", rollbackError.getMessage());
            cause.addSuppressed(rollbackError);
        }
    }
}
