package com.earningsbot.db;

import com.earningsbot.db.mybatis.MyBatisSupport;
import com.earningsbot.db.mybatis.SymbolCacheMapper;
import com.earningsbot.db.mybatis.SymbolCacheRow;
import com.earningsbot.universe.SymbolCacheStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SymbolCacheDao implements SymbolCacheStore {
    private final Database database;

    public SymbolCacheDao(Database database) {
        this.database = database;
    }

    @Override
    public Map<String, OffsetDateTime> loadAll() throws SQLException {
        Map<String, OffsetDateTime> out = new LinkedHashMap<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            SymbolCacheMapper mapper = session.getMapper(SymbolCacheMapper.class);
            for (SymbolCacheRow row : mapper.selectAll()) {
                if (row.getSymbol() != null && row.getUpdatedAt() != null) {
                    out.put(row.getSymbol(), row.getUpdatedAt());
                }
            }
        }
        return out;
    }

    @Override
    public void replaceAll(List<String> symbols, OffsetDateTime updatedAt) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                SymbolCacheMapper mapper = session.getMapper(SymbolCacheMapper.class);
                mapper.lockForRefresh();
                mapper.deleteAll();
                for (String symbol : symbols) {
                    mapper.insert(symbol, updatedAt);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                PgSignalStore.rollbackQuietly(conn, e);
                throw e;
            }
        }
    }
}
