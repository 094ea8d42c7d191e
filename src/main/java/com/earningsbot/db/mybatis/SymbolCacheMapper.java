package com.earningsbot.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface SymbolCacheMapper {
    @Select("SELECT symbol, updated_at FROM symbols_cache ORDER BY symbol ASC")
    List<SymbolCacheRow> selectAll();

    // Serializes concurrent refreshes so a snapshot never mixes two of them.
    @Update("LOCK TABLE symbols_cache IN SHARE ROW EXCLUSIVE MODE")
    void lockForRefresh();

    @Delete("DELETE FROM symbols_cache")
    int deleteAll();

    @Insert("INSERT INTO symbols_cache(symbol, updated_at) VALUES(#{symbol}, #{updatedAt}) " +
            "ON CONFLICT(symbol) DO UPDATE SET updated_at=excluded.updated_at")
    int insert(@Param("symbol") String symbol, @Param("updatedAt") OffsetDateTime updatedAt);
}
