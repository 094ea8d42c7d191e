package com.earningsbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface PositionMapper {
    @Insert("INSERT INTO positions(id, symbol, entry_date, entry_price, status, created_at, updated_at) " +
            "VALUES(CAST(#{id} AS UUID), #{symbol}, #{entryDate}, #{entryPrice}, 'OPEN', #{createdAt}, #{createdAt}) " +
            "ON CONFLICT(symbol, entry_date) DO NOTHING")
    int insertIfAbsent(PositionInsertParam row);

    @Select("SELECT CAST(id AS TEXT) AS id, symbol, entry_date, entry_price, status, exit_date, exit_price, " +
            "exit_reason, created_at, updated_at " +
            "FROM positions WHERE status='OPEN' ORDER BY entry_date ASC, symbol ASC")
    List<PositionRow> selectOpen();

    @Update("UPDATE positions SET status='CLOSED', exit_date=#{exitDate}, exit_price=#{exitPrice}, " +
            "exit_reason=#{exitReason}, updated_at=#{updatedAt} " +
            "WHERE id=CAST(#{id} AS UUID) AND status='OPEN'")
    int closeIfOpen(PositionCloseParam row);
}
