package com.earningsbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface AlertMapper {
    @Insert("INSERT INTO alerts(id, event_key, alert_type, symbol, as_of, message, created_at) " +
            "VALUES(CAST(#{id} AS UUID), #{eventKey}, #{alertType}, #{symbol}, #{asOf}, #{message}, #{createdAt}) " +
            "ON CONFLICT(event_key) DO NOTHING")
    int insertIfAbsent(AlertInsertParam row);

    @Select("SELECT CAST(id AS TEXT) AS id, event_key, alert_type, symbol, as_of, message, created_at, sent_at " +
            "FROM alerts WHERE sent_at IS NULL ORDER BY created_at ASC, event_key ASC LIMIT #{limit}")
    List<AlertRow> selectPending(@Param("limit") int limit);

    @Select("SELECT CAST(id AS TEXT) AS id, event_key, alert_type, symbol, as_of, message, created_at, sent_at " +
            "FROM alerts WHERE id=CAST(#{id} AS UUID)")
    AlertRow selectById(@Param("id") String id);

    @Update("UPDATE alerts SET sent_at=#{sentAt} WHERE id=CAST(#{id} AS UUID) AND sent_at IS NULL")
    int markSentIfUnsent(@Param("id") String id, @Param("sentAt") OffsetDateTime sentAt);
}
