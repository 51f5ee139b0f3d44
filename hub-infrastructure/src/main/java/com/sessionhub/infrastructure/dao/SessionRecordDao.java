package com.sessionhub.infrastructure.dao;

import com.sessionhub.infrastructure.dao.po.SessionRecordPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 会话记录 DAO
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Mapper
public interface SessionRecordDao {

    /**
     * 按 session_id 插入或更新
     */
    int upsert(SessionRecordPO po);

    int deleteBySessionId(@Param("sessionId") String sessionId);

    SessionRecordPO selectBySessionId(@Param("sessionId") String sessionId);

    List<SessionRecordPO> selectByStatus(@Param("status") String status);

    /**
     * 按最近活跃时间倒序
     */
    List<SessionRecordPO> selectAll();
}
