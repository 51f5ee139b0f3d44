package com.sessionhub.domain.session.adapter.repository;

import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.types.enums.SessionStatusEnum;

import java.util.List;

/**
 * 会话记录仓储接口
 *
 * @author sessionhub
 * @since 2026-10-19
 */
public interface ISessionRecordRepository {

    /**
     * 按 sessionId 插入或覆盖
     */
    void upsert(SessionRecordEntity record);

    SessionRecordEntity findBySessionId(String sessionId);

    List<SessionRecordEntity> findByStatus(SessionStatusEnum status);

    /**
     * 按最近活跃时间倒序
     */
    List<SessionRecordEntity> findAll();

    boolean deleteBySessionId(String sessionId);
}
