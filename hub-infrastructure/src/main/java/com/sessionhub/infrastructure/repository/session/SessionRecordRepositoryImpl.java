package com.sessionhub.infrastructure.repository.session;

import com.sessionhub.domain.session.adapter.repository.ISessionRecordRepository;
import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.infrastructure.dao.SessionRecordDao;
import com.sessionhub.infrastructure.dao.po.SessionRecordPO;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.enums.SessionStatusEnum;
import com.sessionhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 会话记录仓储实现类。
 * <p>
 * 以 session_id 为唯一键做 upsert；状态枚举以编码字符串落库，
 * 无法识别的历史状态在读取时被跳过。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Slf4j
@Repository
public class SessionRecordRepositoryImpl implements ISessionRecordRepository {

    private final SessionRecordDao sessionRecordDao;

    public SessionRecordRepositoryImpl(SessionRecordDao sessionRecordDao) {
        this.sessionRecordDao = sessionRecordDao;
    }

    @Override
    public void upsert(SessionRecordEntity record) {
        if (record == null || StringUtils.isBlank(record.getSessionId()) || record.getStatus() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Session record is incomplete");
        }
        sessionRecordDao.upsert(toPO(record));
    }

    @Override
    public SessionRecordEntity findBySessionId(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return null;
        }
        return toEntity(sessionRecordDao.selectBySessionId(sessionId));
    }

    @Override
    public List<SessionRecordEntity> findByStatus(SessionStatusEnum status) {
        if (status == null) {
            return Collections.emptyList();
        }
        return toEntities(sessionRecordDao.selectByStatus(status.getCode()));
    }

    @Override
    public List<SessionRecordEntity> findAll() {
        return toEntities(sessionRecordDao.selectAll());
    }

    @Override
    public boolean deleteBySessionId(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            return false;
        }
        return sessionRecordDao.deleteBySessionId(sessionId) > 0;
    }

    private List<SessionRecordEntity> toEntities(List<SessionRecordPO> pos) {
        if (pos == null || pos.isEmpty()) {
            return Collections.emptyList();
        }
        return pos.stream()
                .map(this::toEntity)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private SessionRecordEntity toEntity(SessionRecordPO po) {
        if (po == null) {
            return null;
        }
        SessionStatusEnum status;
        try {
            status = SessionStatusEnum.fromCode(po.getStatus());
        } catch (IllegalArgumentException ex) {
            log.warn("Skip session record with unknown status. sessionId={}, status={}",
                    po.getSessionId(), po.getStatus());
            return null;
        }
        SessionRecordEntity entity = new SessionRecordEntity();
        entity.setId(po.getId());
        entity.setSessionId(po.getSessionId());
        entity.setClientId(po.getClientId());
        entity.setStatus(status);
        entity.setPhoneNumber(po.getPhoneNumber());
        entity.setQrCode(po.getQrCode());
        entity.setLastActiveAt(po.getLastActiveAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private SessionRecordPO toPO(SessionRecordEntity entity) {
        return SessionRecordPO.builder()
                .id(entity.getId())
                .sessionId(entity.getSessionId())
                .clientId(entity.getClientId())
                .status(entity.getStatus().getCode())
                .phoneNumber(entity.getPhoneNumber())
                .qrCode(entity.getQrCode())
                .lastActiveAt(entity.getLastActiveAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
