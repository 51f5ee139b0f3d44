package com.sessionhub.trigger.application.query;

import com.sessionhub.api.dto.AuthorizedUserDTO;
import com.sessionhub.api.dto.HealthStatusDTO;
import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.dto.ValidatedSessionDTO;
import com.sessionhub.domain.session.adapter.repository.ISessionRecordRepository;
import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.domain.session.service.SessionRegistry;
import com.sessionhub.trigger.application.common.SessionViewAssembler;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.enums.SessionStatusEnum;
import com.sessionhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 会话查询读用例：实时视图来自注册表，校验结果来自持久化记录。
 */
@Service
public class SessionQueryService {

    public static final String HEALTHY = "healthy";
    public static final String ACTIVE = "active";
    public static final String INACTIVE = "inactive";

    private final SessionRegistry sessionRegistry;
    private final ISessionRecordRepository sessionRecordRepository;
    private final SessionViewAssembler sessionViewAssembler;

    public SessionQueryService(SessionRegistry sessionRegistry,
                               ISessionRecordRepository sessionRecordRepository,
                               SessionViewAssembler sessionViewAssembler) {
        this.sessionRegistry = sessionRegistry;
        this.sessionRecordRepository = sessionRecordRepository;
        this.sessionViewAssembler = sessionViewAssembler;
    }

    public List<SessionSummaryDTO> listSessions() {
        return sessionViewAssembler.toSummaries(sessionRegistry.listAll());
    }

    public SessionSummaryDTO getSession(String sessionId) {
        SessionEntity session = sessionRegistry.get(sessionId);
        if (session == null) {
            throw new AppException(ResponseCode.SESSION_NOT_FOUND.getCode(), "Session not found");
        }
        return sessionViewAssembler.toSummary(session);
    }

    public List<AuthorizedUserDTO> listAuthorizedUsers() {
        return sessionRegistry.listByState(SessionStatusEnum.READY).stream()
                .map(sessionViewAssembler::toAuthorizedUser)
                .collect(Collectors.toList());
    }

    /**
     * 返回给定 ID 中持久化状态为 READY 的会话，保持入参顺序并去重。
     */
    public List<ValidatedSessionDTO> validateSessions(List<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> distinctIds = new LinkedHashSet<>();
        for (String sessionId : sessionIds) {
            if (StringUtils.isNotBlank(sessionId)) {
                distinctIds.add(sessionId.trim());
            }
        }
        List<ValidatedSessionDTO> result = new ArrayList<>();
        for (String sessionId : distinctIds) {
            SessionRecordEntity record = sessionRecordRepository.findBySessionId(sessionId);
            if (record != null && record.isReady()) {
                result.add(sessionViewAssembler.toValidatedSession(record));
            }
        }
        return result;
    }

    public HealthStatusDTO health() {
        int activeSessions = sessionRegistry.listByState(SessionStatusEnum.READY).size();
        return HealthStatusDTO.builder()
                .status(HEALTHY)
                .sessionStatus(activeSessions > 0 ? ACTIVE : INACTIVE)
                .activeSessions(activeSessions)
                .build();
    }
}
