package com.sessionhub.trigger.application.common;

import com.sessionhub.api.dto.AuthorizedUserDTO;
import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.dto.ValidatedSessionDTO;
import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 会话视图组装器：REST 响应与观察端推送共用同一套映射。
 */
@Component
public class SessionViewAssembler {

    private static final Comparator<SessionSummaryDTO> LAST_ACTIVE_DESC = Comparator.comparing(
            SessionSummaryDTO::getLastActiveAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public SessionSummaryDTO toSummary(SessionEntity session) {
        if (session == null) {
            return null;
        }
        return SessionSummaryDTO.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .phoneNumber(session.getPhoneNumber())
                .qrCode(session.getQrCode())
                .lastActiveAt(session.getLastActiveAt())
                .build();
    }

    /**
     * 按最近活跃时间倒序。
     */
    public List<SessionSummaryDTO> toSummaries(List<SessionEntity> sessions) {
        return sessions.stream()
                .map(this::toSummary)
                .filter(Objects::nonNull)
                .sorted(LAST_ACTIVE_DESC)
                .collect(Collectors.toList());
    }

    public AuthorizedUserDTO toAuthorizedUser(SessionEntity session) {
        String number = StringUtils.defaultIfBlank(session.getPhoneNumber(), Constants.UNKNOWN_PHONE_NUMBER);
        return AuthorizedUserDTO.builder()
                .id(session.getId())
                .sessionId(session.getId())
                .name(number)
                .number(number)
                .status(session.getStatus())
                .lastActive(session.getLastActiveAt())
                .build();
    }

    public ValidatedSessionDTO toValidatedSession(SessionRecordEntity record) {
        String number = StringUtils.defaultIfBlank(record.getPhoneNumber(), Constants.UNKNOWN_PHONE_NUMBER);
        return ValidatedSessionDTO.builder()
                .id(record.getSessionId())
                .sessionId(record.getSessionId())
                .name(number)
                .number(number)
                .status(record.getStatus())
                .build();
    }
}
