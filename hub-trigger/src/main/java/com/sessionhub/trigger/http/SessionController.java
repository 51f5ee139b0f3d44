package com.sessionhub.trigger.http;

import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.dto.SessionValidateRequestDTO;
import com.sessionhub.api.dto.ValidatedSessionDTO;
import com.sessionhub.api.response.Response;
import com.sessionhub.trigger.application.command.SessionLifecycleCoordinator;
import com.sessionhub.trigger.application.query.SessionQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话 API
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionQueryService sessionQueryService;
    private final SessionLifecycleCoordinator lifecycleCoordinator;

    public SessionController(SessionQueryService sessionQueryService,
                             SessionLifecycleCoordinator lifecycleCoordinator) {
        this.sessionQueryService = sessionQueryService;
        this.lifecycleCoordinator = lifecycleCoordinator;
    }

    @GetMapping
    public Response<List<SessionSummaryDTO>> listSessions() {
        return Response.success(sessionQueryService.listSessions());
    }

    @GetMapping("/{id}")
    public Response<SessionSummaryDTO> getSession(@PathVariable("id") String sessionId) {
        return Response.success(sessionQueryService.getSession(sessionId));
    }

    @DeleteMapping("/{id}")
    public Response<Boolean> deleteSession(@PathVariable("id") String sessionId) {
        boolean existed = lifecycleCoordinator.deleteSession(sessionId);
        log.info("Session delete requested. sessionId={}, existed={}", sessionId, existed);
        return Response.success(existed);
    }

    @PostMapping("/validate")
    public Response<List<ValidatedSessionDTO>> validateSessions(@RequestBody SessionValidateRequestDTO request) {
        if (request == null || request.getSessionIds() == null) {
            throw new IllegalArgumentException("sessionIds is required");
        }
        return Response.success(sessionQueryService.validateSessions(request.getSessionIds()));
    }
}
