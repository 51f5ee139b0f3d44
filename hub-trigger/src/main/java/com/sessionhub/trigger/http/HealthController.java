package com.sessionhub.trigger.http;

import com.sessionhub.api.dto.HealthStatusDTO;
import com.sessionhub.api.response.Response;
import com.sessionhub.trigger.application.query.SessionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final SessionQueryService sessionQueryService;

    public HealthController(SessionQueryService sessionQueryService) {
        this.sessionQueryService = sessionQueryService;
    }

    @GetMapping("/health")
    public Response<HealthStatusDTO> health() {
        return Response.success(sessionQueryService.health());
    }
}
