package com.sessionhub.trigger.http;

import com.sessionhub.api.dto.AuthorizedUserDTO;
import com.sessionhub.api.response.Response;
import com.sessionhub.trigger.application.query.SessionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 已授权（就绪）账号 API
 */
@RestController
public class AuthorizedUserController {

    private final SessionQueryService sessionQueryService;

    public AuthorizedUserController(SessionQueryService sessionQueryService) {
        this.sessionQueryService = sessionQueryService;
    }

    @GetMapping("/api/authorized-users")
    public Response<List<AuthorizedUserDTO>> listAuthorizedUsers() {
        return Response.success(sessionQueryService.listAuthorizedUsers());
    }
}
