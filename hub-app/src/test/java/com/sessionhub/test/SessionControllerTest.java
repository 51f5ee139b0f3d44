package com.sessionhub.test;

import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.test.support.FakeAutomationClient;
import com.sessionhub.test.support.SessionHubTestContext;
import com.sessionhub.trigger.http.AuthorizedUserController;
import com.sessionhub.trigger.http.GlobalApiExceptionHandler;
import com.sessionhub.trigger.http.HealthController;
import com.sessionhub.trigger.http.SessionController;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionControllerTest {

    private SessionHubTestContext context;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        context = new SessionHubTestContext();
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new SessionController(context.queryService, context.coordinator),
                        new AuthorizedUserController(context.queryService),
                        new HealthController(context.queryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldListSessionsByLastActiveDesc() throws Exception {
        String older = context.coordinator.createSession(null);
        context.clock.advance(Duration.ofSeconds(5));
        String newer = context.coordinator.createSession(null);
        context.clientFactory.clientOf(newer).emitQr("ABC");

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].sessionId").value(newer))
                .andExpect(jsonPath("$.data[0].status").value("pending"))
                .andExpect(jsonPath("$.data[0].qrCode").value("ABC"))
                .andExpect(jsonPath("$.data[1].sessionId").value(older));
    }

    @Test
    public void shouldGetSingleSession() throws Exception {
        String sessionId = context.coordinator.createSession(null);

        mockMvc.perform(get("/api/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value(sessionId))
                .andExpect(jsonPath("$.data.status").value("pending"));
    }

    @Test
    public void shouldReturnNotFoundForUnknownSession() throws Exception {
        mockMvc.perform(get("/api/sessions/session_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.SESSION_NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("Session not found"));
    }

    @Test
    public void shouldDeleteSessionAndReportExistence() throws Exception {
        String sessionId = context.coordinator.createSession(null);
        FakeAutomationClient client = context.clientFactory.clientOf(sessionId);

        mockMvc.perform(delete("/api/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data").value(true));
        mockMvc.perform(delete("/api/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(false));

        Assertions.assertEquals(1, client.getDestroyCount());
    }

    @Test
    public void shouldValidatePersistedReadySessions() throws Exception {
        context.repository.upsert(record("session_a", SessionStatusEnum.READY));
        context.repository.upsert(record("session_b", SessionStatusEnum.AUTHENTICATED));

        mockMvc.perform(post("/api/sessions/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionIds\":[\"session_a\",\"session_b\",\"session_a\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].sessionId").value("session_a"))
                .andExpect(jsonPath("$.data[0].status").value("ready"));
    }

    @Test
    public void shouldRejectValidateWithoutIds() throws Exception {
        mockMvc.perform(post("/api/sessions/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("sessionIds is required"));
    }

    @Test
    public void shouldListAuthorizedUsersAndReportHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("healthy"))
                .andExpect(jsonPath("$.data.sessionStatus").value("inactive"))
                .andExpect(jsonPath("$.data.activeSessions").value(0));

        String sessionId = context.coordinator.createSession(null);
        FakeAutomationClient client = context.clientFactory.clientOf(sessionId);
        client.emitAuthenticated("8613800000000");
        client.emitReady();

        mockMvc.perform(get("/api/authorized-users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].id").value(sessionId))
                .andExpect(jsonPath("$.data[0].number").value("8613800000000"));
        mockMvc.perform(get("/health"))
                .andExpect(jsonPath("$.data.sessionStatus").value("active"))
                .andExpect(jsonPath("$.data.activeSessions").value(1));
    }

    private SessionRecordEntity record(String sessionId, SessionStatusEnum status) {
        SessionRecordEntity record = new SessionRecordEntity();
        record.setSessionId(sessionId);
        record.setClientId("client_" + sessionId);
        record.setStatus(status);
        record.setPhoneNumber("8613800000000");
        return record;
    }
}
