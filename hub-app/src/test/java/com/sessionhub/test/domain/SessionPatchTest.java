package com.sessionhub.test.domain;

import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.valobj.SessionPatch;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SessionPatchTest {

    @Test
    public void shouldNeverKeepQrPayloadOutsidePending() {
        SessionEntity session = SessionEntity.builder()
                .id("session_1")
                .status(SessionStatusEnum.AUTHENTICATED)
                .build();

        SessionPatch.builder().qrCode("late-qr").build().applyTo(session);

        Assertions.assertNull(session.getQrCode());
    }

    @Test
    public void shouldClearQrWhenLeavingPending() {
        SessionEntity session = SessionEntity.builder()
                .id("session_1")
                .status(SessionStatusEnum.PENDING)
                .qrCode("QR-1")
                .build();

        SessionPatch.builder().status(SessionStatusEnum.DISCONNECTED).build().applyTo(session);

        Assertions.assertEquals(SessionStatusEnum.DISCONNECTED, session.getStatus());
        Assertions.assertFalse(session.hasQrPayload());
    }

    @Test
    public void shouldRejectBackwardTransition() {
        SessionEntity session = SessionEntity.builder()
                .id("session_1")
                .status(SessionStatusEnum.READY)
                .build();

        Assertions.assertThrows(IllegalStateException.class,
                () -> SessionPatch.builder().status(SessionStatusEnum.PENDING).build().applyTo(session));
        Assertions.assertEquals(SessionStatusEnum.READY, session.getStatus());
    }

    @Test
    public void shouldNotLeaveDisconnected() {
        Assertions.assertFalse(SessionStatusEnum.DISCONNECTED.canTransitTo(SessionStatusEnum.READY));
        Assertions.assertTrue(SessionStatusEnum.PENDING.canTransitTo(SessionStatusEnum.DISCONNECTED));
        Assertions.assertFalse(SessionStatusEnum.PENDING.canTransitTo(SessionStatusEnum.READY));
    }
}
