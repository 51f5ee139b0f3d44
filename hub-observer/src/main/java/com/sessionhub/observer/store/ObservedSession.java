package com.sessionhub.observer.store;

import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 观察端本地视图中的一条会话。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ObservedSession {

    private String sessionId;
    private SessionStatusEnum status;
    private String phoneNumber;
    private String qrCode;
    private LocalDateTime lastActiveAt;

    public ObservedSession copy() {
        return toBuilder().build();
    }
}
