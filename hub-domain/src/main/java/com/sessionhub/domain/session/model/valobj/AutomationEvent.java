package com.sessionhub.domain.session.model.valobj;

import com.sessionhub.types.enums.AutomationEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 自动化客户端上报的生命周期事件，字段按事件类型选填。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationEvent {

    private AutomationEventTypeEnum type;

    /** qr */
    private String qrCode;

    /** authenticated / ready */
    private String phoneNumber;

    /** authenticated / ready，平台侧序列化身份 */
    private String serializedId;

    /** disconnected */
    private String reason;

    /** auth_failure */
    private String message;

    /** change_state */
    private String state;

    /** message */
    private String from;
    private String body;
    private boolean fromMe;
    private Long timestamp;
}
