package com.sessionhub.domain.session.model.entity;

import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.concurrent.Future;

/**
 * 运行期会话实体。
 * <p>
 * 注册表内部持有可变实例，对外只返回 {@link #copy()} 得到的快照。
 * 二维码载荷（qrCode、qrGeneratedAt、qrExpiryHandle）仅在 PENDING 状态下存在。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionEntity {

    /**
     * 会话 ID，进程内唯一
     */
    private String id;

    /**
     * 外部自动化客户端身份，用于重启后重新挂载认证数据
     */
    private String clientId;

    private SessionStatusEnum status;

    /**
     * 认证后才有值
     */
    private String phoneNumber;

    private String qrCode;

    private LocalDateTime qrGeneratedAt;

    /**
     * 二维码代次，每收到一个新二维码加一，过期定时器据此判断自己是否已失效
     */
    private long qrGeneration;

    /**
     * 创建该会话的观察端通道 ID，只做弱引用，通道关闭后置空
     */
    private String observerChannelId;

    private LocalDateTime createdAt;

    private LocalDateTime lastActiveAt;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private IAutomationClient automationClient;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Future<?> qrExpiryHandle;

    public boolean hasQrPayload() {
        return qrCode != null;
    }

    public boolean isObservedBy(String channelId) {
        return channelId != null && channelId.equals(observerChannelId);
    }

    /**
     * 清空二维码载荷。定时器句柄只解除引用，取消由调用方负责。
     */
    public void clearQrPayload() {
        this.qrCode = null;
        this.qrGeneratedAt = null;
        this.qrExpiryHandle = null;
    }

    public SessionEntity copy() {
        return this.toBuilder().build();
    }
}
