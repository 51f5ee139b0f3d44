package com.sessionhub.domain.session.model.valobj;

import com.sessionhub.domain.session.model.entity.SessionEntity;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次注册表变更的前后快照。新建时 before 为 null，移除时 after 为 null。
 */
@Getter
@ToString
public class SessionChange {

    private final SessionEntity before;
    private final SessionEntity after;

    public SessionChange(SessionEntity before, SessionEntity after) {
        this.before = before;
        this.after = after;
    }

    public String getSessionId() {
        return after != null ? after.getId() : before == null ? null : before.getId();
    }

    public boolean isRemoval() {
        return after == null;
    }
}
