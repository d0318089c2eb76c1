package com.ryuqq.lifecycle.core.statemachine;

import java.util.Locale;

/**
 * 리소스에 수행되는 생명주기 액션.
 *
 * <p>INIT은 리소스가 만들어진 직후의 초기 액션이며, 호출자가 요청할 수 있는 액션이 아닙니다.
 * 나머지 액션은 각각 백엔드의 변경 호출 하나와 대응합니다.</p>
 *
 * <p>원격 상태 문자열은 {@code <ACTION>_<PHASE>} 형식(예: {@code CREATE_IN_PROGRESS})을 따르며,
 * 이 enum의 {@link #name()}이 그 접두사가 됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ResourceAction {

    /**
     * 초기 상태 (아직 어떤 액션도 수행되지 않음).
     */
    INIT,

    CREATE,

    UPDATE,

    DELETE,

    SUSPEND,

    RESUME;

    /**
     * 백엔드 식별자가 있어야 수행할 수 있는 액션인지 확인.
     *
     * @return UPDATE, DELETE, SUSPEND, RESUME인 경우 true
     */
    public boolean requiresIdentity() {
        return this != INIT && this != CREATE;
    }

    /**
     * 메시지용 소문자 이름.
     *
     * @return 예: "suspend"
     */
    public String verb() {
        return name().toLowerCase(Locale.ROOT);
    }
}
