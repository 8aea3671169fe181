package io.github.hotbrkm.tenantmail.agent.email.tenant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TenantOperation {
    SEND_EMAIL("send_email"),
    ADD_DOMAIN("add_domain"),
    CREATE_WEBHOOK("create_webhook"),
    API_CALL("api_call"),
    USE_STORAGE("use_storage");

    private final String operationName;
}
