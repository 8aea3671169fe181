package io.github.hotbrkm.tenantmail.agent.email.tenant;

import java.time.ZoneId;

public record TenantSettings(ZoneId timezone, boolean trackOpens, boolean trackClicks, boolean bounceHandling) {

    public static TenantSettings defaults(ZoneId timezone) {
        return new TenantSettings(timezone, true, true, true);
    }
}
