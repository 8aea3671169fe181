package io.github.hotbrkm.tenantmail.simulator.smtp.dkim;

import java.util.Locale;

public enum DkimCheckResult {
    PASS, FAIL, NONE, PERMERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
