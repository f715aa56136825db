package com.maturityplatform.assessment.model;

import com.maturityplatform.common.exception.ValidationException;

import java.util.Locale;

public enum OrganizationSize {
    STARTUP,
    SMB,
    MID_MARKET,
    ENTERPRISE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrganizationSize fromKey(String key) {
        if (key != null) {
            for (OrganizationSize s : values()) {
                if (s.key().equalsIgnoreCase(key.trim())) {
                    return s;
                }
            }
        }
        throw new ValidationException("Unknown organization size '" + key
            + "'. Must be one of: startup, smb, mid_market, enterprise");
    }
}
