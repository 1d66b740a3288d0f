package com.bulwark.core.check;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(4)
public class RateLimitingCheck extends PresenceCheck {

    public RateLimitingCheck() {
        super("rate_limiting", "Rate Limiting", CheckRules.RATE_LIMITING);
    }
}
