package com.bulwark.core.check;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(3)
public class AuthenticationCheck extends PresenceCheck {

    public AuthenticationCheck() {
        super("authentication", "Authentication", CheckRules.AUTHENTICATION);
    }
}
