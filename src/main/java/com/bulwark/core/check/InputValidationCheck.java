package com.bulwark.core.check;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Looks for validation or sanitisation code in each component. The server
 * component also passes when its manifest pulls in a validation library.
 */
@Component
@Order(5)
public class InputValidationCheck extends PresenceCheck {

    public InputValidationCheck() {
        super("input_validation", "Input Validation", CheckRules.INPUT_VALIDATION);
    }
}
