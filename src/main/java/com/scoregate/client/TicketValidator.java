package com.scoregate.client;

import com.scoregate.model.TicketValidation;

/**
 * Confirms with the external identity service that {@code accountId} owns the
 * session ticket and the application entitlement. Never throws: network and parse
 * failures come back as {@link com.scoregate.model.TicketFailure#VALIDATION_FAILED}.
 */
public interface TicketValidator {

    TicketValidation validate(String accountId, String ticket);
}
