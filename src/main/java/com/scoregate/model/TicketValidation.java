package com.scoregate.model;

public record TicketValidation(boolean valid, TicketFailure failure, String detail) {

    private static final TicketValidation VALID = new TicketValidation(true, null, null);

    public static TicketValidation ok() {
        return VALID;
    }

    public static TicketValidation fail(TicketFailure failure, String detail) {
        return new TicketValidation(false, failure, detail);
    }
}
