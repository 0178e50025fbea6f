package com.facilitydesk.backend.modules.auth.application;

import com.facilitydesk.backend.global.error.ProblemException;

public class AuthFailureException extends ProblemException {

    private final AuthFailure failure;

    public AuthFailureException(AuthFailure failure) {
        this(failure, failure.defaultMessage());
    }

    public AuthFailureException(AuthFailure failure, String detail) {
        super(failure.status(), failure.name(), detail);
        this.failure = failure;
    }

    public AuthFailure getFailure() {
        return failure;
    }

    public static AuthFailureException accountNotActive(String statusName) {
        return new AuthFailureException(AuthFailure.ACCOUNT_NOT_ACTIVE,
                "Account is " + statusName + ". Please contact administrator");
    }

    public static AuthFailureException accountLocked(long remainingMinutes) {
        return new AuthFailureException(AuthFailure.ACCOUNT_LOCKED,
                "Account is locked. Try again in " + remainingMinutes + " minutes");
    }
}
