package dev.corebanking.identity.exception;

import java.util.List;

public class IncorrectPasswordException extends ValidationException {

    public IncorrectPasswordException() {
        super(ErrorCode.INCORRECT_PASSWORD, "Current password is incorrect", List.of());
    }
}
