package com.dinnerplans.restaurants.domain.exception;

/**
 * A join or leave kept colliding with a concurrent change. Callers should try again.
 */
public class AttendanceConflictException extends RuntimeException {

    public AttendanceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
