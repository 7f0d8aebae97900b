package com.critter.exception;

/**
 * Thrown inside the trade exchange transaction when an offered creature, item or coin amount
 * is no longer held by its offeror. Forces a rollback of every transfer already applied.
 */
public class StaleOfferException extends RuntimeException {

    public StaleOfferException(String message) {
        super(message);
    }
}
