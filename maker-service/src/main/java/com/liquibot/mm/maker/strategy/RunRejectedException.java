package com.liquibot.mm.maker.strategy;

/**
 * A run could not be started: the instrument is already quoted or every worker is busy.
 */
public class RunRejectedException extends RuntimeException {

    public RunRejectedException(String message) {
        super(message);
    }
}
