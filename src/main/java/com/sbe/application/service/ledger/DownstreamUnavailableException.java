package com.sbe.application.service.ledger;

/**
 * The event log (or another external collaborator) could not be reached after retries
 */
public class DownstreamUnavailableException extends RuntimeException {

    public DownstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
