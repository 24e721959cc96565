package com.codifier.infrastructure.apply;

/**
 * The text under a change's resolved range no longer matches the snapshot taken at resolution time.
 */
public class StaleResolutionException extends ChangeApplicationException {

    public StaleResolutionException(String changeId, String message) {
        super(changeId, "STALE_RESOLUTION", message);
    }
}
