package com.codifier.infrastructure.apply;

/**
 * Applying the accepted changes would put section paths out of document order.
 */
public class SectionOrderViolationException extends ChangeApplicationException {

    public SectionOrderViolationException(String changeId, String message) {
        super(changeId, "SECTION_ORDER_VIOLATION", message);
    }
}
