package com.codifier.domain.change.model;

/**
 * Outcome of dual-pass validation for one record.
 *
 * @param primaryExtracted   found by the primary extraction pass
 * @param secondaryConfirmed the secondary pass produced the same edit on the same range
 * @param discrepancy        description of a disagreement or failed guard (nullable)
 */
public record ValidationStatus(
        boolean primaryExtracted,
        boolean secondaryConfirmed,
        String discrepancy
) {
    public static ValidationStatus singlePass() {
        return new ValidationStatus(true, false, null);
    }

    public boolean hasDiscrepancy() {
        return discrepancy != null && !discrepancy.isBlank();
    }

    public ValidationStatus withDiscrepancy(String note) {
        String merged = hasDiscrepancy() ? discrepancy + "; " + note : note;
        return new ValidationStatus(primaryExtracted, secondaryConfirmed, merged);
    }
}
