package com.codifier.domain.apply.model;

import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.change.model.ChangeKind;

import java.time.Instant;

/**
 * Audit line for one applied change.
 */
public record ManifestEntry(
        String changeId,
        ChangeKind kind,
        LineRange range,
        String citation,
        String reviewerId,
        Instant decidedAt,
        String before,
        String after
) {}
