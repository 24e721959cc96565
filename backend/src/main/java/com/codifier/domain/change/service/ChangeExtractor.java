package com.codifier.domain.change.service;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.change.model.ChangeSet;

/**
 * One independent extraction pass: reads an amendment and proposes located changes against
 * an Act version. Implementations are interchangeable; the reconciliation step relies only
 * on the shape of the returned ChangeSet.
 */
public interface ChangeExtractor {

    /**
     * Name used in configuration and recorded on every produced change.
     */
    String name();

    /**
     * @param amendment the amendment to read
     * @param act       the target Act version
     * @return unreconciled ChangeSet for this pass
     */
    ChangeSet extract(Amendment amendment, Act act);
}
