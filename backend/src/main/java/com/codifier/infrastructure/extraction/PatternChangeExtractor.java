package com.codifier.infrastructure.extraction;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.amendment.model.Amendment;
import com.codifier.domain.amendment.model.InstructionSpan;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeSet;
import com.codifier.domain.change.service.ChangeExtractor;
import com.codifier.infrastructure.classification.InstructionClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic pass: pattern classifier plus location resolver.
 */
@Component
@RequiredArgsConstructor
public class PatternChangeExtractor implements ChangeExtractor {

    public static final String NAME = "pattern";

    private final InstructionClassifier classifier;
    private final ChangeSetAssembler assembler;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChangeSet extract(Amendment amendment, Act act) {
        List<ChangeIntent> intents = new ArrayList<>();
        for (InstructionSpan span : amendment.spans()) {
            intents.addAll(classifier.classify(span));
        }
        return assembler.assemble(amendment, act, intents, NAME);
    }
}
