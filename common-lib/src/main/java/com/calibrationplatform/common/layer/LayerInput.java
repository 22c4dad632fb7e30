package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.registry.MethodDeclaration;

import java.util.Objects;

/**
 * What every evaluator may read for one subject.
 *
 * @param declaration the method's declaration, {@code null} when the method is undeclared
 */
public record LayerInput(
    CalibrationSubject subject,
    EvidenceBundle evidence,
    MethodDeclaration declaration
) {
    public LayerInput {
        Objects.requireNonNull(subject, "subject");
        evidence = evidence == null ? EvidenceBundle.empty() : evidence;
    }
}
