package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.CalibrationFixtures;
import com.calibrationplatform.common.config.LayerRubric.ContextualRubric;
import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.CompatibilityTier;
import com.calibrationplatform.common.model.ExecutionContext;
import com.calibrationplatform.common.model.MethodRole;
import com.calibrationplatform.common.registry.CompatibilityDeclaration;
import com.calibrationplatform.common.registry.MethodDeclaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextualLayerEvaluatorTest {

    private final ContextualRubric rubric = ContextualRubric.defaults();

    private static MethodDeclaration declaring(Map<String, CompatibilityTier> questions) {
        return new MethodDeclaration("m.Ctx.run", MethodRole.ANALYZER, "1",
            EnumSet.allOf(CanonicalLayer.class), Map.of(),
            new CompatibilityDeclaration(questions, Map.of(), Map.of()),
            null, null, null, null, null);
    }

    private double questionScore(String questionId, MethodDeclaration declaration) {
        CalibrationSubject subject = CalibrationSubject.of("m.Ctx.run", "n", MethodRole.ANALYZER,
            new ExecutionContext(questionId, "D1", "PA01", 0.8));
        return new ContextualLayerEvaluator(CanonicalLayer.QUESTION, rubric)
            .evaluate(new LayerInput(subject, null, declaration)).value();
    }

    @Test
    @DisplayName("each declared tier maps to its rubric value")
    void tiers() {
        MethodDeclaration d = declaring(Map.of(
            "Q1", CompatibilityTier.PRIMARY,
            "Q2", CompatibilityTier.SECONDARY,
            "Q3", CompatibilityTier.COMPATIBLE,
            "Q4", CompatibilityTier.INCOMPATIBLE));
        assertEquals(1.0, questionScore("Q1", d));
        assertEquals(0.7, questionScore("Q2", d));
        assertEquals(0.3, questionScore("Q3", d));
        assertEquals(0.0, questionScore("Q4", d));
        assertEquals(0.1, questionScore("Q5", d));
    }

    @Test
    @DisplayName("undeclared method resolves every key to the undeclared penalty")
    void undeclaredMethod() {
        assertEquals(0.1, questionScore("Q1", null));
    }

    @Test
    @DisplayName("dimension and policy axes read their own tables")
    void otherAxes() {
        MethodDeclaration d = CalibrationFixtures.analyzerDeclaration();
        LayerInput input = new LayerInput(CalibrationFixtures.analyzer(0.8), null, d);
        assertEquals(1.0, new ContextualLayerEvaluator(CanonicalLayer.DIMENSION, rubric).evaluate(input).value());
        assertEquals(1.0, new ContextualLayerEvaluator(CanonicalLayer.POLICY, rubric).evaluate(input).value());
    }

    @Test
    @DisplayName("missing context key → EvidenceException naming the key")
    void missingKey() {
        CalibrationSubject subject = CalibrationSubject.of("m.Ctx.run", "n", MethodRole.ANALYZER,
            new ExecutionContext("Q1", null, "PA01", 0.8));
        EvidenceException e = assertThrows(EvidenceException.class, () ->
            new ContextualLayerEvaluator(CanonicalLayer.DIMENSION, rubric)
                .evaluate(new LayerInput(subject, null, null)));
        assertEquals("dimension", e.getField());
    }

    @Test
    @DisplayName("only @q, @d and @p are contextual axes")
    void rejectsNonContextualAxis() {
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualLayerEvaluator(CanonicalLayer.META, rubric));
    }
}
