package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.CongruenceRubric;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.InterplayGroup;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.registry.MethodRegistry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ensemble validity {@code @C}.
 *
 * <h3>Alone</h3>
 * <p>{@code scale_identical} if the method is registered, else {@code scale_mismatch}.
 *
 * <h3>In an interplay group</h3>
 * <pre>
 *   C = c_scale · c_sem · c_fusion
 *   c_scale  identical output range | every differing member converts to the subject's range | else
 *   c_sem    |∩ tags| / |∪ tags|  (0 when no member has tags)
 *   c_fusion recognized rule, all requirements provided | some missing | no recognized rule
 * </pre>
 * An unregistered member makes the whole group score 0.
 */
public class CongruenceLayerEvaluator implements LayerEvaluator {

    private final CongruenceRubric rubric;
    private final MethodRegistry methods;

    public CongruenceLayerEvaluator(CongruenceRubric rubric, MethodRegistry methods) {
        this.rubric = rubric;
        this.methods = methods;
    }

    @Override
    public CanonicalLayer layer() {
        return CanonicalLayer.CONGRUENCE;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        String methodId = input.subject().methodId();
        Optional<InterplayGroup> group = input.subject().interplayGroup()
            .filter(g -> g.memberMethodIds().size() > 1);

        if (group.isEmpty()) {
            boolean registered = methods.isRegistered(methodId);
            double score = registered ? rubric.scaleIdentical() : rubric.scaleMismatch();
            return new LayerScore(CanonicalLayer.CONGRUENCE, score, Map.of(),
                Map.of("registered", registered), "alone",
                registered ? "single method, registered" : "single method, not registered");
        }
        return evaluateGroup(methodId, group.get());
    }

    private LayerScore evaluateGroup(String methodId, InterplayGroup group) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("group_id", group.groupId());
        evidence.put("members", group.memberMethodIds());
        evidence.put("fusion_rule", group.fusionRule() == null ? "undeclared" : group.fusionRule());

        List<MethodDeclaration> members = new ArrayList<>();
        for (String memberId : group.memberMethodIds()) {
            Optional<MethodDeclaration> d = methods.find(memberId);
            if (d.isEmpty()) {
                return new LayerScore(CanonicalLayer.CONGRUENCE, 0.0, Map.of(), evidence, "0",
                    "group member " + memberId + " is not registered");
            }
            members.add(d.get());
        }
        MethodDeclaration self = methods.find(methodId).orElse(members.get(0));

        double cScale = scaleCompatibility(self, members);
        double cSem = semanticOverlap(members);
        double cFusion = fusionValidity(group, members);
        double score = cScale * cSem * cFusion;

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("c_scale", cScale);
        components.put("c_sem", cSem);
        components.put("c_fusion", cFusion);
        return new LayerScore(CanonicalLayer.CONGRUENCE, score, components, evidence,
            String.format("%.4f·%.4f·%.4f", cScale, cSem, cFusion),
            "interplay group " + group.groupId() + " with " + members.size() + " members");
    }

    private double scaleCompatibility(MethodDeclaration self, List<MethodDeclaration> members) {
        String target = self.outputRange();
        boolean identical = true;
        boolean convertible = true;
        for (MethodDeclaration m : members) {
            if (target != null && target.equals(m.outputRange())) continue;
            identical = false;
            if (target == null || !m.transformableTo().contains(target)) {
                convertible = false;
            }
        }
        if (identical) return rubric.scaleIdentical();
        return convertible ? rubric.scaleConvertible() : rubric.scaleMismatch();
    }

    private static double semanticOverlap(List<MethodDeclaration> members) {
        Set<String> union = new HashSet<>();
        Set<String> intersection = null;
        for (MethodDeclaration m : members) {
            union.addAll(m.conceptTags());
            if (intersection == null) {
                intersection = new HashSet<>(m.conceptTags());
            } else {
                intersection.retainAll(m.conceptTags());
            }
        }
        if (union.isEmpty()) return 0.0;
        return (double) intersection.size() / union.size();
    }

    private double fusionValidity(InterplayGroup group, List<MethodDeclaration> members) {
        String rule = group.fusionRule();
        if (rule == null || !rubric.recognizedRules().contains(rule)) {
            return rubric.fusionInvalid();
        }
        Set<String> required = new TreeSet<>();
        members.forEach(m -> required.addAll(m.fusionRequirements()));
        return group.providedInputs().containsAll(required)
            ? rubric.fusionComplete()
            : rubric.fusionPartial();
    }
}
