package com.calibrationplatform.common.certificate;

import com.calibrationplatform.common.certificate.CalibrationCertificate.LayerBreakdown;
import com.calibrationplatform.common.fusion.FusionResult;
import com.calibrationplatform.common.fusion.FusionTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-derives a certificate's score from its own contents.
 *
 * <ul>
 *   <li>the structured fusion terms must re-add to {@code calibration_score} exactly</li>
 *   <li>every linear term's input must equal that layer's recorded score</li>
 *   <li>the score must lie in [0,1]</li>
 *   <li>the digest must match the certificate's content</li>
 * </ul>
 */
public final class CertificateVerifier {

    private CertificateVerifier() {}

    public static Verification verify(CalibrationCertificate certificate) {
        List<String> problems = new ArrayList<>();
        List<FusionTerm> terms = certificate.fusionFormula().terms();

        double recomputed = FusionResult.recompute(terms);
        if (Double.compare(recomputed, certificate.calibrationScore()) != 0) {
            problems.add(String.format("recomputed score %.17g != recorded %.17g",
                recomputed, certificate.calibrationScore()));
        }
        for (FusionTerm t : terms) {
            if (t.kind() != FusionTerm.Kind.LINEAR) continue;
            LayerBreakdown layer = certificate.layerBreakdown().get(t.key());
            if (layer == null) {
                problems.add("term " + t.key() + " has no layer breakdown");
            } else if (Double.compare(layer.score(), t.input()) != 0) {
                problems.add("term " + t.key() + " input " + t.input() + " != layer score " + layer.score());
            }
        }
        double score = certificate.calibrationScore();
        if (!FusionResult.isBounded(score)) {
            problems.add("score " + score + " outside [0,1]");
        }
        String digest = CertificateBuilder.digest(certificate);
        if (!digest.equals(certificate.certificateDigest())) {
            problems.add("digest mismatch");
        }
        return new Verification(problems.isEmpty(), recomputed, List.copyOf(problems));
    }

    public record Verification(boolean valid, double recomputedScore, List<String> problems) {}
}
