package com.smelldetector.core.detector.impl;

import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static com.smelldetector.core.tree.SyntaxNodes.function;
import static com.smelldetector.core.tree.SyntaxNodes.parameterNames;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TooManyParametersDetector}.
 */
class TooManyParametersDetectorTest {

    private final TooManyParametersDetector detector = new TooManyParametersDetector();

    @Test
    void detect_atThreshold_noFinding() {
        assertThat(detector.detect(functionWith(5))).isEmpty();
    }

    @Test
    void detect_aboveThreshold_medium() {
        Finding finding = detector.detect(functionWith(6)).orElseThrow();

        assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(finding.message()).isEqualTo("Function has 6 parameters (threshold: 5)");
        assertThat(finding.detail("param_count")).isEqualTo(6);
    }

    @Test
    void detect_atCeiling_stillMedium() {
        assertThat(detector.detect(functionWith(7))).get()
            .extracting(Finding::severity).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void detect_aboveCeiling_high() {
        assertThat(detector.detect(functionWith(8))).get()
            .extracting(Finding::severity).isEqualTo(Severity.HIGH);
    }

    @Test
    void detect_ceilingBelowThreshold_everyFindingIsHigh() {
        TooManyParametersDetector custom = new TooManyParametersDetector(3, 1);

        assertThat(custom.detect(functionWith(4))).get()
            .extracting(Finding::severity).isEqualTo(Severity.HIGH);
    }

    private static SyntaxNode functionWith(int parameterCount) {
        String[] names = IntStream.range(0, parameterCount).mapToObj(i -> "p" + i).toArray(String[]::new);
        return function("configure", 1, 3, parameterNames(names));
    }
}
