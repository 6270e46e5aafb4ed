package com.smelldetector.core.detector.impl;

import com.smelldetector.core.metric.NestedScopePolicy;
import com.smelldetector.core.metric.NestingDepthMetric;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import static com.smelldetector.core.tree.SyntaxNodes.control;
import static com.smelldetector.core.tree.SyntaxNodes.function;
import static com.smelldetector.core.tree.SyntaxNodes.nestedIfs;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DeepNestingDetector}.
 */
class DeepNestingDetectorTest {

    private final DeepNestingDetector detector = new DeepNestingDetector();

    @Test
    void detect_depthAtThreshold_noFinding() {
        assertThat(detector.detect(function("f", nestedIfs(4)))).isEmpty();
    }

    @Test
    void detect_depthFive_medium() {
        Finding finding = detector.detect(function("walk", nestedIfs(5))).orElseThrow();

        assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(finding.message()).isEqualTo("Function has nesting depth of 5 (threshold: 4)");
        assertThat(finding.detail("nesting_depth")).isEqualTo(5);
    }

    @Test
    void detect_depthSix_high() {
        assertThat(detector.detect(function("walk", nestedIfs(6)))).get()
            .extracting(Finding::severity).isEqualTo(Severity.HIGH);
    }

    @Test
    void detect_nestedFunctionDepth_dependsOnPolicy() {
        SyntaxNode outer = function("outer",
            control("for_statement",
                control("if_statement",
                    function("inner", nestedIfs(3)))));

        assertThat(new DeepNestingDetector(4, 5, NestedScopePolicy.ACCUMULATE).detect(outer)).isPresent();
        assertThat(new DeepNestingDetector(4, 5, NestedScopePolicy.ISOLATE).detect(outer)).isEmpty();
    }

    @Test
    void metric_carriesPolicy() {
        DeepNestingDetector isolating = new DeepNestingDetector(4, 5, NestedScopePolicy.ISOLATE);

        assertThat(isolating.getMetric()).isInstanceOfSatisfying(NestingDepthMetric.class,
            metric -> assertThat(metric.getNestedScopes()).isEqualTo(NestedScopePolicy.ISOLATE));
        assertThat(isolating.getOrder()).isEqualTo(300);
    }
}
