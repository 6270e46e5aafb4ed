package com.smelldetector.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Detectors live in the impl package and share the threshold base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The tree model and query layer stay independent of detection and parsing</li>
 *   <li>Only the parser implementation touches tree-sitter</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.smelldetector.core");
    }

    @Test
    void detectors_shouldExtendAbstractThresholdDetector() {
        ArchRule rule = classes()
            .that().resideInAPackage("..detector.impl..")
            .and().haveSimpleNameEndingWith("Detector")
            .should().beAssignableTo("com.smelldetector.core.detector.AbstractThresholdDetector");

        rule.check(classes);
    }

    @Test
    void detectorProviders_shouldBeNestedInTheirDetector() {
        ArchRule rule = classes()
            .that().implement("com.smelldetector.core.detector.SmellDetectorProvider")
            .should().beNestedClasses()
            .andShould().haveSimpleName("Provider");

        rule.check(classes);
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void treeAndQueries_shouldNotDependOnDetectionOrParsing() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.tree..", "..core.query..", "..core.metric..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..core.detector..", "..core.parser..", "..core.analysis..", "..core.report..");

        rule.check(classes);
    }

    @Test
    void onlyParserImplementation_shouldUseTreeSitter() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..parser.impl..")
            .should().dependOnClassesThat().resideInAPackage("org.treesitter..");

        rule.check(classes);
    }

    @Test
    void detectorBase_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.detector")
            .and().doNotHaveSimpleName("DetectorRegistry")
            .should().dependOnClassesThat().resideInAPackage("..detector.impl..");

        rule.check(classes);
    }
}
