package com.hexarchitect.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the engine itself.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Model types are immutable records or enums</li>
 *   <li>The model does not depend on graph, validation or export code</li>
 *   <li>Validation rules and exporters only read the graph</li>
 *   <li>Utilities have no domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.hexarchitect.core");
    }

    /**
     * Verifies all model types are records or enums.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer stays independent of everything built on top of it.
     */
    @Test
    void models_shouldNotDependOnEngineCode() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.graph..", "..core.validation..", "..core.export..", "..core.registry..", "..core.config..");

        rule.check(classes);
    }

    /**
     * Verifies rules and exporters never construct graphs themselves.
     */
    @Test
    void rulesAndExporters_shouldNotDependOnGraphBuilder() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.export..", "..core.validation..")
            .and().doNotHaveSimpleName("ValidationEngine")
            .should().dependOnClassesThat().haveSimpleName("GraphBuilder");

        rule.check(classes);
    }

    /**
     * Verifies exporters do not depend on validation.
     */
    @Test
    void exporters_shouldNotDependOnValidation() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.export..")
            .should().dependOnClassesThat().resideInAPackage("..core.validation..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes are low-level and reusable.
     */
    @Test
    void utilClasses_shouldNotDependOnEngineCode() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.graph..", "..core.validation..", "..core.export..");

        rule.check(classes);
    }
}
