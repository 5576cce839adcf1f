package com.priceradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RestController;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Enforces package boundaries between application modules. Run in CI.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.priceradar");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..source..", "..reconciliation..", "..snapshot..", "..config..", "..api..", "..common..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..domain..", "..source..", "..reconciliation..", "..snapshot..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void reconciliation_must_not_do_io() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..reconciliation..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..source..", "..snapshot..", "..api..", "org.springframework.web..", "reactor..");
        rule.check(classes);
    }

    @Test
    void source_must_not_depend_on_snapshot_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..source..")
                .should().dependOnClassesThat().resideInAnyPackage("..snapshot..", "..api..", "..reconciliation..");
        rule.check(classes);
    }

    @Test
    void snapshot_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..snapshot..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void only_api_declares_controllers() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("..api..")
                .should().beAnnotatedWith(RestController.class);
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.priceradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
