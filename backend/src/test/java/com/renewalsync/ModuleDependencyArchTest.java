package com.renewalsync;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package dependency rules. Run in CI to keep module boundaries.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.renewalsync");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..", "..renewal..");
        rule.check(classes);
    }

    @Test
    void domain_must_not_depend_on_ingestion_renewal_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..renewal..", "..config..");
        rule.check(classes);
    }

    @Test
    void renewal_lock_must_not_depend_on_ingestion() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..renewal..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion..");
        rule.check(classes);
    }

    @Test
    void ingestion_event_handlers_must_not_depend_on_job_or_reorg() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.event..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.job..", "..ingestion.reorg..");
        rule.check(classes);
    }

    @Test
    void ingestion_adapter_must_not_depend_on_store() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.adapter..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion.job..", "..ingestion.event..");
        rule.check(classes);
    }

    @Test
    void only_lock_service_touches_lock_repository() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackages("..renewal.lock..", "..domain..")
                .should().dependOnClassesThat().haveSimpleName("RenewalLockRepository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.renewalsync.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
