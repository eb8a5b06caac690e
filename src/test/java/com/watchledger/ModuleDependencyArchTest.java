package com.watchledger;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: engines are plain computations over domain records; wiring lives in config and report.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.watchledger");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.watchledger.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.watchledger.domain..", "com.watchledger.analytics..", "com.watchledger.config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.watchledger.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.watchledger.analytics..", "com.watchledger.config..");
        rule.check(classes);
    }

    @Test
    void engines_must_not_depend_on_report_or_config() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage(
                        "..analytics.normalizer..", "..analytics.metrics..", "..analytics.monthly..",
                        "..analytics.goal..", "..analytics.leaderboard..", "..analytics.contact..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..analytics.report..", "..analytics.config..", "com.watchledger.config..");
        rule.check(classes);
    }

    @Test
    void engines_must_not_read_the_clock_bean_or_cache() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage(
                        "..analytics.metrics..", "..analytics.monthly..", "..analytics.goal..",
                        "..analytics.leaderboard..", "..analytics.contact..")
                .should().dependOnClassesThat().resideInAnyPackage("org.springframework.cache..")
                .orShould().dependOnClassesThat().belongToAnyOf(Clock.class);
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.watchledger.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
