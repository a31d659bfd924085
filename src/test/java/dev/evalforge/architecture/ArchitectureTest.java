package dev.evalforge.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.evalforge", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Collaborator contracts know the domain types, never the orchestrator.
    @ArchTest
    static final ArchRule pipeline_should_not_depend_on_orchestration =
        noClasses().that().resideInAPackage("..pipeline..")
            .should().dependOnClassesThat().resideInAPackage("..evaluation..")
            .allowEmptyShould(true);

    // Custom metrics are evaluated independently of the built-in calculator.
    @ArchTest
    static final ArchRule custom_metrics_should_stand_alone =
        noClasses().that().resideInAPackage("..custom..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..metrics..", "..evaluation..", "..pipeline.."
            )
            .allowEmptyShould(true);

    // Value packages stay free of calculation and orchestration code
    @ArchTest
    static final ArchRule values_should_not_depend_on_services =
        noClasses().that().resideInAnyPackage("..analysis..", "..testcase..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..metrics..", "..evaluation..", "..pipeline..", "..custom..", "..suggestion.."
            )
            .allowEmptyShould(true);

    // Only the config package wires beans together
    @ArchTest
    static final ArchRule features_should_not_depend_on_config =
        noClasses().that().resideInAnyPackage(
                "..analysis..", "..testcase..", "..metrics..", "..custom..",
                "..suggestion..", "..pipeline..", "..evaluation.."
            )
            .should().dependOnClassesThat().resideInAPackage("dev.evalforge.config..")
            .allowEmptyShould(true);

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.evalforge.(*)..").should().beFreeOfCycles()
            .allowEmptyShould(true);
}
