package dev.feedbridge.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.feedbridge", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Feature packages should not depend on the loop or on service adapters.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..source..", "..state..", "..schedule..", "..session..",
                "..ingest..", "..publish..", "..sweep..", "..refresh.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..bridge..", "..instapaper..", "..miniflux.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..instapaper..")
            .should().dependOnClassesThat().resideInAPackage("..miniflux..");

    @ArchTest
    static final ArchRule miniflux_should_not_depend_on_instapaper =
        noClasses().that().resideInAPackage("..miniflux..")
            .should().dependOnClassesThat().resideInAPackage("..instapaper..");

    // OAuth signing stays inside the Instapaper adapter
    @ArchTest
    static final ArchRule only_instapaper_uses_oauth =
        noClasses().that().resideOutsideOfPackage("..instapaper..")
            .should().dependOnClassesThat().resideInAPackage("com.github.scribejava..");

    // Config package should not depend on feature or adapter packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..source..", "..session..", "..ingest..", "..publish..",
                "..bridge..", "..instapaper..", "..miniflux.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.feedbridge.(*)..").should().beFreeOfCycles();
}
