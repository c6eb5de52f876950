package io.journeyguard.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.journeyguard.core.spi.JourneyAnalyzer;

/**
 * Architecture guardrails for the core module: no dependency on the CLI or on a concrete logging
 * backend, a model package that sits below the analyzers and repairs, and stateless analyzers.
 */
@AnalyzeClasses(
        packages = "io.journeyguard.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noCliDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.journeyguard.cli..")
            .because("the core library must be usable without the command-line front end");

    @ArchTest
    static final ArchRule noLoggingBackend = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("core logs through the SLF4J API only");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule modelStaysBelowAnalysis = noClasses()
            .that()
            .resideInAPackage("io.journeyguard.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.journeyguard.core.engine..",
                    "io.journeyguard.core.repair..",
                    "io.journeyguard.core.document..",
                    "io.journeyguard.core.structure..",
                    "io.journeyguard.core.variables..")
            .because("the graph model is shared by every analyzer and repair");

    @ArchTest
    static final ArchRule analyzersHaveOnlyFinalFields = classes()
            .that()
            .implement(JourneyAnalyzer.class)
            .should()
            .haveOnlyFinalFields()
            .because("one analyzer instance serves concurrent runs");
}
