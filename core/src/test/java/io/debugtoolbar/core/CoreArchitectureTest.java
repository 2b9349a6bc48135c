package io.debugtoolbar.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Keeps the core free of any web framework so every adapter can reuse it.
 */
@AnalyzeClasses(packages = "io.debugtoolbar.core", importOptions = ImportOption.DoNotIncludeTests.class)
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule coreMustNotDependOnServerFrameworks = noClasses()
            .that()
            .resideInAPackage("io.debugtoolbar.core..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.javalin..", "jakarta.servlet..", "org.eclipse.jetty..")
            .because("Core must stay framework-agnostic; hosts plug in through ResponseSink");

    @ArchTest
    static final ArchRule coreMustNotDependOnLoggingBackend = noClasses()
            .that()
            .resideInAPackage("io.debugtoolbar.core..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("Core logs through SLF4J only; the backend is the host's choice");

    @ArchTest
    static final ArchRule pipelineMustNotDependOnToolbar = noClasses()
            .that()
            .resideInAnyPackage(
                    "io.debugtoolbar.core.capture..",
                    "io.debugtoolbar.core.encoding..",
                    "io.debugtoolbar.core.engine..",
                    "io.debugtoolbar.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.debugtoolbar.core.toolbar..", "io.debugtoolbar.core.panels..")
            .because("The interception pipeline only knows the ResponseHook it is given");
}
