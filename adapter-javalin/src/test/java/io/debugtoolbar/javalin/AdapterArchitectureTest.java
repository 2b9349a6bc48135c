package io.debugtoolbar.javalin;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "io.debugtoolbar.javalin", importOptions = ImportOption.DoNotIncludeTests.class)
class AdapterArchitectureTest {

    @ArchTest
    static final ArchRule configMustNotDependOnServer = noClasses()
            .that()
            .resideInAPackage("io.debugtoolbar.javalin.config..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.javalin..", "jakarta.servlet..", "org.eclipse.jetty..")
            .because("Configuration loads before any server exists");

    @ArchTest
    static final ArchRule loggingMustNotDependOnServer = noClasses()
            .that()
            .resideInAPackage("io.debugtoolbar.javalin.logging..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.javalin..", "jakarta.servlet..", "org.eclipse.jetty..");

    @ArchTest
    static final ArchRule nothingDependsOnDemo = noClasses()
            .that()
            .resideOutsideOfPackage("io.debugtoolbar.javalin.demo..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.debugtoolbar.javalin.demo..");
}
