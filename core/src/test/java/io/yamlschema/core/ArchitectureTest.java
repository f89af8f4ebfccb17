package io.yamlschema.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Package boundaries of the core module. */
@AnalyzeClasses(
        packages = "io.yamlschema.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureTest {

    @ArchTest
    static final ArchRule noCliDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.yamlschema.cli..")
            .because("the engine must be usable without the command-line front end");

    @ArchTest
    static final ArchRule errorsAreSelfContained = classes()
            .that()
            .resideInAPackage("io.yamlschema.core.error..")
            .should()
            .onlyDependOnClassesThat()
            .resideInAnyPackage("io.yamlschema.core.error..", "java..")
            .because("error trees are plain values shared by compiler and validator");

    @ArchTest
    static final ArchRule modelDoesNotDependOnCompiler = noClasses()
            .that()
            .resideInAPackage("io.yamlschema.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.yamlschema.core.spec..")
            .because("compiled nodes must not know how they were built");

    @ArchTest
    static final ArchRule noLoggingBackend = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("core logs through the SLF4J API only");
}
