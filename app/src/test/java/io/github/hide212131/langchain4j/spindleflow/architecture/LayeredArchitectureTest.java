package io.github.hide212131.langchain4j.spindleflow.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
        packages = "io.github.hide212131.langchain4j.spindleflow",
        importOptions = ImportOption.DoNotIncludeTests.class)
class LayeredArchitectureTest {

    private static final String APP = "io.github.hide212131.langchain4j.spindleflow.app..";
    private static final String RUNTIME = "io.github.hide212131.langchain4j.spindleflow.runtime..";
    private static final String INFRA = "io.github.hide212131.langchain4j.spindleflow.infra..";

    @ArchTest
    static final ArchRule appModuleShouldOnlyDependOnAllowedLayers =
            classes()
                    .that()
                    .resideInAPackage(APP)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            APP,
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "picocli..",
                            "dev.langchain4j..");

    @ArchTest
    static final ArchRule runtimeModuleShouldNotDependOnAppNorOtherLayers =
            classes()
                    .that()
                    .resideInAPackage(RUNTIME)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(
                            RUNTIME,
                            INFRA,
                            "java..",
                            "javax..",
                            "org.slf4j..",
                            "dev.langchain4j..",
                            "org.yaml..",
                            "com.fasterxml.jackson..",
                            "io.github.cdimascio..");

    @ArchTest
    static final ArchRule infraModuleShouldBeLeafLayer =
            classes()
                    .that()
                    .resideInAPackage(INFRA)
                    .should()
                    .onlyDependOnClassesThat()
                    .resideInAnyPackage(INFRA, "java..", "javax..", "org.slf4j..", "io.opentelemetry..");

    @ArchTest
    static final ArchRule onlyTheProviderPackageTalksToOpenAiChatModels =
            noClasses()
                    .that()
                    .resideOutsideOfPackages(
                            "io.github.hide212131.langchain4j.spindleflow.runtime.provider..", APP)
                    .should()
                    .dependOnClassesThat()
                    .resideInAPackage("dev.langchain4j.model.openai..");
}
