package stac;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.syntax.ArchRuleDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("stac");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.core..")
                    .should().dependOnClassesThat().resideInAPackage("stac.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on adapter config")
        void coreShouldNotDependOnConfig() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.core..")
                    .should().dependOnClassesThat().resideInAPackage("stac.config..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Backend SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter")
        void spiShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.spi..")
                    .should().dependOnClassesThat().resideInAPackage("stac.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("SPI should not depend on ports")
        void spiShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.spi..")
                    .should().dependOnClassesThat().resideInAPackage("stac.core.port..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("stac.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("stac.core.port.in..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Model Rules")
    class ModelRules {

        @Test
        @DisplayName("Models should not depend on services")
        void modelsShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("stac.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("stac.core.port..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on the backend SPI")
        void modelsShouldNotDependOnSpi() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("stac.spi..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Inbound Adapter Rules")
    class InboundAdapterRules {

        @Test
        @DisplayName("REST resources should reach the backend only through inbound ports")
        void restResourcesShouldNotCallBackendClients() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("stac.adapter.in.rest..")
                    .should().dependOnClassesThat().haveSimpleNameEndingWith("Client")
                    .orShould().dependOnClassesThat().resideInAPackage("stac.core.service..");

            rule.check(importedClasses);
        }
    }
}
