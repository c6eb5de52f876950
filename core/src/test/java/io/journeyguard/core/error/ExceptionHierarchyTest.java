package io.journeyguard.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two abstract tiers and every concrete type. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void journeyExceptionIsAbstractAndRoot() {
        assertThat(JourneyException.class).isAbstract();
        assertThat(JourneyException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void journeyLoadExceptionIsAbstract() {
        assertThat(JourneyLoadException.class).isAbstract();
        assertThat(JourneyLoadException.class.getSuperclass()).isEqualTo(JourneyException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void documentParseExceptionExtendsLoadException() {
        var ex = new DocumentParseException("not json", "journey.json");

        assertThat(ex).isInstanceOf(JourneyLoadException.class);
        assertThat(ex.documentName()).isEqualTo("journey.json");
        assertThat(ex.source()).isEqualTo("journey.json");
        assertThat(ex.detail()).isEqualTo("not json");
        assertThat(ex.phase()).isEqualTo(JourneyException.Phase.LOAD);
    }

    @Test
    void documentParseExceptionKeepsCause() {
        var cause = new IOException("disk");
        var ex = new DocumentParseException("unreadable", cause, "journey.json");

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void envelopeExceptionExtendsLoadException() {
        var ex = new EnvelopeException("no workflow", "journey.json");

        assertThat(ex).isInstanceOf(JourneyLoadException.class);
        assertThat(ex.phase()).isEqualTo(JourneyException.Phase.LOAD);
    }

    @Test
    void registryLoadExceptionCarriesSourceButNoDocument() {
        var ex = new RegistryLoadException("bad registry", "/etc/registry.json");

        assertThat(ex).isInstanceOf(JourneyLoadException.class);
        assertThat(ex.source()).isEqualTo("/etc/registry.json");
        assertThat(ex.documentName()).isNull();
    }

    // --- Repair-time exceptions ---

    @Test
    void persistExceptionIsRepairPhase() {
        var cause = new IOException("read-only");
        var ex = new PersistException("Failed to write", cause, "journey.json");

        assertThat(ex).isNotInstanceOf(JourneyLoadException.class);
        assertThat(ex.phase()).isEqualTo(JourneyException.Phase.REPAIR);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.documentName()).isEqualTo("journey.json");
    }

    @Test
    void fieldReplacementExceptionCarriesFieldPath() {
        var ex = new FieldReplacementException("Field not found", "abc/action/text");

        assertThat(ex.fieldPath()).isEqualTo("abc/action/text");
        assertThat(ex.phase()).isEqualTo(JourneyException.Phase.REPAIR);
    }
}
