package io.journeyguard.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RawTextRepair")
class RawTextRepairTest {

    @Test
    void wellFormedTextIsUnchanged() {
        String text = "{\"a\": \"line\\nbreak \\\"quoted\\\"\"}";

        var result = RawTextRepair.repair(text);

        assertThat(result.text()).isEqualTo(text);
        assertThat(result.fixes()).isZero();
        assertThat(result.changed()).isFalse();
    }

    @Test
    void overEscapedQuotesCollapse() {
        // {"a": "say \\"hi\\""}  ->  {"a": "say \"hi\""}
        var result = RawTextRepair.repair("{\"a\": \"say \\\\\"hi\\\\\"\"}");

        assertThat(result.text()).isEqualTo("{\"a\": \"say \\\"hi\\\"\"}");
        assertThat(result.fixes()).isEqualTo(2);
        assertThat(result.changed()).isTrue();
    }

    @Test
    void everyEscapeKindIsCovered() {
        var result = RawTextRepair.repair("\\\\n \\\\t \\\\r \\\\/");

        assertThat(result.text()).isEqualTo("\\n \\t \\r \\/");
        assertThat(result.fixes()).isEqualTo(4);
    }

    @Test
    void nestedLevelsAreRemovedOverSeveralPasses() {
        // four backslashes before n take three passes to reach a single escape
        var result = RawTextRepair.repair("\\\\\\\\n");

        assertThat(result.text()).isEqualTo("\\n");
        assertThat(result.fixes()).isEqualTo(3);
    }

    @Test
    void nullTextIsRejected() {
        assertThatNullPointerException().isThrownBy(() -> RawTextRepair.repair(null));
    }
}
