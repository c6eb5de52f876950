package io.journeyguard.core.variables;

import static org.assertj.core.api.Assertions.assertThat;

import io.journeyguard.core.variables.ExpressionReferences.FieldAccess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionReferencesTest {

    @Nested
    @DisplayName("references")
    class References {

        @Test
        void dottedAccessYieldsRootName() {
            assertThat(ExpressionReferences.references("user.name")).containsExactly("user");
        }

        @Test
        void keywordsAreIgnored() {
            assertThat(ExpressionReferences.references("flag == true && other != null")).containsExactly("flag", "other");
        }

        @Test
        void quotedStringsAreIgnored() {
            assertThat(ExpressionReferences.references("status == \"done\" ? next : 'fallback'"))
                    .containsExactly("status", "next");
        }

        @Test
        void interpolationsAreReadFromTemplates() {
            assertThat(ExpressionReferences.references("`Hello ${first} ${last.name}!`"))
                    .containsExactly("first", "last");
        }

        @Test
        void wrappedTemplateWithoutInterpolationHasNoReferences() {
            assertThat(ExpressionReferences.references("`just text`")).isEmpty();
        }

        @Test
        void backtickSegmentsAreDroppedFromConcatenation() {
            assertThat(ExpressionReferences.references("`Hi ` + name")).containsExactly("name");
        }

        @Test
        void literalsHaveNoReferences() {
            assertThat(ExpressionReferences.references("\"Welcome\"")).isEmpty();
            assertThat(ExpressionReferences.references("42")).isEmpty();
            assertThat(ExpressionReferences.references(null)).isEmpty();
            assertThat(ExpressionReferences.references("")).isEmpty();
        }

        @Test
        void platformCallsAreNotVariables() {
            assertThat(ExpressionReferences.references("count > @std.len(items)")).containsExactly("count");
        }

        @Test
        void duplicatesAreKept() {
            assertThat(ExpressionReferences.references("a + a")).containsExactly("a", "a");
        }
    }

    @Nested
    @DisplayName("fieldAccesses")
    class FieldAccesses {

        @Test
        void firstFieldOfChainIsKept() {
            assertThat(ExpressionReferences.fieldAccesses("user.profile.email"))
                    .containsExactly(new FieldAccess("user", "profile"));
        }

        @Test
        void plainNameHasNoAccess() {
            assertThat(ExpressionReferences.fieldAccesses("count")).isEmpty();
        }

        @Test
        void accessesInsideInterpolationsAreFound() {
            assertThat(ExpressionReferences.fieldAccesses("`Dear ${user.name}, code ${otp.code}`"))
                    .containsExactly(new FieldAccess("user", "name"), new FieldAccess("otp", "code"));
        }

        @Test
        void platformCallsAndStringsAreIgnored() {
            assertThat(ExpressionReferences.fieldAccesses("@policy.get(\"a.b\")")).isEmpty();
            assertThat(ExpressionReferences.fieldAccesses("\"x.y\"")).isEmpty();
        }

        @Test
        void numbersAreNotAccesses() {
            assertThat(ExpressionReferences.fieldAccesses("amount * 1.5")).isEmpty();
        }
    }

    @Test
    void interpolationBodiesInOrder() {
        assertThat(ExpressionReferences.interpolations("${a} and ${b + 1}")).containsExactly("a", "b + 1");
    }
}
