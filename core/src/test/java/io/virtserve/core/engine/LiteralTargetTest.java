package io.virtserve.core.engine;

import static io.virtserve.core.model.PredicateOperator.CONTAINS;
import static io.virtserve.core.model.PredicateOperator.ENDS_WITH;
import static io.virtserve.core.model.PredicateOperator.EQUALS;
import static io.virtserve.core.model.PredicateOperator.STARTS_WITH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.virtserve.core.model.PredicateOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LiteralTargetTest {

    private static LiteralTarget target(PredicateOperator operator, String value) {
        return new LiteralTarget(operator, value, true);
    }

    @Test
    void caseInsensitiveTargetComparesLoweredActual() {
        LiteralTarget target = new LiteralTarget(EQUALS, "/API", false);

        assertThat(target.test("/Api", "/api")).isTrue();
        assertThat(new LiteralTarget(EQUALS, "/API", true).test("/Api", "/api")).isFalse();
    }

    @Test
    void rejectsNonLiteralOperators() {
        assertThatThrownBy(() -> new LiteralTarget(PredicateOperator.MATCHES, "x", true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LiteralTarget(PredicateOperator.EXISTS, "x", true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0}({1}) implies {2}({3}): {4}")
    @CsvSource({
        "equals,     /orders/1, equals,     /orders/1, true",
        "equals,     /orders/1, startsWith, /orders,   true",
        "equals,     /orders/1, endsWith,   /1,        true",
        "equals,     /orders/1, contains,   ders,      true",
        "startsWith, /orders/,  startsWith, /ord,      true",
        "startsWith, /orders/,  contains,   rder,      true",
        "endsWith,   .json,     endsWith,   json,      true",
        "startsWith, /orders,   equals,     /orders,   false",
        "startsWith, /orders,   endsWith,   s,         false",
        "equals,     /orders/1, startsWith, /users,    false",
        "contains,   abc,       contains,   b,         true",
    })
    void implication(String op, String value, String otherOp, String otherValue, boolean expected) {
        LiteralTarget a = target(PredicateOperator.fromKey(op), value);
        LiteralTarget b = target(PredicateOperator.fromKey(otherOp), otherValue);

        assertThat(a.implies(b)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}({1}) contradicts {2}({3}): {4}")
    @CsvSource({
        "equals,     /a,       equals,     /b,       true",
        "equals,     /a,       equals,     /a,       false",
        "equals,     /orders,  startsWith, /users,   true",
        "startsWith, /users,   equals,     /orders,  true",
        "equals,     x.json,   endsWith,   .xml,     true",
        "startsWith, /a/,      startsWith, /b/,      true",
        "startsWith, /a/,      startsWith, /a/b,     false",
        "endsWith,   .json,    endsWith,   .xml,     true",
        "startsWith, /a,       endsWith,   z,        false",
        "equals,     /a,       contains,   zz,       false",
    })
    void contradiction(String op, String value, String otherOp, String otherValue, boolean expected) {
        LiteralTarget a = target(PredicateOperator.fromKey(op), value);
        LiteralTarget b = target(PredicateOperator.fromKey(otherOp), otherValue);

        assertThat(a.contradicts(b)).isEqualTo(expected);
        assertThat(b.contradicts(a)).isEqualTo(expected);
    }

    @Test
    void mixedCaseModesAreNeverFolded() {
        LiteralTarget sensitive = new LiteralTarget(EQUALS, "/a", true);
        LiteralTarget insensitive = new LiteralTarget(EQUALS, "/B", false);

        assertThat(sensitive.contradicts(insensitive)).isFalse();
        assertThat(sensitive.implies(new LiteralTarget(STARTS_WITH, "/", false))).isFalse();
    }

    @Test
    void caseInsensitiveFoldingUsesLowercaseForms() {
        LiteralTarget equals = new LiteralTarget(EQUALS, "/API/v1", false);

        assertThat(equals.implies(new LiteralTarget(STARTS_WITH, "/api", false))).isTrue();
        assertThat(equals.contradicts(new LiteralTarget(ENDS_WITH, "V2", false))).isTrue();
    }

    @Test
    void equalityCoversOperatorValueAndCaseMode() {
        assertThat(target(CONTAINS, "x")).isEqualTo(target(CONTAINS, "x")).hasSameHashCodeAs(target(CONTAINS, "x"));
        assertThat(target(CONTAINS, "x")).isNotEqualTo(new LiteralTarget(CONTAINS, "x", false));
        assertThat(new LiteralTarget(ENDS_WITH, "x", false)).hasToString("endsWith(x, ci)");
    }
}
