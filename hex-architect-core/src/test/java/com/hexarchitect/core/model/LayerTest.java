package com.hexarchitect.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Layer} and {@link Role} parsing.
 */
class LayerTest {

    @Test
    void rank_increasesFromDomainOutward() {
        assertThat(Layer.DOMAIN.rank()).isLessThan(Layer.PORT.rank());
        assertThat(Layer.PORT.rank()).isLessThan(Layer.APPLICATION.rank());
        assertThat(Layer.APPLICATION.rank()).isLessThan(Layer.ADAPTER.rank());
        assertThat(Layer.ADAPTER.rank()).isLessThan(Layer.INFRASTRUCTURE.rank());
    }

    @ParameterizedTest
    @ValueSource(strings = {"domain", "Domain", "DOMAIN", " domain "})
    void parse_anyCase_returnsLayer(String text) {
        assertThat(Layer.parse(text)).contains(Layer.DOMAIN);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "core", "domains"})
    void parse_unknownText_returnsEmpty(String text) {
        assertThat(Layer.parse(text)).isEmpty();
    }

    @Test
    void toString_returnsDisplayName() {
        assertThat(Layer.INFRASTRUCTURE).hasToString("Infrastructure");
    }

    @ParameterizedTest
    @ValueSource(strings = {"value_object", "ValueObject", "value-object", "VALUE_OBJECT"})
    void roleParse_separatorVariants_returnsRole(String text) {
        assertThat(Role.parse(text)).contains(Role.VALUE_OBJECT);
    }

    @Test
    void roleParse_unknownText_returnsEmpty() {
        assertThat(Role.parse("controller")).isEmpty();
    }
}
