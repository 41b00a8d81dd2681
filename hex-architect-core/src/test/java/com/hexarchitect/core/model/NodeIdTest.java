package com.hexarchitect.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeId}.
 */
class NodeIdTest {

    @Test
    void of_sameTypeName_returnsEqualIds() {
        assertThat(NodeId.of("UserRepository")).isEqualTo(NodeId.of("UserRepository"));
        assertThat(NodeId.of("UserRepository").hashCode()).isEqualTo(NodeId.of("UserRepository").hashCode());
    }

    @Test
    void of_surroundingWhitespace_isStripped() {
        assertThat(NodeId.of("  User ")).isEqualTo(NodeId.of("User"));
        assertThat(NodeId.of("  User ").value()).isEqualTo("User");
    }

    @Test
    void of_differentCase_returnsDifferentIds() {
        assertThat(NodeId.of("user")).isNotEqualTo(NodeId.of("User"));
    }

    @Test
    void of_blankName_throwsException() {
        assertThatThrownBy(() -> NodeId.of("   "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }

    @Test
    void of_nullName_throwsException() {
        assertThatThrownBy(() -> NodeId.of(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void key_isStableHexOfFixedLength() {
        String key = NodeId.of("Order").key();

        assertThat(key).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(NodeId.of("Order").key()).isEqualTo(key);
        assertThat(NodeId.of("OrderMapper").key()).isNotEqualTo(key);
    }

    @Test
    void compareTo_ordersByValue() {
        assertThat(NodeId.of("A")).isLessThan(NodeId.of("B"));
    }

    @Test
    void toString_returnsValue() {
        assertThat(NodeId.of("Order")).hasToString("Order");
    }
}
