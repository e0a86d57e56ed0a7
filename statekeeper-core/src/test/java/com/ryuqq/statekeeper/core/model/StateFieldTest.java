package com.ryuqq.statekeeper.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateField Value Object 테스트.
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class StateFieldTest {

    @Test
    void of_ValidName_CreatesStateField() {
        // Given
        String name = "aasm_state";

        // When
        StateField field = StateField.of(name);

        // Then
        assertEquals(name, field.getName());
    }

    @Test
    void defaultField_UsesDefaultName() {
        // When
        StateField field = StateField.defaultField();

        // Then
        assertEquals(StateField.DEFAULT_NAME, field.getName());
        assertEquals("state", field.getName());
    }

    @Test
    void of_NullName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> StateField.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> StateField.of("  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_NameStartingWithDigit_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> StateField.of("1state")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_NameWithHyphen_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateField.of("order-state"));
    }

    @Test
    void of_TooLongName_ThrowsException() {
        // Given
        String name = "s".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> StateField.of(name)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void equals_SameName_AreEqual() {
        // Given
        StateField a = StateField.of("status");
        StateField b = StateField.of("status");

        // When & Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, StateField.of("state"));
    }
}
