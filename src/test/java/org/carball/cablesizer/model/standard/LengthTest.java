package org.carball.cablesizer.model.standard;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class LengthTest {

    @Test
    void shouldConvertFeetToMeters() {
        // Given
        Length length = Length.feet(100);

        // When
        Length converted = length.to(LengthUnit.METERS);

        // Then
        assertThat(converted.value()).isCloseTo(30.48, within(1e-9));
        assertThat(converted.unit()).isEqualTo(LengthUnit.METERS);
    }

    @Test
    void shouldReturnSameInstanceWhenUnitMatches() {
        // Given
        Length length = Length.meters(50);

        // When/Then
        assertThat(length.to(LengthUnit.METERS)).isSameAs(length);
        assertThat(length.isIn(LengthUnit.METERS)).isTrue();
        assertThat(length.isIn(LengthUnit.FEET)).isFalse();
    }

    @Test
    void shouldRejectMissingUnit() {
        assertThatThrownBy(() -> new Length(10, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unit");
    }

    @Test
    void shouldParseUnitNames() {
        assertThat(LengthUnit.fromName("ft")).isEqualTo(LengthUnit.FEET);
        assertThat(LengthUnit.fromName("Metres")).isEqualTo(LengthUnit.METERS);
        assertThatThrownBy(() -> LengthUnit.fromName("yards"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
