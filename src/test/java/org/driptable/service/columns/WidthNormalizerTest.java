package org.driptable.service.columns;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WidthNormalizerTest {

    @Test
    void appendsPixelsToBareIntegers() {
        assertThat(WidthNormalizer.normalize("120")).isEqualTo("120px");
        assertThat(WidthNormalizer.normalize(120)).isEqualTo("120px");
        assertThat(WidthNormalizer.normalize("0")).isEqualTo("0px");
    }

    @Test
    void isIdempotent() {
        String once = WidthNormalizer.normalize("120");

        assertThat(WidthNormalizer.normalize(once)).isEqualTo("120px");
        assertThat(WidthNormalizer.normalize("120px")).isEqualTo("120px");
    }

    @Test
    void passesOtherValuesThrough() {
        assertThat(WidthNormalizer.normalize("50%")).isEqualTo("50%");
        assertThat(WidthNormalizer.normalize("-10")).isEqualTo("-10");
        assertThat(WidthNormalizer.normalize("12.5")).isEqualTo("12.5");
        assertThat(WidthNormalizer.normalize(null)).isNull();
    }
}
