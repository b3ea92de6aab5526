package com.phillippitts.photobatch.service.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResizePolicyTest {

    @Test
    void shouldScaleLongestSideAndForceEvenDimensions() {
        ResizePolicy.TargetSize size = ResizePolicy.target(101, 50, 50, RoundingRule.NEAREST);

        assertThat(size.resized()).isTrue();
        assertThat(size.width()).isEqualTo(50);
        assertThat(size.height()).isEqualTo(26);
    }

    @Test
    void truncatingRuleDropsFraction() {
        ResizePolicy.TargetSize size = ResizePolicy.target(101, 50, 50, RoundingRule.TRUNCATE);

        assertThat(size.width()).isEqualTo(50);
        assertThat(size.height()).isEqualTo(24);
    }

    @Test
    void portraitScalesHeight() {
        ResizePolicy.TargetSize size = ResizePolicy.target(3000, 4000, 2000, RoundingRule.NEAREST);

        assertThat(size.width()).isEqualTo(1500);
        assertThat(size.height()).isEqualTo(2000);
    }

    @Test
    void smallImagesKeepTheirSize() {
        ResizePolicy.TargetSize size = ResizePolicy.target(31, 17, 3000, RoundingRule.NEAREST);

        assertThat(size.resized()).isFalse();
        assertThat(size.width()).isEqualTo(31);
        assertThat(size.height()).isEqualTo(17);
    }

    @Test
    void longestSideEqualToLimitIsNotResized() {
        assertThat(ResizePolicy.target(3000, 2000, 3000, RoundingRule.NEAREST).resized()).isFalse();
    }

    @Test
    void shouldNeverCollapseThinImagesToZero() {
        ResizePolicy.TargetSize size = ResizePolicy.target(10000, 1, 100, RoundingRule.TRUNCATE);

        assertThat(size.width()).isEqualTo(100);
        assertThat(size.height()).isEqualTo(2);
    }

    @Test
    void rejectsNonPositiveInput() {
        assertThatThrownBy(() -> ResizePolicy.target(0, 10, 100, RoundingRule.NEAREST))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResizePolicy.target(10, 10, 0, RoundingRule.NEAREST))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
