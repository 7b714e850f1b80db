package com.project.omr.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OmrPropertiesTest {

    @Test
    void defaults_matchDocumentedValues() {
        OmrProperties props = OmrProperties.defaults();

        assertThat(props.fillThreshold()).isEqualTo(40.0);
        assertThat(props.bubbleAreaRange()).isEqualTo(new OmrProperties.AreaRange(200, 8000));
        assertThat(props.aspectRatioRange()).isEqualTo(new OmrProperties.RatioRange(0.7, 1.3));
        assertThat(props.rowThreshold()).isEqualTo(15.0);
        assertThat(props.expectedOptions()).isEqualTo(4);
        assertThat(props.debug()).isFalse();
        assertThat(props.preprocessor()).isEqualTo(OmrProperties.PreprocessorType.JAVA);
        assertThat(props.thresholdMode()).isEqualTo(OmrProperties.ThresholdMode.OTSU);
    }

    @Test
    void withMethods_returnModifiedCopies() {
        OmrProperties base = OmrProperties.defaults();

        OmrProperties changed = base.withFillThreshold(55.5).withRowThreshold(8.0).withBubbleAreaRange(100, 900)
                .withAspectRatioRange(0.8, 1.2).withExpectedOptions(5).withDebug(true);

        assertThat(base.fillThreshold()).isEqualTo(40.0);
        assertThat(changed.fillThreshold()).isEqualTo(55.5);
        assertThat(changed.rowThreshold()).isEqualTo(8.0);
        assertThat(changed.bubbleAreaRange().max()).isEqualTo(900);
        assertThat(changed.aspectRatioRange().min()).isEqualTo(0.8);
        assertThat(changed.expectedOptions()).isEqualTo(5);
        assertThat(changed.debug()).isTrue();
    }

    @Test
    void rejectsInvalidValues() {
        OmrProperties base = OmrProperties.defaults();

        assertThatThrownBy(() -> base.withFillThreshold(100.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withFillThreshold(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withRowThreshold(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withBubbleAreaRange(500, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withBubbleAreaRange(0, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withAspectRatioRange(0.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withAspectRatioRange(1.4, 1.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withExpectedOptions(27)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OmrProperties.Batch(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ranges_areInclusive() {
        OmrProperties.AreaRange area = new OmrProperties.AreaRange(200, 8000);
        OmrProperties.RatioRange ratio = new OmrProperties.RatioRange(0.7, 1.3);

        assertThat(area.contains(200)).isTrue();
        assertThat(area.contains(8000)).isTrue();
        assertThat(area.contains(8001)).isFalse();
        assertThat(ratio.contains(0.7)).isTrue();
        assertThat(ratio.contains(1.3)).isTrue();
        assertThat(ratio.contains(1.31)).isFalse();
    }

    @Test
    void batchWorkers_zeroMeansAvailableProcessors() {
        assertThat(new OmrProperties.Batch(0).effectiveWorkers()).isGreaterThanOrEqualTo(1);
        assertThat(new OmrProperties.Batch(3).effectiveWorkers()).isEqualTo(3);
    }
}
