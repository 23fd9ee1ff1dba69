package com.migration.planning.waveforge.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavePlanningPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(WavePlanningConfig.class);

    @Test
    void bindsOverriddenValues() {
        contextRunner
                .withPropertyValues(
                        "wave-planning.min-size=10",
                        "wave-planning.max-size=20",
                        "wave-planning.category-waves=false",
                        "wave-planning.prioritize-patterns[0]=PKG_*",
                        "wave-planning.prioritize-patterns[1]=dbo.[Orders]",
                        "wave-planning.transitive-depth-limit=5")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    WavePlanningOptions options = context.getBean(WavePlanningOptions.class);
                    assertThat(options.getMinSize()).isEqualTo(10);
                    assertThat(options.getMaxSize()).isEqualTo(20);
                    assertThat(options.isCategoryWaves()).isFalse();
                    assertThat(options.getPrioritizePatterns()).containsExactly("PKG_*", "dbo.[Orders]");
                    assertThat(options.getTransitiveDepthLimit()).isEqualTo(5);
                    assertThat(options.getEtlCategory()).isEqualTo("ETL");
                });
    }

    @Test
    void failsWhenMinSizeExceedsMaxSize() {
        contextRunner
                .withPropertyValues("wave-planning.min-size=90")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void failsOnNonPositiveSize() {
        contextRunner
                .withPropertyValues("wave-planning.max-size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void optionsValidation_rejectsBadBounds() {
        assertThatThrownBy(() -> WavePlanningOptions.builder().minSize(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WavePlanningOptions.builder().transitiveDepthLimit(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        WavePlanningOptions.defaults().validate();
    }
}
