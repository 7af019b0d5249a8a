package com.arbor.restart.infra.config;

import com.arbor.restart.api.model.EstimationMethod;
import com.arbor.restart.api.model.ForecastMethod;
import com.arbor.restart.api.model.ProgressMeasure;
import com.arbor.restart.api.model.RestartPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestartConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should use documented defaults without any source")
    void shouldUseDefaults() {
        RestartConfig config = RestartConfig.fromProperties(new Properties(), key -> null);

        assertThat(config.getRestartPolicy()).isEqualTo(RestartPolicy.NEVER);
        assertThat(config.getEstimationMethod()).isEqualTo(EstimationMethod.TREE_SIZE);
        assertThat(config.getProgressMeasure()).isEqualTo(ProgressMeasure.UNIFORM);
        assertThat(config.getForecastMethod()).isEqualTo(ForecastMethod.LINEAR);
        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.isUseAcceleration()).isFalse();
        assertThat(config.getRestartLimit()).isEqualTo(1);
        assertThat(config.getMinNodes()).isEqualTo(1000L);
        assertThat(config.isCountOnlyLeaves()).isFalse();
        assertThat(config.getEstimationFactor()).isEqualTo(2.0);
        assertThat(config.getHitCounterLimit()).isEqualTo(50);
        assertThat(config.isPrintReports()).isFalse();
        assertThat(config.getRegForestFilename()).isEqualTo(RestartConfig.NO_FOREST);
        assertThat(config.hasRegForest()).isFalse();
    }

    @Test
    void loadDefault_readsBundledProperties() {
        RestartConfig config = RestartConfig.loadDefault();

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getRestartPolicy()).isNotNull();
    }

    @Test
    void fromProperties_parsesEveryOption() {
        Properties props = new Properties();
        props.setProperty("restarts/restartpolicy", "e");
        props.setProperty("restarts/estimationmethod", "p");
        props.setProperty("restarts/progressmeasure", "g");
        props.setProperty("restarts/forecast", "w");
        props.setProperty("restarts/windowsize", "250");
        props.setProperty("restarts/useacceleration", "true");
        props.setProperty("restarts/restartlimit", "-1");
        props.setProperty("restarts/minnodes", "50");
        props.setProperty("restarts/countonlyleaves", "yes");
        props.setProperty("restarts/estimation/factor", "3.5");
        props.setProperty("restarts/hitcounterlim", "7");
        props.setProperty("restarts/printreports", "1");
        props.setProperty("restarts/regforestfilename", "forest.rfcsv");

        RestartConfig config = RestartConfig.fromProperties(props, key -> null);

        assertThat(config.getRestartPolicy()).isEqualTo(RestartPolicy.ESTIMATION);
        assertThat(config.getEstimationMethod()).isEqualTo(EstimationMethod.TREE_PROFILE);
        assertThat(config.getProgressMeasure()).isEqualTo(ProgressMeasure.GAP);
        assertThat(config.getForecastMethod()).isEqualTo(ForecastMethod.WINDOW);
        assertThat(config.getWindowSize()).isEqualTo(250);
        assertThat(config.isUseAcceleration()).isTrue();
        assertThat(config.getRestartLimit()).isEqualTo(-1);
        assertThat(config.getMinNodes()).isEqualTo(50L);
        assertThat(config.isCountOnlyLeaves()).isTrue();
        assertThat(config.getEstimationFactor()).isEqualTo(3.5);
        assertThat(config.getHitCounterLimit()).isEqualTo(7);
        assertThat(config.isPrintReports()).isTrue();
        assertThat(config.hasRegForest()).isTrue();
    }

    @Test
    @DisplayName("Should let environment variables override file values")
    void shouldPreferEnvironment() {
        Properties props = new Properties();
        props.setProperty("restarts/restartpolicy", "e");
        props.setProperty("restarts/estimation/factor", "3.0");
        Map<String, String> env = Map.of(
                "RESTARTS_RESTARTPOLICY", "p",
                "RESTARTS_ESTIMATION_FACTOR", "4.0");

        RestartConfig config = RestartConfig.fromProperties(props, env::get);

        assertThat(config.getRestartPolicy()).isEqualTo(RestartPolicy.PROGRESS);
        assertThat(config.getEstimationFactor()).isEqualTo(4.0);
    }

    @Test
    void toEnvironmentKey_replacesSlashes() {
        assertThat(RestartConfig.toEnvironmentKey("restarts/estimation/factor")).isEqualTo("RESTARTS_ESTIMATION_FACTOR");
    }

    @Test
    void loadFromProperties_fromFile() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "restarts/restartpolicy=a\nrestarts/minnodes=-1\n");

        RestartConfig config = RestartConfig.loadFromProperties(file.toString());

        assertThat(config.getRestartPolicy()).isEqualTo(RestartPolicy.ALWAYS);
        assertThat(config.getMinNodes()).isEqualTo(-1L);
    }

    @Test
    void loadFromProperties_missingFileUsesDefaults() {
        RestartConfig config = RestartConfig.loadFromProperties(tempDir.resolve("missing.properties").toString());

        assertThat(config.getHitCounterLimit()).isEqualTo(50);
    }

    @Test
    void toBuilder_copiesValues() {
        RestartConfig original = RestartConfig.builder()
                .restartPolicy(RestartPolicy.ALWAYS)
                .windowSize(10)
                .build();

        RestartConfig copy = original.toBuilder().hitCounterLimit(3).build();

        assertThat(copy.getRestartPolicy()).isEqualTo(RestartPolicy.ALWAYS);
        assertThat(copy.getWindowSize()).isEqualTo(10);
        assertThat(copy.getHitCounterLimit()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> RestartConfig.builder().windowSize(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
        assertThatThrownBy(() -> RestartConfig.builder().windowSize(501).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RestartConfig.builder().restartLimit(-2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("restartLimit");
        assertThatThrownBy(() -> RestartConfig.builder().minNodes(-5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RestartConfig.builder().estimationFactor(0.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("estimationFactor");
        assertThatThrownBy(() -> RestartConfig.builder().estimationFactor(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RestartConfig.builder().hitCounterLimit(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RestartConfig.builder().regForestFilename("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromProperties_rejectsUnknownCodes() {
        Properties props = new Properties();
        props.setProperty("restarts/restartpolicy", "x");

        assertThatThrownBy(() -> RestartConfig.fromProperties(props, key -> null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("restart policy");
    }

    @Test
    void fromProperties_rejectsMalformedNumbers() {
        Properties props = new Properties();
        props.setProperty("restarts/windowsize", "many");

        assertThatThrownBy(() -> RestartConfig.fromProperties(props, key -> null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("restarts/windowsize");
    }

    @Test
    void fromProperties_rejectsMalformedBooleans() {
        Properties props = new Properties();
        props.setProperty("restarts/printreports", "maybe");

        assertThatThrownBy(() -> RestartConfig.fromProperties(props, key -> null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bool");
    }
}
