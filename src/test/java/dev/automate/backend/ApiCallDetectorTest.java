package dev.automate.backend;

import dev.automate.model.Route;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiCallDetectorTest {

    @Test
    void recognizesStreamingCalls() {
        assertThat(ApiCallDetector.isStreamingCall("scope_hsi.get_data(\"ch1\")")).isTrue();
        assertThat(ApiCallDetector.classify("with scope_hsi.access_data():")).contains(Route.STREAMING);
    }

    @Test
    void recognizesDriverAndRawCalls() {
        assertThat(ApiCallDetector.isDriverCall("scope.commands.ch[1].scale.write(1)")).isTrue();
        assertThat(ApiCallDetector.isApiCall("scope.write(\"*RST\")")).isTrue();
        assertThat(ApiCallDetector.classify("scope.query(\"*IDN?\")")).contains(Route.COMMAND);
    }

    @Test
    void plainCommandsAreNotCalls() {
        assertThat(ApiCallDetector.isApiCall("CH1:SCAle 1")).isFalse();
        assertThat(ApiCallDetector.classify("*IDN?")).isEmpty();
        assertThat(ApiCallDetector.classify(null)).isEmpty();
    }
}
