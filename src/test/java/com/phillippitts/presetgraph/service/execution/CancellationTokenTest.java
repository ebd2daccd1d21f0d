package com.phillippitts.presetgraph.service.execution;

import com.phillippitts.presetgraph.service.model.InMemoryModelRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void onlyFirstCancelReportsTransition() {
        CancellationToken token = new CancellationToken();
        assertThat(token.isCancelled()).isFalse();

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void runContextObservesSharedToken() {
        CancellationToken token = new CancellationToken();
        RunConfig config = new RunConfig(null, null, new InMemoryModelRegistry(List.of(), "groq"), false);
        RunContext first = new RunContext("r", token, config);
        RunContext branch = new RunContext("r", token, config);

        first.token().cancel();

        assertThat(branch.isCancelled()).isTrue();
        assertThat(config.uiLanguage()).isEqualTo("en");
    }
}
