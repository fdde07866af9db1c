package com.storyscene.backend.generation.provider;

import com.storyscene.backend.generation.model.ModelCatalog;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageProviderRouterTest {

    private static ImageProviderClient client(String code) {
        return new ImageProviderClient() {
            @Override
            public String providerCode() {
                return code;
            }

            @Override
            public ImageProviderResult generate(ImageGenerationCall call, Duration timeout) {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Test
    void model_provider_wins_over_the_stub() {
        ImageProviderClient venice = client("venice");
        ImageProviderRouter router = new ImageProviderRouter(List.of(venice, new StubImageProviderClient()));

        assertThat(router.pick(ModelCatalog.require("hidream"))).isSameAs(venice);
        assertThat(router.pick(ModelCatalog.require("gemini-3-pro"))).isInstanceOf(StubImageProviderClient.class);
        assertThat(router.available()).containsExactlyInAnyOrder("VENICE", "STUB");
    }

    @Test
    void no_provider_fails_per_call() {
        ImageProviderRouter router = new ImageProviderRouter(List.of());

        assertThatThrownBy(() -> router.pick(ModelCatalog.require("hidream")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("PROVIDER_NOT_CONFIGURED");
    }

    @Test
    void duplicate_provider_codes_fail_fast() {
        assertThatThrownBy(() -> new ImageProviderRouter(List.of(client("GEMINI"), client(" gemini "))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("DUPLICATE_PROVIDER_CODE: GEMINI");
    }
}
