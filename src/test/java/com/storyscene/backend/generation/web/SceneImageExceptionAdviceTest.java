package com.storyscene.backend.generation.web;

import com.storyscene.backend.auth.security.AccessTokenFilter;
import com.storyscene.backend.auth.security.AuthContext;
import com.storyscene.backend.common.web.RequestIdFilter;
import com.storyscene.backend.credits.dto.CreditBalanceResponse;
import com.storyscene.backend.generation.controller.SceneImageController;
import com.storyscene.backend.generation.dto.ResetScenesResponse;
import com.storyscene.backend.generation.service.SceneGenerationOrchestrator;
import com.storyscene.backend.generation.service.SceneResetService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = SceneImageController.class,
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        },
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = AccessTokenFilter.class)
        }
)
@Import({SceneImageExceptionAdvice.class, RequestIdFilter.class})
class SceneImageExceptionAdviceTest {

    private static final String SCENE = "0b0f7c1e-3f43-4a0e-9d9b-6a1d2c1f0e11";
    private static final String STORY = "6c1e8a0e-0a9c-4d2f-8a71-5e3b0f4f9a22";

    @Autowired MockMvc mvc;

    @MockitoBean AuthContext auth;
    @MockitoBean SceneGenerationOrchestrator orchestrator;
    @MockitoBean SceneResetService resetService;

    private static String body(String json) {
        return json.replace('\'', '"');
    }

    @Test
    void invalid_scene_id_should_400_with_requestId() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "RID-123")
                        .content(body("{'sceneId':'not-a-uuid'}")))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Request-Id", "RID-123"))
                .andExpect(jsonPath("$.errorCode").value("SCENE_ID_INVALID"))
                .andExpect(jsonPath("$.requestId").value("RID-123"));

        Mockito.verifyNoInteractions(orchestrator);
    }

    @Test
    void upstream_credit_failure_should_402_with_details_and_balance() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(orchestrator.generate(eq(1L), any(), anyString())).thenThrow(new SceneGenerationException(
                402, "UPSTREAM_CREDITS_EXHAUSTED", "upstream_generation",
                "AI credits exhausted. Please add credits to continue.", "req-402",
                Map.of("upstreamStatus", 402, "model", "venice-sd35"),
                new CreditBalanceResponse(3, 0, 3, 3), null));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "','artStyle':'anime'}")))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.errorCode").value("UPSTREAM_CREDITS_EXHAUSTED"))
                .andExpect(jsonPath("$.stage").value("upstream_generation"))
                .andExpect(jsonPath("$.requestId").value("req-402"))
                .andExpect(jsonPath("$.details.upstreamStatus").value(402))
                .andExpect(jsonPath("$.credits.remaining").value(3));
    }

    @Test
    void rate_limit_should_pass_retry_after_through() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(orchestrator.generate(eq(1L), any(), anyString())).thenThrow(new SceneGenerationException(
                429, "UPSTREAM_RATE_LIMITED", "upstream_generation", "Rate limit exceeded. Please try again later.",
                "req-429", null, null, 12));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "12"))
                .andExpect(jsonPath("$.retryAfterSec").value(12))
                .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    void request_in_progress_should_409_with_retry_after() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(orchestrator.generate(eq(1L), any(), anyString()))
                .thenThrow(new RequestInProgressException("Request is already being processed", 5));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isConflict())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.errorCode").value("REQUEST_IN_PROGRESS"));
    }

    @Test
    void missing_scene_should_404_and_foreign_story_403() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(orchestrator.generate(eq(1L), any(), anyString()))
                .thenThrow(new NotFoundException("SCENE_NOT_FOUND"))
                .thenThrow(new ForbiddenException("NOT_ALLOWED"));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("SCENE_NOT_FOUND"));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("NOT_ALLOWED"));
    }

    @Test
    void unauthenticated_should_401() throws Exception {
        Mockito.when(auth.requireUserId()).thenThrow(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHENTICATED"));
    }

    @Test
    void malformed_json_should_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sceneId\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("REQUEST_BODY_INVALID"));
    }

    @Test
    void reset_goes_to_the_reset_service() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(resetService.reset(1L, STORY)).thenReturn(new ResetScenesResponse(true, STORY, 4));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'storyId':'" + STORY + "','reset':true}")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        Mockito.verifyNoInteractions(orchestrator);
    }

    @Test
    void unexpected_error_should_500_without_internals() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(1L);
        Mockito.when(orchestrator.generate(eq(1L), any(), anyString())).thenThrow(new NullPointerException("secret detail"));

        mvc.perform(post("/api/v1/scene-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("{'sceneId':'" + SCENE + "'}")))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error").value("Unexpected error"));
    }
}
