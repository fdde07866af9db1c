package com.storyscene.backend.generation.controller;

import com.storyscene.backend.auth.security.AuthContext;
import com.storyscene.backend.common.web.RequestIdFilter;
import com.storyscene.backend.generation.dto.GenerateSceneImageRequest;
import com.storyscene.backend.generation.dto.GenerationOptions;
import com.storyscene.backend.generation.service.SceneGenerationOrchestrator;
import com.storyscene.backend.generation.service.SceneResetService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "SceneImages", description = "Scene image generation (+ reset / promptOnly side actions)")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/scene-images")
public class SceneImageController {

    private final AuthContext auth;
    private final SceneGenerationOrchestrator orchestrator;
    private final SceneResetService resetService;

    /**
     * ✅ One endpoint, three actions:
     * reset=true clears a story's scenes, promptOnly=true previews the prompt, otherwise generates.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> generate(@RequestBody(required = false) GenerateSceneImageRequest body, HttpServletRequest req) {
        Long uid = auth.requireUserId();
        String requestId = RequestIdFilter.getOrCreate(req);
        GenerationOptions opts = GenerationOptions.from(body);

        if (opts.reset()) return ResponseEntity.ok(resetService.reset(uid, opts.storyId()));
        if (opts.promptOnly()) return ResponseEntity.ok(orchestrator.preview(uid, opts, requestId));
        return ResponseEntity.ok(orchestrator.generate(uid, opts, requestId));
    }
}
