package com.storyscene.backend.generation.service;

import com.storyscene.backend.generation.dto.ResetScenesResponse;
import com.storyscene.backend.generation.repo.SceneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class SceneResetService {

    private final SceneContextLoader contextLoader;
    private final SceneRepository scenes;

    /** Puts every scene of an owned story back to {@code pending}. No credits move. */
    @Transactional
    public ResetScenesResponse reset(Long userId, String storyId) {
        contextLoader.requireOwnedStory(userId, storyId);
        int n = scenes.resetAllForStory(storyId, Instant.now());
        log.info("scene_reset userId={} storyId={} count={}", userId, storyId, n);
        return new ResetScenesResponse(true, storyId, n);
    }
}
