package com.storyscene.backend.generation.dto;

public record ResetScenesResponse(boolean success, String storyId, int resetCount) {}
