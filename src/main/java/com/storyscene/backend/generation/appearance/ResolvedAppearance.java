package com.storyscene.backend.generation.appearance;

public record ResolvedAppearance(String name, AppearanceSnapshot snapshot, ClothingSource clothingSource) {

    public enum ClothingSource { SCENE, TIMELINE, HISTORY, DEFAULT, NONE }

    public boolean clothingStatedInScene() {
        return clothingSource == ClothingSource.SCENE;
    }
}
