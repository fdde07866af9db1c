package com.storyscene.backend.generation.appearance;

public record ContinuityIssue(String type, String character, String previous, String current) {

    public static final String OUTFIT_CHANGE_UNEXPLAINED = "outfit_change_unexplained";

    public static ContinuityIssue outfitChange(String character, String previous, String current) {
        return new ContinuityIssue(OUTFIT_CHANGE_UNEXPLAINED, character, previous, current);
    }
}
