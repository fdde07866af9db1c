package com.storyscene.backend.generation.appearance;

/**
 * Story-level defaults of a character as seen by the resolver.
 *
 * @param referenceSnippet prompt snippet of the active or newest approved reference sheet
 * @param referenceImageUrl reference image of that sheet, used for optional vision traits
 */
public record CharacterProfile(
        String characterId,
        String name,
        String defaultClothing,
        String defaultPhysicalAttributes,
        String referenceSnippet,
        String referenceImageUrl,
        OutfitTimeline timeline
) {
    public CharacterProfile {
        if (timeline == null) timeline = OutfitTimeline.NONE;
    }

    public static CharacterProfile of(String name, String defaultClothing, String defaultPhysicalAttributes) {
        return new CharacterProfile(null, name, defaultClothing, defaultPhysicalAttributes, null, null, OutfitTimeline.NONE);
    }
}
