package com.storyscene.backend.generation.prompt;

import java.util.List;

/**
 * @param missingSubjects required names not found (case-insensitive) in {@code fullPrompt}
 */
public record AssembledPrompt(
        String fullPrompt,
        boolean truncated,
        List<String> missingSubjects,
        Parts parts
) {
    public record Parts(String base, String characters, String style, String guide) {}

    public AssembledPrompt {
        missingSubjects = missingSubjects == null ? List.of() : List.copyOf(missingSubjects);
    }
}
