package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.List;

public final class NegativePrompt {

    private NegativePrompt() {}

    static final List<String> BASE = List.of(
            "ugly", "blurry", "low quality", "distorted", "bad anatomy", "bad hands",
            "missing fingers", "extra digit", "fewer digits", "cropped", "worst quality",
            "normal quality", "jpeg artifacts", "signature", "watermark", "username"
    );

    /** Fixed quality terms, plus the style's avoid list under strict mode. */
    public static String build(String styleId, boolean strict) {
        List<String> terms = new ArrayList<>(BASE);
        StyleDefinition def = StyleCatalog.resolve(styleId).definition();
        if (strict && !def.isNone()) terms.addAll(def.avoid());
        return String.join(", ", terms);
    }
}
