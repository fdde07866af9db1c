package com.storyscene.backend.generation.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in art styles, their aliases, and word-based inference for unknown ids.
 */
public final class StyleCatalog {

    private StyleCatalog() {}

    public static final String NONE = "none";
    public static final String DEFAULT_STYLE = "cinematic";

    /**
     * @param canonicalId catalog id after alias resolution (or the normalized unknown id)
     * @param usedFallback definition was inferred, not found in the catalog
     * @param appendStyleName guidance should name the requested style explicitly (alias or inferred)
     */
    public record Resolution(String canonicalId, StyleDefinition definition, boolean usedFallback, boolean appendStyleName) {}

    private static final Map<String, StyleDefinition> DEFINITIONS;
    private static final Map<String, String> ALIASES;

    static {
        Map<String, StyleDefinition> m = new LinkedHashMap<>();

        put(m, new StyleDefinition(NONE, "No Specific Style", StyleCategory.ARTISTIC, "",
                List.of(), List.of(), List.of(), List.of(), 0, 0, List.of(), List.of()));

        put(m, new StyleDefinition("digital_illustration", "Digital Illustration", StyleCategory.ARTISTIC,
                "digital illustration of",
                List.of("crisp linework", "painterly shading", "clean edges", "high detail", "masterpiece", "best quality"),
                List.of("balanced palette with clear value separation", "clean highlights and controlled shadows"),
                List.of("readable silhouettes", "clear focal subject", "strong foreground/midground/background separation"),
                List.of("contemporary illustration workflows", "concept art clarity and readability"),
                0, 0, List.of("digital illustration"), List.of()));

        put(m, new StyleDefinition("cinematic", "Cinematic", StyleCategory.REALISTIC,
                "cinematic film still of",
                List.of("cinematic lighting", "dramatic contrast", "shallow depth of field", "controlled color grading",
                        "atmospheric haze", "subtle film grain", "soft bloom on highlights"),
                List.of("teal and orange color grading", "deep shadows with controlled highlights"),
                List.of("rule of thirds", "leading lines", "strong depth separation", "intentional framing"),
                List.of("film still aesthetics", "modern blockbuster grading and lighting motifs"),
                0.3, 2, List.of("cinematic lighting"),
                List.of("cartoon lineart", "watercolor wash", "comic halftone", "flat minimalist shapes")));

        put(m, new StyleDefinition("realistic_cinematic", "Realistic Cinematic", StyleCategory.REALISTIC,
                "photorealistic cinematic shot of",
                List.of("realistic materials", "natural micro-textures", "filmic contrast", "shallow depth of field",
                        "lens perspective cues", "subtle film grain"),
                List.of("naturalistic palette with filmic grading", "skin tones and materials stay physically plausible"),
                List.of("photographic framing", "lens perspective cues", "subtle background separation"),
                List.of("cinematography conventions", "photorealistic VFX/DI pipelines"),
                0.6, 3, List.of("photorealistic"), List.of()));

        put(m, new StyleDefinition("film_noir", "Film Noir", StyleCategory.REALISTIC,
                "black and white film noir shot of",
                List.of("high contrast lighting", "deep shadows", "monochrome tones", "dramatic composition"),
                List.of("monochrome palette with rich blacks and bright highlights"),
                List.of("strong diagonals", "silhouette emphasis", "negative space used for tension"),
                List.of("classic Hollywood noir cinematography", "1940s-1950s noir visual language"),
                0.4, 2, List.of("monochrome"), List.of()));

        put(m, new StyleDefinition("watercolor", "Watercolor", StyleCategory.ARTISTIC,
                "watercolor painting of",
                List.of("soft washes", "paper texture", "cold-press paper grain", "translucent pigments",
                        "wet-on-wet blooms", "bleed edges", "light pencil underdrawing", "gentle edges"),
                List.of("airy pastel-to-mid tones with preserved whites", "low-to-moderate saturation with clean harmony"),
                List.of("simplified shapes", "breathable negative space", "focal area with stronger pigment and sharper edges"),
                List.of("traditional watercolor illustration techniques", "glazing and layered wash methods"),
                -0.4, 2, List.of("watercolor"),
                List.of("photorealistic", "3d render", "sharp ink outlines", "hard cel shading")));

        put(m, new StyleDefinition("oil", "Oil Painting", StyleCategory.ARTISTIC,
                "oil painting of",
                List.of("visible brush strokes", "rich pigment", "canvas texture", "painterly edges",
                        "chiaroscuro lighting", "impasto highlights"),
                List.of("warm earth tones with deep values", "controlled saturation with rich color mixing"),
                List.of("classical balance", "strong value structure", "focal emphasis via contrast"),
                List.of("classical atelier painting traditions", "old-master lighting and material study"),
                0.1, 3, List.of("oil painting"),
                List.of("cel shading", "clean vector shapes", "comic halftone", "photorealistic lens artifacts")));

        put(m, new StyleDefinition("impressionism", "Impressionism", StyleCategory.ARTISTIC,
                "impressionist painting of",
                List.of("broken brushstrokes", "visible paint texture", "soft edges", "light-focused rendering", "suggested detail"),
                List.of("warm natural light with pastel accents", "high-key palette with subtle complementary contrast"),
                List.of("plein-air sensibility", "momentary atmosphere", "loose framing with natural balance"),
                List.of("late-19th-century plein-air painting", "Impressionist approaches to light and color"),
                -0.1, 2, List.of("impressionist"), List.of()));

        put(m, new StyleDefinition("anime", "Anime", StyleCategory.ANIME,
                "anime style artwork of",
                List.of("2D", "flat color", "Japanese anime style", "crisp line art", "clean line art", "cel shading",
                        "expressive eyes", "expressive facial features", "stylized hair shapes", "readable shadow shapes",
                        "masterpiece", "best quality", "anime key visual"),
                List.of("saturated but controlled colors", "clean shadow colors with minimal gradients"),
                List.of("dynamic camera angles", "strong character framing", "clear silhouettes and readable poses"),
                List.of("TV anime and key-animation aesthetics", "modern anime illustration conventions"),
                0.2, 1, List.of("cel shading"),
                List.of("watercolor bleed", "oil impasto", "photorealistic skin pores", "comic halftone dots")));

        put(m, new StyleDefinition("anime_manga", "Manga", StyleCategory.ANIME,
                "manga style illustration of",
                List.of("clean line art", "screen tones", "graphic shadow shapes", "2d rendering", "high readability"),
                List.of("black and white with tonal control", "limited accent color if used"),
                List.of("panel-like framing", "strong focus on faces and gestures", "clear depth separation"),
                List.of("manga inking and toning conventions", "serialized comic storytelling language"),
                0.2, 1, List.of("line art"), List.of()));

        put(m, new StyleDefinition("comic", "Comic Book", StyleCategory.ARTISTIC,
                "comic book panel of",
                List.of("bold ink outlines", "graphic shadows", "halftone dots", "halftone accents",
                        "high contrast highlights", "dynamic framing"),
                List.of("vibrant primaries with strong contrast", "limited gradients with bold value blocks"),
                List.of("strong diagonals", "clear subject separation", "action-focused framing"),
                List.of("graphic novel inking styles", "print-era halftone and color separation cues"),
                0.2, 1, List.of("bold ink"),
                List.of("photorealistic", "soft watercolor wash", "painterly oil blending", "minimalist flat poster")));

        put(m, new StyleDefinition("vintage_comic", "Vintage Comic", StyleCategory.ARTISTIC,
                "vintage comic book illustration of",
                List.of("aged paper feel", "halftone print texture", "bold inks", "retro linework"),
                List.of("limited retro palette", "slightly faded inks with print-like contrast"),
                List.of("clear central subject", "simple backgrounds with graphic shapes", "poster-like readability"),
                List.of("mid-century print comics", "newsprint texture and vintage printing constraints"),
                0.1, 1, List.of("halftone"), List.of()));

        put(m, new StyleDefinition("minimalist", "Minimalist", StyleCategory.ARTISTIC,
                "minimalist illustration of",
                List.of("simple shapes", "flat shapes", "flat colors", "clean edges", "vector art style",
                        "simple lighting cues", "generous negative space"),
                List.of("limited 2-4 color palette", "muted tones or monochrome with one accent"),
                List.of("strong geometry", "uncluttered focal point", "balanced asymmetry or centered framing"),
                List.of("modernist graphic design principles", "minimal poster and icon design"),
                -0.6, -4, List.of("negative space"),
                List.of("painterly brush strokes", "photorealistic texture", "comic halftone", "heavy film grain")));

        put(m, new StyleDefinition("realistic", "Realistic", StyleCategory.REALISTIC,
                "photograph of",
                List.of("photorealistic detail", "realistic lighting", "natural materials", "sharp focus",
                        "accurate proportions", "realistic bokeh"),
                List.of("naturalistic color palette", "physically plausible highlights and shadows"),
                List.of("photographic framing", "subtle depth cues", "balanced exposure and contrast"),
                List.of("photography and film lens conventions", "realism-driven visual language"),
                0.7, 2, List.of("photorealistic"),
                List.of("watercolor wash", "comic inks", "cel shading", "flat vector shapes")));

        put(m, new StyleDefinition("fantasy", "Fantasy", StyleCategory.ARTISTIC,
                "fantasy illustration of",
                List.of("magical atmosphere", "ethereal glow", "ambient magical effects", "epic composition",
                        "ornate detail", "dramatic lighting", "mythic motifs"),
                List.of("luminous accents with cohesive palette", "controlled saturation with strong value contrast"),
                List.of("layered depth", "scale cues and staging", "clear focal hero element"),
                List.of("fantasy concept art traditions", "mythology-inspired visual motifs"),
                0.2, 3, List.of("epic composition"),
                List.of("flat minimalist poster", "strict photorealism", "comic halftone", "cel shading")));

        put(m, new StyleDefinition("cyberpunk", "Cyberpunk", StyleCategory.REALISTIC,
                "cinematic cyberpunk shot of",
                List.of("neon signage", "rain-slick reflections", "futuristic city density", "glowing rim lights",
                        "atmospheric haze", "photorealistic"),
                List.of("neon magenta and cyan accents", "deep blues and purples with bright specular highlights"),
                List.of("layered city depth", "strong perspective lines", "high contrast focal subject against light sources"),
                List.of("1980s cyberpunk sci-fi aesthetics", "retro-futurist tech-noir motifs"),
                0.3, 2, List.of("neon"), List.of()));

        put(m, new StyleDefinition("steampunk", "Steampunk", StyleCategory.ARTISTIC,
                "steampunk illustration of",
                List.of("brass and copper machinery", "Victorian aesthetic", "gears and valves", "retro-futurist props"),
                List.of("warm sepia and brass tones", "oxidized greens with warm highlights"),
                List.of("detailed hero prop focus", "layered mechanical foreground elements", "balanced ornamental framing"),
                List.of("Victorian industrial design cues", "retro-futurism and alternate-history motifs"),
                0.1, 2, List.of("brass"), List.of()));

        put(m, new StyleDefinition("storybook_illustration", "Storybook Illustration", StyleCategory.ARTISTIC,
                "storybook illustration of",
                List.of("whimsical shapes", "soft painterly shading", "charming character design", "gentle edge work"),
                List.of("warm inviting palette", "soft contrast with friendly highlights"),
                List.of("simple readable staging", "clear narrative focal point", "comfortable negative space"),
                List.of("children's picture book illustration language", "storybook character design conventions"),
                -0.1, 2, List.of("storybook"), List.of()));

        put(m, new StyleDefinition("pixel_art", "Pixel Art", StyleCategory.PIXEL,
                "pixel art of",
                List.of("crisp pixel edges", "tile-like shapes", "dithering patterns", "sprite readability",
                        "pixelart", "pixel-art", "lowres"),
                List.of("limited palette with clear ramps", "retro console-inspired hues with strong contrast control"),
                List.of("simple silhouettes", "clear separation of forms", "iconic readable framing"),
                List.of("classic 8-bit and 16-bit sprite aesthetics", "retro game art conventions"),
                -0.2, -6, List.of("pixel"), List.of()));

        put(m, new StyleDefinition("3d_render", "3D Render", StyleCategory.THREE_D,
                "3d render of",
                List.of("CGI materials", "global illumination", "ray tracing feel", "clean specular highlights",
                        "rendered depth cues", "unreal engine 5", "octane render"),
                List.of("cinematic neutral base palette", "physically plausible material colors"),
                List.of("product-shot clarity or cinematic staging", "clean background separation",
                        "strong lighting key/fill balance"),
                List.of("modern CGI rendering conventions", "real-time engine and offline renderer aesthetics"),
                0.3, 1, List.of("CGI"), List.of()));

        DEFINITIONS = Collections.unmodifiableMap(m);

        Map<String, String> a = new LinkedHashMap<>();
        a.put("oil_painting", "oil");
        a.put("pencil_drawing", "digital_illustration");
        a.put("ink_wash", "watercolor");
        a.put("anime_screenshot", "anime");
        a.put("manga_panel", "anime_manga");
        a.put("webtoon", "anime_manga");
        a.put("studio_ghibli_style", "anime");
        a.put("graphic_novel", "comic");
        a.put("comic_strip", "comic");
        a.put("comic_book", "comic");
        a.put("storyboard_sketch", "digital_illustration");
        a.put("vector_art", "minimalist");
        a.put("flat_design", "minimalist");
        a.put("isometric_3d", "3d_render");
        a.put("low_poly", "3d_render");
        ALIASES = Collections.unmodifiableMap(a);
    }

    private static void put(Map<String, StyleDefinition> m, StyleDefinition d) {
        m.put(d.id(), d);
    }

    public static Map<String, StyleDefinition> definitions() {
        return DEFINITIONS;
    }

    public static Map<String, String> aliases() {
        return ALIASES;
    }

    /** Catalog ids plus aliases: the values a request may name. */
    public static boolean isKnown(String styleId) {
        if (styleId == null) return false;
        String id = normalize(styleId);
        return DEFINITIONS.containsKey(id) || ALIASES.containsKey(id);
    }

    public static Set<String> knownIds() {
        return DEFINITIONS.keySet();
    }

    public static Resolution resolve(String styleId) {
        String raw = normalize(styleId);
        if (raw.isEmpty()) raw = "digital_illustration";
        if (NONE.equals(raw)) return new Resolution(NONE, DEFINITIONS.get(NONE), false, false);

        String canonical = ALIASES.getOrDefault(raw, raw);
        StyleDefinition direct = DEFINITIONS.get(canonical);
        if (direct != null) return new Resolution(canonical, direct, false, !canonical.equals(raw));

        return new Resolution(canonical, infer(canonical), true, true);
    }

    /** Category of a style id, or null for {@code none}. */
    public static StyleCategory categoryOf(String styleId) {
        Resolution r = resolve(styleId);
        return r.definition().isNone() ? null : r.definition().category();
    }

    static StyleDefinition infer(String id) {
        String readable = id.replace('_', ' ').trim();
        StyleCategory category = StyleCategory.infer(id);

        String prefix = switch (category) {
            case ANIME -> "anime style artwork of";
            case PIXEL -> "pixel art of";
            case THREE_D -> "3d render of";
            case REALISTIC -> "photograph of";
            default -> "digital illustration of";
        };

        List<String> shared = List.of("high quality", "strong readability", readable + " style");
        List<String> head = switch (category) {
            case ANIME -> List.of("cel shading", "clean line art", "expressive faces");
            case PIXEL -> List.of("crisp pixel edges", "limited palette", "sprite readability");
            case THREE_D -> List.of("CGI materials", "global illumination", "realistic shading");
            case REALISTIC -> List.of("photorealistic detail", "realistic lighting", "natural materials");
            default -> List.of("clean linework", "painterly shading", "high detail");
        };
        List<String> elements = new ArrayList<>(head);
        elements.addAll(shared);

        List<String> palettes = switch (category) {
            case PIXEL -> List.of("limited palette with clear value ramps", "palette inspired by " + readable);
            case ANIME -> List.of("saturated but controlled colors", "palette inspired by " + readable);
            default -> List.of("cohesive palette with clear value separation", "palette inspired by " + readable);
        };

        boolean pixel = category == StyleCategory.PIXEL;
        return new StyleDefinition(
                id,
                titleCase(readable),
                category,
                prefix,
                elements,
                palettes,
                List.of("clear focal subject", "readable silhouettes", "balanced composition"),
                List.of("influenced by " + readable, "recognized visual language cues of the style"),
                pixel ? -0.2 : 0,
                pixel ? -6 : 0,
                List.of(readable),
                List.of()
        );
    }

    private static String normalize(String styleId) {
        return styleId == null ? "" : styleId.trim().toLowerCase(Locale.ROOT);
    }

    private static String titleCase(String readable) {
        StringBuilder sb = new StringBuilder();
        for (String w : readable.split(" ")) {
            if (w.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }
}
