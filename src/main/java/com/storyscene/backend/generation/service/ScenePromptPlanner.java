package com.storyscene.backend.generation.service;

import com.storyscene.backend.generation.appearance.AppearanceContinuityResolver;
import com.storyscene.backend.generation.appearance.AppearanceResolution;
import com.storyscene.backend.generation.appearance.AppearanceSnapshot;
import com.storyscene.backend.generation.appearance.CharacterAppendixBuilder;
import com.storyscene.backend.generation.appearance.CharacterProfile;
import com.storyscene.backend.generation.appearance.CharacterStatesHasher;
import com.storyscene.backend.generation.appearance.ContinuityIssue;
import com.storyscene.backend.generation.config.GenerationProperties;
import com.storyscene.backend.generation.dto.GenerationOptions;
import com.storyscene.backend.generation.engine.ModelSelector;
import com.storyscene.backend.generation.entity.SceneEntity;
import com.storyscene.backend.generation.prompt.AssembledPrompt;
import com.storyscene.backend.generation.prompt.PromptAssembler;
import com.storyscene.backend.generation.prompt.PromptSanitizer;
import com.storyscene.backend.generation.style.GenerationTuning;
import com.storyscene.backend.generation.style.NegativePrompt;
import com.storyscene.backend.generation.style.ResolutionCoercer;
import com.storyscene.backend.generation.style.StyleCatalog;
import com.storyscene.backend.generation.style.StyleGuidance;
import com.storyscene.backend.generation.style.StyleGuidanceBuilder;
import com.storyscene.backend.generation.style.StyleGuideGuidance;
import com.storyscene.backend.generation.style.StyleValidator;
import com.storyscene.backend.generation.vision.ValidationCharacter;
import com.storyscene.backend.generation.web.SceneGenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Style, appearance and prompt decisions for one scene. Pure with respect to billing:
 * it runs before any reservation and is the whole of a {@code promptOnly} request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenePromptPlanner {

    public static final String STAGE = "style_validation";
    static final int BASE_TEXT_MAX = 1200;
    static final String DEFAULT_BASE_TEXT = "A beautiful story scene";

    private final AppearanceContinuityResolver resolver;
    private final GenerationProperties props;

    /**
     * @param traitsByName vision trait lines per character, may be empty
     * @throws SceneGenerationException 400 when strict style is on and the prompt lost the style marker
     */
    public PromptPlan plan(SceneContext ctx, GenerationOptions opts, Map<String, String> traitsByName, String requestId) {
        List<String> warnings = new ArrayList<>();

        String requestedStyle = PromptSanitizer.firstNonBlank(opts.artStyle(), ctx.story().getArtStyle(), StyleCatalog.DEFAULT_STYLE);
        StyleCatalog.Resolution style = StyleCatalog.resolve(requestedStyle);
        String styleId = style.canonicalId();
        if (style.usedFallback()) warnings.add("style_inferred:" + styleId);

        int intensity = opts.effectiveIntensity(ctx.story().getStyleIntensity());
        boolean strict = opts.strictStyle();

        ModelSelector.Selection selection = ModelSelector.select(opts.model(), styleId, strict, props.getDefaultModel());
        warnings.addAll(selection.warnings());
        if (!selection.warnings().isEmpty()) {
            log.warn("model_style_mismatch requestId={} model={} style={}", requestId, selection.model().id(), styleId);
        }

        StyleGuidance guidance = StyleGuidanceBuilder.build(requestedStyle, intensity, strict, opts.disabledStyleElements());
        StyleGuideGuidance guide = StyleGuideGuidance.from(ctx.styleGuide(), intensity, strict);
        if (ctx.styleGuide() != null) warnings.addAll(guide.issues());

        AppearanceResolution appearance = resolver.resolve(ctx.activeNames(), ctx.current(), ctx.history(), ctx.profilesByName());
        List<ContinuityIssue> issues = resolver.continuityIssues(appearance, ctx.history(), ctx.profilesByName());
        for (String name : appearance.missingClothing()) warnings.add("missing_clothing:" + name);
        for (ContinuityIssue i : issues) warnings.add("continuity:" + i.type() + ":" + i.character());

        String appendix = CharacterAppendixBuilder.build(appearance, ctx.profilesByName(), traitsByName);
        List<String> names = CharacterAppendixBuilder.names(appearance);
        int limit = selection.model().promptLimit();

        AssembledPrompt assembled;
        if (opts.forceFullPrompt() != null) {
            String clean = PromptSanitizer.sanitize(opts.forceFullPrompt());
            String full = PromptSanitizer.truncate(clean, limit);
            assembled = new AssembledPrompt(full, full.length() < clean.length(),
                    PromptAssembler.missingSubjects(full, names),
                    new AssembledPrompt.Parts(full, "", "", ""));
        } else {
            assembled = PromptAssembler.assemble(new PromptAssembler.Input(
                    baseText(ctx.scene(), opts.forcePrompt()),
                    appendix,
                    guidance.prefix(),
                    guidance.positive(),
                    guide.positive(),
                    styleId,
                    limit,
                    names
            ));
        }
        if (assembled.fullPrompt().isBlank()) throw new IllegalArgumentException("PROMPT_EMPTY");
        if (assembled.truncated()) warnings.add("prompt_truncated");
        for (String m : assembled.missingSubjects()) warnings.add("missing_subject:" + m);

        StyleValidator.Result guidanceCheck = StyleValidator.validateGuidance(requestedStyle, strict, guidance, opts.disabledStyleElements());
        List<String> styleIssues = new ArrayList<>(guidanceCheck.issues());
        if (!StyleValidator.promptCarriesStyleMarker(assembled.fullPrompt(), guidance)) {
            styleIssues.add("style_marker_missing");
            if (strict) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("styleId", styleId);
                details.put("markers", StyleValidator.markersOf(guidance));
                details.put("issues", styleIssues);
                throw new SceneGenerationException(400, "STYLE_VALIDATION_FAILED", STAGE,
                        "Selected style is not reflected in the prompt.", requestId, details, null, null);
            }
        }
        warnings.addAll(styleIssues);

        ResolutionCoercer.Resolution resolution = ResolutionCoercer.coerce(selection.model().id(),
                opts.width(), opts.height(), props.getDefaultWidth(), props.getDefaultHeight());
        warnings.addAll(resolution.issues());

        List<ValidationCharacter> validation = new ArrayList<>();
        List<String> referenceUrls = new ArrayList<>();
        for (String name : names) {
            CharacterProfile p = ctx.profilesByName().get(name);
            AppearanceSnapshot s = appearance.snapshotOf(name);
            String url = p == null ? null : p.referenceImageUrl();
            validation.add(new ValidationCharacter(name, url, p == null ? null : p.referenceSnippet(), s.clothing(), s.state()));
            if (!PromptSanitizer.isBlank(url)) referenceUrls.add(url);
        }

        return new PromptPlan(
                styleId,
                intensity,
                strict,
                selection,
                guidance,
                assembled,
                NegativePrompt.build(styleId, strict),
                resolution,
                GenerationTuning.compute(styleId, intensity, strict, selection.model()),
                appearance,
                issues,
                styleIssues,
                validation,
                referenceUrls,
                CharacterStatesHasher.sha256Hex(assembled.fullPrompt()),
                CharacterStatesHasher.hash(appearance),
                warnings
        );
    }

    /** {@code forcePrompt}, else the first non-empty scene text, else a neutral default. */
    static String baseText(SceneEntity scene, String forcePrompt) {
        String picked = PromptSanitizer.firstNonBlank(
                forcePrompt,
                scene.getImagePrompt(),
                scene.getSummary(),
                scene.getTitle(),
                scene.getOriginalText()
        );
        String clean = PromptSanitizer.sanitize(picked, BASE_TEXT_MAX);
        return clean.isEmpty() ? DEFAULT_BASE_TEXT : clean;
    }
}
