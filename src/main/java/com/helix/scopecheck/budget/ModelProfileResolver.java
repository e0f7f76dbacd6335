package com.helix.scopecheck.budget;

import com.helix.scopecheck.configuration.AlignmentProperties;
import com.helix.scopecheck.configuration.AlignmentProperties.ProfileProperties;
import com.helix.scopecheck.configuration.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks the context-window profile for the configured model.
 *
 * <p>An explicit {@code app.alignment.profile} wins; otherwise the model id is matched against
 * {@code app.alignment.small-model-patterns}.
 */
@Slf4j
@Component
public class ModelProfileResolver {

    public static final String STANDARD = "standard";
    public static final String SMALL = "small";

    private final AlignmentProperties alignment;
    private final List<Pattern> smallModelPatterns;

    public ModelProfileResolver(AppProperties properties) {
        this.alignment = properties.getAlignment();
        this.smallModelPatterns = alignment.getSmallModelPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public ModelProfile resolve() {
        return resolve(alignment.getModelId());
    }

    public ModelProfile resolve(String modelId) {
        String explicit = alignment.getProfile() == null ? "" : alignment.getProfile().trim().toLowerCase(Locale.ROOT);
        boolean small;
        if (!explicit.isEmpty()) {
            if (!SMALL.equals(explicit) && !STANDARD.equals(explicit)) {
                throw new IllegalStateException("Unknown model profile '" + explicit + "', expected small or standard");
            }
            small = SMALL.equals(explicit);
        } else {
            small = isSmallModel(modelId);
        }
        ModelProfile profile = small
                ? toProfile(SMALL, alignment.getProfiles().getSmall(), true)
                : toProfile(STANDARD, alignment.getProfiles().getStandard(), false);
        log.debug("Model '{}' resolved to profile {} (explicit='{}')", modelId, profile.name(), explicit);
        return profile;
    }

    public boolean isSmallModel(String modelId) {
        if (modelId == null) {
            return false;
        }
        return smallModelPatterns.stream().anyMatch(p -> p.matcher(modelId).find());
    }

    public TokenBudgetManager budgetManager() {
        return budgetManager(resolve());
    }

    public TokenBudgetManager budgetManager(ModelProfile profile) {
        AlignmentProperties.SectionWeights w = alignment.getSectionWeights();
        return new TokenBudgetManager(profile, Map.of(
                SectionPriority.HIGH, w.getHigh(),
                SectionPriority.MEDIUM, w.getMedium(),
                SectionPriority.LOW, w.getLow()));
    }

    private static ModelProfile toProfile(String name, ProfileProperties p, boolean smallModel) {
        return new ModelProfile(name, p.getContextTokens(), p.getOutputTokens(), p.getRetrievalTopK(),
                p.isFewShotEnabled(), p.isConstrainedDecoding(), smallModel);
    }
}
