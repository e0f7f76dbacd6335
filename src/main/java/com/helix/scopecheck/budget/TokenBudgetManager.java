package com.helix.scopecheck.budget;

import com.google.common.base.Preconditions;
import com.helix.scopecheck.exception.BudgetExceededException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Splits the model's prompt budget across named sections and trims content to fit.
 *
 * <p>Allocation honors fixed sections (and the untrimmable floor of other sections) first, then
 * water-fills the remainder proportionally to section weight, never giving a section more than
 * its natural length. Trimming prefers dropping whole low-ranked items over cutting one in half.
 */
@Slf4j
public class TokenBudgetManager {

    private static final String TRUNCATION_SUFFIX = "\n...(truncated)";

    private final ModelProfile profile;
    private final Map<SectionPriority, Integer> weights;

    public TokenBudgetManager(ModelProfile profile, Map<SectionPriority, Integer> weights) {
        this.profile = Preconditions.checkNotNull(profile, "profile");
        this.weights = new EnumMap<>(SectionPriority.class);
        this.weights.putAll(weights);
        for (SectionPriority priority : List.of(SectionPriority.HIGH, SectionPriority.MEDIUM, SectionPriority.LOW)) {
            Preconditions.checkArgument(this.weights.getOrDefault(priority, 0) > 0, "Missing weight for %s", priority);
        }
    }

    public static TokenBudgetManager withDefaultWeights(ModelProfile profile) {
        return new TokenBudgetManager(profile, Map.of(
                SectionPriority.HIGH, 3,
                SectionPriority.MEDIUM, 2,
                SectionPriority.LOW, 1));
    }

    public ModelProfile profile() {
        return profile;
    }

    /**
     * Computes reservations for the given sections.
     *
     * @throws BudgetExceededException if fixed sections and floors alone exceed the prompt budget
     */
    public Budget allocate(List<SectionRequest> sections) {
        int total = profile.inputTokens();
        Map<String, Integer> reserved = new LinkedHashMap<>();
        Map<String, Integer> capacity = new LinkedHashMap<>();
        Map<String, SectionRequest> byName = new LinkedHashMap<>();

        int guaranteed = 0;
        for (SectionRequest section : sections) {
            Preconditions.checkArgument(byName.put(section.name(), section) == null,
                    "Duplicate section %s", section.name());
            if (isDisabled(section)) {
                reserved.put(section.name(), 0);
                continue;
            }
            int floor = section.guaranteedTokens();
            guaranteed += floor;
            reserved.put(section.name(), floor);
            int headroom = section.naturalTokens() - floor;
            if (section.priority() != SectionPriority.FIXED && headroom > 0) {
                capacity.put(section.name(), headroom);
            }
        }

        if (guaranteed > total) {
            log.error("Token budget exceeded: fixed sections need {} of {} tokens (profile={})",
                    guaranteed, total, profile.name());
            throw new BudgetExceededException(guaranteed, total);
        }

        int remaining = total - guaranteed;
        while (remaining > 0 && !capacity.isEmpty()) {
            int weightSum = capacity.keySet().stream().mapToInt(name -> weightOf(byName.get(name))).sum();
            int distributed = 0;
            for (String name : new ArrayList<>(capacity.keySet())) {
                int share = (int) ((long) remaining * weightOf(byName.get(name)) / weightSum);
                int give = Math.min(share, capacity.get(name));
                if (give > 0) {
                    reserved.merge(name, give, Integer::sum);
                    distributed += give;
                    capacity.merge(name, -give, Integer::sum);
                }
            }
            if (distributed == 0) {
                // every share rounded down to zero; hand out the rest by priority
                distributed = distributeRemainder(remaining, capacity, byName, reserved);
            }
            capacity.values().removeIf(left -> left <= 0);
            remaining -= distributed;
        }

        Budget budget = new Budget(total, reserved, profile.decodingMode(), profile.fewShotEnabled());
        log.info("Token budget allocated [profile={}]: {}", profile.name(), budget.summary());
        return budget;
    }

    /**
     * Truncates {@code text} to at most {@code maxTokens}, cutting at the last newline when that
     * keeps at least half of the allowed text.
     */
    public String fit(String text, int maxTokens) {
        return truncate(text, maxTokens);
    }

    /**
     * Stateless form of {@link #fit(String, int)}.
     */
    public static String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || maxTokens <= 0) {
            return "";
        }
        if (TokenEstimator.estimate(text) <= maxTokens) {
            return text;
        }
        int maxChars = TokenEstimator.maxChars(maxTokens) - TRUNCATION_SUFFIX.length();
        if (maxChars <= 0) {
            return text.substring(0, Math.max(0, TokenEstimator.maxChars(maxTokens)));
        }
        String truncated = text.substring(0, maxChars);
        int lastNewline = truncated.lastIndexOf('\n');
        if (lastNewline > maxChars / 2) {
            truncated = truncated.substring(0, lastNewline);
        }
        return truncated + TRUNCATION_SUFFIX;
    }

    /**
     * Fits free text into the section's reservation and records the usage.
     */
    public String fitSection(Budget budget, String section, String text) {
        String fitted = fit(text, budget.reserved(section));
        budget.recordUsage(section, TokenEstimator.estimate(fitted));
        return fitted;
    }

    /**
     * Fits a header plus a ranked list into the section's reservation. The header is always
     * kept; items are taken in rank order until the next one would not fit, so lower-ranked
     * items are dropped wholesale. Only when not even the top item fits is it cut down with
     * {@code lastResort}.
     *
     * @param header text that is never trimmed; may be empty
     * @param ranked items, best first
     * @param renderer renders one item
     * @param lastResort shrinks an item to the given token count, or {@code null} to never cut
     */
    public <T> RankedFit<T> fitRanked(Budget budget,
                                      String section,
                                      String header,
                                      List<T> ranked,
                                      Function<T, String> renderer,
                                      BiFunction<T, Integer, T> lastResort) {
        int limit = budget.reserved(section);
        StringBuilder text = new StringBuilder(header == null ? "" : header);
        Preconditions.checkState(TokenEstimator.estimate(text.toString()) <= limit,
                "Header of section %s exceeds its reservation", section);

        List<T> kept = new ArrayList<>();
        boolean truncated = false;
        for (T item : ranked) {
            String candidate = join(text, renderer.apply(item));
            if (TokenEstimator.estimate(candidate) > limit) {
                break;
            }
            text.setLength(0);
            text.append(candidate);
            kept.add(item);
        }

        if (kept.isEmpty() && !ranked.isEmpty() && lastResort != null) {
            T top = ranked.get(0);
            int room = limit - TokenEstimator.estimate(join(text, "")) - 1;
            if (room > 0) {
                T shrunk = lastResort.apply(top, room);
                String candidate = join(text, renderer.apply(shrunk));
                if (TokenEstimator.estimate(candidate) <= limit) {
                    text.setLength(0);
                    text.append(candidate);
                    kept.add(shrunk);
                    truncated = true;
                    log.warn("Section {}: top item alone exceeds {} tokens, truncated it", section, limit);
                }
            }
        }

        int dropped = ranked.size() - kept.size();
        if (dropped > 0) {
            log.debug("Section {}: kept {} of {} items within {} tokens", section, kept.size(), ranked.size(), limit);
        }
        String rendered = text.toString();
        budget.recordUsage(section, TokenEstimator.estimate(rendered));
        return new RankedFit<>(List.copyOf(kept), rendered, dropped, truncated);
    }

    private static String join(CharSequence head, String item) {
        if (head.length() == 0) {
            return item;
        }
        return head + "\n" + item;
    }

    private boolean isDisabled(SectionRequest section) {
        return PromptSections.FEW_SHOT_EXAMPLES.equals(section.name()) && !profile.fewShotEnabled();
    }

    private int weightOf(SectionRequest section) {
        return weights.get(section.priority());
    }

    private int distributeRemainder(int remaining,
                                    Map<String, Integer> capacity,
                                    Map<String, SectionRequest> byName,
                                    Map<String, Integer> reserved) {
        List<String> order = new ArrayList<>(capacity.keySet());
        order.sort(Comparator.comparing(name -> byName.get(name).priority()));
        int distributed = 0;
        for (String name : order) {
            if (distributed == remaining) {
                break;
            }
            int give = Math.min(capacity.get(name), remaining - distributed);
            reserved.merge(name, give, Integer::sum);
            capacity.merge(name, -give, Integer::sum);
            distributed += give;
        }
        return distributed;
    }
}
