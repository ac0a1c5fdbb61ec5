package com.advotac.assistant.rag.rerank;

import com.advotac.assistant.model.HitMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Keyword rules tying query vocabulary to statute families. A rule fires when any of its
 * keywords occurs in the query; it then boosts hits whose title matches its pattern.
 * Boosts from several rules add up to at most {@link #MAX_BOOST}.
 */
@Component
public class StatutePriorRules {
    public static final double MAX_BOOST = 0.35;

    private final List<Rule> rules;

    public StatutePriorRules() {
        this(defaultRules());
    }

    StatutePriorRules(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public record Rule(List<String> keywords, Pattern titlePattern, double boost) {
        static Rule of(String titleRegex, double boost, String... keywords) {
            return new Rule(List.of(keywords), Pattern.compile(titleRegex, Pattern.CASE_INSENSITIVE), boost);
        }

        boolean firesFor(String lowerQuery) {
            for (String keyword : this.keywords) {
                if (lowerQuery.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }

    static List<Rule> defaultRules() {
        return List.of(
                Rule.of("indian evidence act|bharatiya sakshya", 0.22, "admissible", "certificate", "65b", "electronic record"),
                Rule.of("information technology act", 0.20, "intermediary", "safe-harbour", "safe harbour", "69a", "79"),
                Rule.of("code of criminal procedure|bharatiya nagarik suraksha", 0.18, "arrest", "482", "fir quash", "bail"),
                Rule.of("companies act", 0.16, "related party", "section 188", "board approval"),
                Rule.of("insolvency and bankruptcy code", 0.16, "29a", "resolution applicant", "coc", "cirp"),
                Rule.of("right to information act", 0.16, "8(1)", "personal information", "pio"),
                Rule.of("indian penal code|bharatiya nyaya sanhita", 0.18, "ipc", "murder", "culpable homicide", "theft", "cheating"));
    }

    /**
     * Rules that fire for this query; computed once per query and reused for every hit.
     */
    public List<Rule> activeRules(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        List<Rule> active = new ArrayList<>();
        for (Rule rule : this.rules) {
            if (rule.firesFor(lower)) {
                active.add(rule);
            }
        }
        return active;
    }

    public double boost(List<Rule> activeRules, HitMetadata metadata) {
        String title = metadata.title();
        if (title == null || title.isBlank() || activeRules.isEmpty()) {
            return 0.0;
        }
        double boost = 0.0;
        for (Rule rule : activeRules) {
            if (rule.titlePattern().matcher(title).find()) {
                boost += rule.boost();
            }
        }
        return Math.min(boost, MAX_BOOST);
    }
}
