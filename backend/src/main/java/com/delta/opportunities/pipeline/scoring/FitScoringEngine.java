package com.delta.opportunities.pipeline.scoring;

import com.delta.opportunities.pipeline.model.FitScore;
import com.delta.opportunities.pipeline.model.Opportunity;
import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.model.ScoringFeature;
import com.delta.opportunities.pipeline.model.ScoringWeights;
import com.delta.opportunities.pipeline.model.UserProfile;
import com.delta.opportunities.pipeline.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based fit scoring. Output depends only on the arguments: the engine holds no state,
 * reads no clock and performs no I/O, so the same inputs always produce the same score.
 */
@Component
public class FitScoringEngine {
    static final double EXACT_SKILL_CREDIT = 1.0;
    static final double PARTIAL_SKILL_CREDIT = 0.5;
    static final double MISSING_SKILL_PENALTY = 0.2;
    static final double EXPERIENCE_YEARS_SHARE = 0.7;
    static final double ROLE_SIMILARITY_SHARE = 0.3;
    static final double NEUTRAL = 0.5;
    static final double NO_DEADLINE_URGENCY = 0.3;

    private static final Set<String> TOP_ORGANIZATIONS = Set.of(
        "google", "deepmind", "anthropic", "openai", "meta", "apple",
        "microsoft", "amazon", "nvidia", "tesla", "spacex",
        "stanford", "mit", "berkeley", "harvard", "cambridge", "oxford"
    );
    private static final Set<String> TOP_PROGRAMS = Set.of(
        "y combinator", "techstars", "sequoia", "a16z", "founders fund",
        "thiel fellowship", "rhodes", "fulbright", "marshall"
    );

    public FitScore score(UserProfile profile, Opportunity opportunity, ScoringWeights weights) {
        Map<ScoringFeature, Double> values = featureValues(profile, opportunity);
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<ScoringFeature, Double> entry : values.entrySet()) {
            double weight = weights.weight(entry.getKey());
            weighted += weight * entry.getValue();
            totalWeight += weight;
        }
        double score = totalWeight <= 0.0 ? 0.0 : round(clamp(weighted / totalWeight), 4);
        return new FitScore(score, tierFor(score, weights), weights.version(), values);
    }

    public int tierFor(double score, ScoringWeights weights) {
        if (score >= weights.tier1Threshold()) {
            return 1;
        }
        if (score >= weights.tier2Threshold()) {
            return 2;
        }
        return 3;
    }

    Map<ScoringFeature, Double> featureValues(UserProfile profile, Opportunity opportunity) {
        OpportunityFields fields = opportunity.fields();
        Map<ScoringFeature, Double> values = new EnumMap<>(ScoringFeature.class);
        values.put(ScoringFeature.SKILL_MATCH, round(skillMatch(fields.requiredSkills(), profile.skills()), 4));
        values.put(
            ScoringFeature.EXPERIENCE_MATCH,
            round(experienceMatch(fields.requiredExperienceYears(), profile.yearsExperience(), fields.title(), profile.pastRoles()), 4)
        );
        values.put(ScoringFeature.SEMANTIC_SIMILARITY, round(semanticSimilarity(profile, fields), 4));
        values.put(ScoringFeature.PRESTIGE, prestige(fields.organization()));
        values.put(ScoringFeature.DEADLINE_URGENCY, urgency(opportunity.discoveredAt(), fields.deadline()));
        values.put(ScoringFeature.COMPENSATION, compensation(fields.salaryMax(), profile.minSalary()));
        Double successRate = profile.historicalSuccessRates().get(fields.opportunityType());
        values.put(ScoringFeature.HISTORICAL_SUCCESS_RATE, successRate == null ? NEUTRAL : round(clamp(successRate), 4));
        return values;
    }

    double skillMatch(List<String> requiredSkills, List<String> profileSkills) {
        if (requiredSkills.isEmpty()) {
            return 1.0;
        }
        List<String> have = new ArrayList<>();
        for (String skill : profileSkills) {
            have.add(skill.toLowerCase(Locale.ROOT).trim());
        }
        int matched = 0;
        int partial = 0;
        for (String skill : requiredSkills) {
            String required = skill.toLowerCase(Locale.ROOT).trim();
            if (have.contains(required)) {
                matched++;
                continue;
            }
            for (String candidate : have) {
                if (!candidate.isEmpty() && (candidate.contains(required) || required.contains(candidate))) {
                    partial++;
                    break;
                }
            }
        }
        int total = requiredSkills.size();
        int missing = total - matched - partial;
        double score = (matched / (double) total) * EXACT_SKILL_CREDIT
            + (partial / (double) total) * PARTIAL_SKILL_CREDIT
            - missing * MISSING_SKILL_PENALTY / total;
        return clamp(score);
    }

    double experienceMatch(Integer requiredYears, int profileYears, String title, List<String> pastRoles) {
        double yearsScore = 1.0;
        if (requiredYears != null && requiredYears > 0) {
            if (profileYears >= requiredYears) {
                yearsScore = 1.0;
            } else if (profileYears >= requiredYears * 0.7) {
                yearsScore = 0.8;
            } else if (profileYears >= requiredYears * 0.5) {
                yearsScore = 0.5;
            } else {
                yearsScore = 0.3;
            }
        }
        double roleScore = 1.0;
        List<String> keywords = TextNormalizer.tokens(title);
        if (!keywords.isEmpty() && !pastRoles.isEmpty()) {
            int matches = 0;
            for (String role : pastRoles) {
                String normalizedRole = TextNormalizer.normalize(role);
                for (String keyword : keywords) {
                    if (normalizedRole.contains(keyword)) {
                        matches++;
                    }
                }
            }
            roleScore = Math.min(1.0, matches / (double) keywords.size());
        }
        return yearsScore * EXPERIENCE_YEARS_SHARE + roleScore * ROLE_SIMILARITY_SHARE;
    }

    /**
     * Cosine similarity of term-frequency vectors; neutral when either side has no text.
     */
    double semanticSimilarity(UserProfile profile, OpportunityFields fields) {
        StringBuilder profileText = new StringBuilder();
        profile.interests().forEach(interest -> profileText.append(interest).append(' '));
        if (profile.careerGoals() != null) {
            profileText.append(profile.careerGoals());
        }
        StringBuilder opportunityText = new StringBuilder();
        opportunityText.append(fields.title()).append(' ');
        fields.tags().forEach(tag -> opportunityText.append(tag).append(' '));
        if (fields.description() != null) {
            opportunityText.append(fields.description());
        }
        Map<String, Integer> left = termFrequencies(profileText.toString());
        Map<String, Integer> right = termFrequencies(opportunityText.toString());
        if (left.isEmpty() || right.isEmpty()) {
            return NEUTRAL;
        }
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            Integer other = right.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * (double) other;
            }
        }
        double norm = Math.sqrt(sumOfSquares(left)) * Math.sqrt(sumOfSquares(right));
        return norm == 0.0 ? 0.0 : clamp(dot / norm);
    }

    double prestige(String organization) {
        String normalized = organization == null ? "" : organization.toLowerCase(Locale.ROOT);
        for (String top : TOP_ORGANIZATIONS) {
            if (normalized.contains(top)) {
                return 0.95;
            }
        }
        for (String program : TOP_PROGRAMS) {
            if (normalized.contains(program)) {
                return 0.90;
            }
        }
        return NEUTRAL;
    }

    /**
     * Urgency is measured from the moment the opportunity was discovered, which keeps the
     * score a function of stored data only.
     */
    double urgency(Instant discoveredAt, Instant deadline) {
        if (deadline == null || discoveredAt == null) {
            return NO_DEADLINE_URGENCY;
        }
        long days = Math.floorDiv(Duration.between(discoveredAt, deadline).getSeconds(), 86_400L);
        if (days < 0) {
            return 0.0;
        }
        if (days <= 3) {
            return 1.0;
        }
        if (days <= 7) {
            return 0.9;
        }
        if (days <= 14) {
            return 0.7;
        }
        if (days <= 30) {
            return 0.5;
        }
        return 0.3;
    }

    double compensation(Double salaryMax, Double minAcceptable) {
        if (salaryMax == null || minAcceptable == null) {
            return NEUTRAL;
        }
        if (salaryMax >= minAcceptable * 1.2) {
            return 1.0;
        }
        if (salaryMax >= minAcceptable) {
            return 0.8;
        }
        if (salaryMax >= minAcceptable * 0.9) {
            return 0.5;
        }
        return 0.3;
    }

    private static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : TextNormalizer.tokens(text)) {
            if (token.length() > 2) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        return counts;
    }

    private static double sumOfSquares(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int value : vector.values()) {
            sum += (double) value * value;
        }
        return sum;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
