package com.delta.opportunities.pipeline.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record UserProfile(
    String userId,
    List<String> skills,
    List<String> pastRoles,
    int yearsExperience,
    List<String> interests,
    String careerGoals,
    Double minSalary,
    Map<OpportunityType, Double> historicalSuccessRates,
    AutomationLevel automationLevel
) {
    public UserProfile {
        skills = skills == null ? List.of() : List.copyOf(skills);
        pastRoles = pastRoles == null ? List.of() : List.copyOf(pastRoles);
        interests = interests == null ? List.of() : List.copyOf(interests);
        yearsExperience = Math.max(0, yearsExperience);
        Map<OpportunityType, Double> rates = new EnumMap<>(OpportunityType.class);
        if (historicalSuccessRates != null) {
            rates.putAll(historicalSuccessRates);
        }
        historicalSuccessRates = Map.copyOf(rates);
    }

    public UserProfile withUserId(String id) {
        return new UserProfile(
            id,
            skills,
            pastRoles,
            yearsExperience,
            interests,
            careerGoals,
            minSalary,
            historicalSuccessRates,
            automationLevel
        );
    }
}
