package com.delta.harvester.crawl.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class CategoryVocabulary {
    private static final List<String> CATEGORIES = List.of(
        "AI", "ML", "SaaS", "B2B", "Consumer", "Enterprise", "Fintech", "Healthtech", "Healthcare",
        "Healthcare IT", "Edtech", "Education", "E-commerce", "Mobile", "Web", "API", "Analytics",
        "Security", "Cloud", "DevOps", "Marketing", "Sales", "HR", "Human Resources", "Legal",
        "Real Estate", "Transportation", "Food", "Fashion", "Gaming", "Media", "Entertainment",
        "Industrials", "Infrastructure", "Productivity", "Engineering", "Operations", "Retail",
        "Supply Chain", "Automotive", "Drones", "Robotics", "Manufacturing", "Drug Discovery",
        "Social", "Recruiting and Talent", "Finance and Accounting", "Construction"
    );

    private static final List<Pattern> PATTERNS = CATEGORIES.stream()
        .map(category -> Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(category) + "(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
        .toList();

    private CategoryVocabulary() {
    }

    public static List<String> findIn(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (int i = 0; i < CATEGORIES.size(); i++) {
            if (PATTERNS.get(i).matcher(text).find()) {
                found.add(CATEGORIES.get(i));
            }
        }
        return found;
    }

    public static String canonical(String text) {
        if (text == null) {
            return null;
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        for (String category : CATEGORIES) {
            if (category.toLowerCase(Locale.ROOT).equals(needle)) {
                return category;
            }
        }
        return null;
    }
}
