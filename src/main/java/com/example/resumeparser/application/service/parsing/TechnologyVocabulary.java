package com.example.resumeparser.application.service.parsing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Curated technology keywords recognized anywhere in résumé text.
 * Matches are case-insensitive and reported with their canonical spelling.
 */
public final class TechnologyVocabulary {

    private static final List<String> TERMS = List.of(
            "Python", "Java", "JavaScript", "TypeScript", "C++", "C#", "Kotlin", "Scala", "Ruby", "PHP",
            "Swift", "Rust", "SQL", "HTML", "CSS", "React", "Angular", "Vue", "Node.js", "Django",
            "Flask", "Spring Boot", "AWS", "Azure", "GCP", "Docker", "Kubernetes", "Terraform", "Git",
            "Linux", "Windows", "macOS", "Agile", "Scrum", "Machine Learning", "AI", "Data Science",
            "Analytics", "Pandas", "NumPy", "TensorFlow", "PyTorch", "PostgreSQL", "MySQL", "MongoDB",
            "Redis", "Kafka", "GraphQL", "Jenkins"
    );

    private static final Map<String, String> CANONICAL = TERMS.stream()
            .collect(Collectors.toMap(TechnologyVocabulary::key, Function.identity()));

    private static final Pattern PATTERN = Pattern.compile(
            "(?<![A-Za-z0-9])(?:" + TERMS.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .map(term -> Pattern.quote(term).replace(" ", "\\E\\s+\\Q"))
                    .collect(Collectors.joining("|"))
                    + ")(?![A-Za-z0-9+#])",
            Pattern.CASE_INSENSITIVE);

    private TechnologyVocabulary() {
    }

    /**
     * @return canonical names of the technologies mentioned in {@code text}, in order of first
     * appearance and without duplicates
     */
    public static List<String> find(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = PATTERN.matcher(text);
        while (matcher.find()) {
            String canonical = CANONICAL.get(key(matcher.group()));
            if (canonical != null) {
                found.add(canonical);
            }
        }
        return new ArrayList<>(found);
    }

    private static String key(String term) {
        return term.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
