package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured summary of a CV. Enrichment only; an empty structure is a valid outcome.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CvStructure(
        String name,
        List<Experience> experience,
        List<String> skills,
        List<Education> education,
        List<String> achievements) {

    public CvStructure {
        experience = experience != null ? List.copyOf(experience) : List.of();
        skills = skills != null ? List.copyOf(skills) : List.of();
        education = education != null ? List.copyOf(education) : List.of();
        achievements = achievements != null ? List.copyOf(achievements) : List.of();
    }

    public static CvStructure empty() {
        return new CvStructure(null, List.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return name == null && experience.isEmpty() && skills.isEmpty()
                && education.isEmpty() && achievements.isEmpty();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Experience(String title, String company, String duration, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Education(String degree, String institution, String year) {
    }
}
