package dev.cvevaluator.model;

public enum CvCriterion implements Criterion {

    TECHNICAL_SKILLS_MATCH("technical_skills_match", 0.40),
    EXPERIENCE_LEVEL("experience_level", 0.25),
    RELEVANT_ACHIEVEMENTS("relevant_achievements", 0.20),
    CULTURAL_FIT("cultural_fit", 0.15);

    private final String key;
    private final double weight;

    CvCriterion(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public double weight() {
        return weight;
    }
}
