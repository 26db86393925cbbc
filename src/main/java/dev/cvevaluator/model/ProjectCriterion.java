package dev.cvevaluator.model;

public enum ProjectCriterion implements Criterion {

    CORRECTNESS("correctness", 0.30),
    CODE_QUALITY("code_quality", 0.25),
    RESILIENCE("resilience", 0.20),
    DOCUMENTATION("documentation", 0.15),
    CREATIVITY("creativity", 0.10);

    private final String key;
    private final double weight;

    ProjectCriterion(String key, double weight) {
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
