package uk.gegc.examimport.features.question.domain.model;

/**
 * Content pool an imported question list is destined for. Parsing is identical for both;
 * only the label in error messages differs.
 */
public enum QuestionPool {
    TRYOUT("tryout"),
    PRACTICE("latihan");

    private final String label;

    QuestionPool(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
