package uk.gegc.knowledgeqa.features.evaluation.domain.model;

public enum EvaluationStatus {
    /** Graded by the model */
    EVALUATED,
    /** Grading could not be completed; the attempt is still recorded */
    UNEVALUATED,
    /** Rejected before grading because the answer was blank or a non-answer */
    INVALID_ANSWER
}
