package uk.gegc.knowledgeqa.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 problem type URIs returned by the API.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://knowledge-qa.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI KNOWLEDGE_BASE_NOT_FOUND = URI.create(BASE_URL + "/knowledge-base-not-found");
    public static final URI QUESTION_NOT_FOUND = URI.create(BASE_URL + "/question-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== State Errors ====================
    public static final URI EMPTY_KNOWLEDGE_BASE = URI.create(BASE_URL + "/empty-knowledge-base");

    // ==================== AI Service Errors ====================
    public static final URI QUESTION_GENERATION_FAILED = URI.create(BASE_URL + "/question-generation-failed");
    public static final URI REQUEST_CANCELLED = URI.create(BASE_URL + "/request-cancelled");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
