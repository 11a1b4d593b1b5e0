package uk.gegc.knowledgeqa.features.drill.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.knowledgeqa.features.drill.api.dto.GenerateQuestionRequest;
import uk.gegc.knowledgeqa.features.drill.api.dto.QaRecordDto;
import uk.gegc.knowledgeqa.features.drill.api.dto.QuestionDto;
import uk.gegc.knowledgeqa.features.drill.api.dto.SubmitAnswerRequest;
import uk.gegc.knowledgeqa.features.drill.application.DrillService;
import uk.gegc.knowledgeqa.features.history.domain.model.EvaluationStatistics;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Tag(name = "Drill", description = "Generate questions from a knowledge base, grade answers and review history.")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Slf4j
public class DrillController {

    private final DrillService drillService;

    @Operation(
            summary = "Generate the next question",
            description = "Selects content from the knowledge base with the requested strategy and asks the model for one open-ended question. Omitted options use the configured defaults."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Question generated"),
            @ApiResponse(responseCode = "404", description = "Knowledge base not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Knowledge base has no content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "No valid question could be generated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/knowledge-bases/{kbName}/questions")
    public ResponseEntity<QuestionDto> generateQuestion(
            @Parameter(description = "Knowledge base name", required = true) @PathVariable String kbName,
            @RequestBody(required = false) @Valid GenerateQuestionRequest request) {
        GenerateQuestionRequest options = request != null ? request : new GenerateQuestionRequest(null, null, null);
        Question question = drillService.nextQuestion(kbName, options.difficulty(), options.strategy(), options.sessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(QuestionDto.from(question));
    }

    @Operation(
            summary = "Suggest questions on a topic",
            description = "Retrieves the fragments most similar to the topic and generates one medium question from each. Fragments the model fails on are skipped; the list is empty when nothing could be generated."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Suggested questions, possibly empty"),
            @ApiResponse(responseCode = "404", description = "Knowledge base not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/knowledge-bases/{kbName}/question-suggestions")
    public ResponseEntity<List<QuestionDto>> suggestQuestions(
            @PathVariable String kbName,
            @Parameter(description = "Topic to search the knowledge base for", example = "list comprehensions", required = true)
            @RequestParam @NotBlank @Size(max = 200) String topic) {
        List<QuestionDto> suggestions = drillService.suggestQuestions(kbName, topic).stream()
                .map(QuestionDto::from)
                .toList();
        return ResponseEntity.ok(suggestions);
    }

    @Operation(
            summary = "Submit an answer",
            description = "Grades the answer against the question's reference material and records the attempt. Grading failures are reported with status UNEVALUATED instead of an error."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer graded and recorded"),
            @ApiResponse(responseCode = "404", description = "Question not found or expired",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/questions/{questionId}/answers")
    public ResponseEntity<QaRecordDto> submitAnswer(
            @Parameter(description = "Identifier of an issued question", required = true) @PathVariable UUID questionId,
            @RequestBody @Valid SubmitAnswerRequest request) {
        return ResponseEntity.ok(QaRecordDto.from(drillService.submitAnswer(questionId, request.answer())));
    }

    @Operation(summary = "List answered questions", description = "Newest first.")
    @GetMapping("/knowledge-bases/{kbName}/history")
    public ResponseEntity<List<QaRecordDto>> history(
            @PathVariable String kbName,
            @Parameter(description = "Maximum number of records", example = "20")
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        List<QaRecordDto> records = drillService.history(kbName, limit).stream()
                .map(QaRecordDto::from)
                .toList();
        return ResponseEntity.ok(records);
    }

    @Operation(summary = "Answer statistics", description = "Accuracy, average score and score distribution over the recorded history.")
    @GetMapping("/knowledge-bases/{kbName}/statistics")
    public ResponseEntity<EvaluationStatistics> statistics(@PathVariable String kbName) {
        return ResponseEntity.ok(drillService.statistics(kbName));
    }

    @Operation(summary = "Clear history", description = "Deletes the recorded history and the recent-question memory of a knowledge base.")
    @DeleteMapping("/knowledge-bases/{kbName}/history")
    public ResponseEntity<Map<String, Integer>> clearHistory(@PathVariable String kbName) {
        int deleted = drillService.clearHistory(kbName);
        log.info("Cleared {} history records for '{}'", deleted, kbName);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }
}
