package uk.gegc.diagnosis.features.diagnosis.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.diagnosis.features.diagnosis.api.dto.*;
import uk.gegc.diagnosis.features.diagnosis.application.DiagnosisService;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.HeatmapData;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.LearningPathStep;
import uk.gegc.diagnosis.features.diagnosis.domain.model.synthesis.ResponsePatternAnalysis;

import java.util.List;
import java.util.UUID;

@Tag(name = "Diagnosis", description = "Adaptive diagnostic assessment: reports, sessions and results")
@RestController
@RequestMapping("/api/v1/diagnosis")
@RequiredArgsConstructor
@Validated
public class DiagnosisController {

    private final DiagnosisService diagnosisService;

    // ==================== Reports ====================

    @Operation(summary = "Create a diagnostic report", description = "Creates a PENDING report for the authenticated user.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Report created",
                    content = @Content(schema = @Schema(implementation = DiagnosisReportDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid configuration",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reports")
    public ResponseEntity<DiagnosisReportDto> createReport(
            @RequestBody @Valid CreateReportRequest request,
            Authentication authentication
    ) {
        DiagnosisReportDto dto = diagnosisService.createReport(authentication.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "List reports", description = "Paginated reports of the authenticated user, newest first.")
    @GetMapping("/reports")
    public ResponseEntity<Page<ReportSummaryDto>> listReports(
            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            @Parameter(in = ParameterIn.QUERY, description = "Filter by subject")
            @RequestParam(name = "subjectId", required = false) String subjectId,

            Authentication authentication
    ) {
        Page<ReportSummaryDto> result = diagnosisService.listReports(
                authentication.getName(),
                subjectId,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get a report")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report returned"),
            @ApiResponse(responseCode = "403", description = "Not the owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Report not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/reports/{reportId}")
    public ResponseEntity<DiagnosisReportDto> getReport(
            @PathVariable UUID reportId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getReport(authentication.getName(), reportId));
    }

    @Operation(summary = "Start a session", description = "Creates and starts an adaptive session in the report.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session started"),
            @ApiResponse(responseCode = "400", description = "Invalid session settings",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Report already completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reports/{reportId}/sessions")
    public ResponseEntity<DiagnosisSessionDto> startSession(
            @PathVariable UUID reportId,
            @RequestBody @Valid StartSessionRequest request,
            Authentication authentication
    ) {
        DiagnosisSessionDto dto = diagnosisService.startSession(authentication.getName(), reportId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Complete a report",
            description = "Synthesizes all responses into mastery, rankings, learning path and recommendations.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report completed"),
            @ApiResponse(responseCode = "409", description = "Report already completed or a session is still active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reports/{reportId}/complete")
    public ResponseEntity<DiagnosisReportDto> completeReport(
            @PathVariable UUID reportId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.completeReport(authentication.getName(), reportId));
    }

    @Operation(summary = "Knowledge point heatmap of a completed report")
    @GetMapping("/reports/{reportId}/heatmap")
    public ResponseEntity<HeatmapData> getHeatmap(
            @PathVariable UUID reportId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getHeatmap(authentication.getName(), reportId));
    }

    @Operation(summary = "Learning path of a completed report")
    @GetMapping("/reports/{reportId}/learning-path")
    public ResponseEntity<List<LearningPathStep>> getLearningPath(
            @PathVariable UUID reportId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getLearningPath(authentication.getName(), reportId));
    }

    @Operation(summary = "Weakness analysis of a completed report")
    @GetMapping("/reports/{reportId}/weaknesses")
    public ResponseEntity<WeaknessAnalysisDto> getWeaknessAnalysis(
            @PathVariable UUID reportId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getWeaknessAnalysis(authentication.getName(), reportId));
    }

    // ==================== Sessions ====================

    @Operation(summary = "Next question",
            description = "Returns the pending question, selects a new one, or marks the session finished.")
    @GetMapping("/sessions/{sessionId}/next-question")
    public ResponseEntity<NextQuestionDto> nextQuestion(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.nextQuestion(authentication.getName(), sessionId));
    }

    @Operation(summary = "Submit an answer to the pending question")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer recorded"),
            @ApiResponse(responseCode = "400", description = "No pending question or wrong question id",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session not in progress or at its question limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sessions/{sessionId}/answers")
    public ResponseEntity<AnswerResultDto> submitAnswer(
            @PathVariable UUID sessionId,
            @RequestBody @Valid AnswerSubmissionRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.submitAnswer(authentication.getName(), sessionId, request));
    }

    @Operation(summary = "End a session")
    @PostMapping("/sessions/{sessionId}/end")
    public ResponseEntity<DiagnosisSessionDto> endSession(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.endSession(authentication.getName(), sessionId));
    }

    @Operation(summary = "Cancel a session")
    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<DiagnosisSessionDto> cancelSession(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.cancelSession(authentication.getName(), sessionId));
    }

    @Operation(summary = "Get a session")
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<DiagnosisSessionDto> getSession(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getSession(authentication.getName(), sessionId));
    }

    @Operation(summary = "Running ability estimate of a session")
    @GetMapping("/sessions/{sessionId}/ability")
    public ResponseEntity<AbilityEstimateDto> getAbilityEstimate(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getAbilityEstimate(authentication.getName(), sessionId));
    }

    @Operation(summary = "Response pattern analysis of a session")
    @GetMapping("/sessions/{sessionId}/analysis")
    public ResponseEntity<ResponsePatternAnalysis> analyzeSession(
            @PathVariable UUID sessionId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.analyzeSession(authentication.getName(), sessionId));
    }

    // ==================== Statistics ====================

    @Operation(summary = "Diagnosis statistics of the authenticated user")
    @GetMapping("/statistics")
    public ResponseEntity<DiagnosisStatisticsDto> getStatistics(
            @RequestParam(name = "subjectId", required = false) String subjectId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(diagnosisService.getStatistics(authentication.getName(), subjectId));
    }
}
