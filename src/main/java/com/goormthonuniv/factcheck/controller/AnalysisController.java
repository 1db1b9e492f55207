package com.goormthonuniv.factcheck.controller;

import com.goormthonuniv.factcheck.dto.AnalyzeRequest;
import com.goormthonuniv.factcheck.dto.HistoryItem;
import com.goormthonuniv.factcheck.dto.ScoredReport;
import com.goormthonuniv.factcheck.service.AnalysisOrchestrator;
import com.goormthonuniv.factcheck.service.ReportNotFoundException;
import com.goormthonuniv.factcheck.service.ReportRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    static final int HISTORY_LIMIT = 50;

    private final AnalysisOrchestrator orchestrator;
    private final ReportRepository reports;

    @Operation(summary = "기사 사실 검증", description = "기사 URL 또는 본문을 전달하면 교차 검증 점수/신뢰 등급/소스별 근거를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공 (점수 null 이면 검증 불가)"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "422", description = "원문 사실 추출 실패"),
            @ApiResponse(responseCode = "502", description = "원문 기사 가져오기 실패"),
            @ApiResponse(responseCode = "503", description = "추출 서비스 사용 불가"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/analyze")
    public ResponseEntity<ScoredReport> analyze(@Valid @RequestBody AnalyzeRequest req) {
        return ResponseEntity.ok(orchestrator.analyze(req));
    }

    @Operation(summary = "리포트 조회")
    @GetMapping("/reports/{id}")
    public ResponseEntity<ScoredReport> report(@PathVariable("id") String id) {
        return ResponseEntity.ok(reports.findById(id).orElseThrow(() -> new ReportNotFoundException(id)));
    }

    @Operation(summary = "최근 분석 이력", description = "최신순 최대 50건")
    @GetMapping("/history")
    public ResponseEntity<List<HistoryItem>> history() {
        return ResponseEntity.ok(reports.findRecent(HISTORY_LIMIT).stream().map(HistoryItem::of).toList());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
