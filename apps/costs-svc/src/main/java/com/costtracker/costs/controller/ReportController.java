package com.costtracker.costs.controller;

import com.costtracker.costs.controller.dto.ReportResponseDto;
import com.costtracker.costs.model.Report;
import com.costtracker.costs.model.ReportKey;
import com.costtracker.costs.report.ReportService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/report")
    public ResponseEntity<ReportResponseDto> getReport(
            @RequestParam(value = "id", required = false) String id,
            @RequestParam(value = "year", required = false) String year,
            @RequestParam(value = "month", required = false) String month
    ) {
        ReportKey key = ReportKey.parse(id, year, month);
        Report report = reportService.getReport(key);
        return ResponseEntity.ok(map(report));
    }

    private ReportResponseDto map(Report report) {
        List<Map<String, List<ReportResponseDto.Entry>>> costs = report.costsByCategory().stream()
                .map(bucket -> Map.of(
                        bucket.category().wireName(),
                        bucket.entries().stream()
                                .map(entry -> new ReportResponseDto.Entry(entry.amount(), entry.description(), entry.dayOfMonth()))
                                .toList()))
                .toList();
        return new ReportResponseDto(report.userId(), report.year(), report.month(), costs);
    }
}
