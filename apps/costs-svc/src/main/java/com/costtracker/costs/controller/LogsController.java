package com.costtracker.costs.controller;

import com.costtracker.costs.controller.dto.RequestLogDto;
import com.costtracker.costs.model.RequestLogRecord;
import com.costtracker.costs.requestlog.RequestLogService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/logs")
public class LogsController {

    private final RequestLogService requestLogService;

    public LogsController(RequestLogService requestLogService) {
        this.requestLogService = requestLogService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Boolean>> acceptLog(@RequestBody RequestLogDto request) {
        requestLogService.accept(new RequestLogRecord(
                request.ts(),
                request.service(),
                request.type(),
                request.method(),
                request.path(),
                request.statusCode(),
                request.responseTimeMs(),
                request.message(),
                request.meta()));
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @GetMapping
    public ResponseEntity<List<RequestLogDto>> listLogs() {
        return ResponseEntity.ok(requestLogService.listNewestFirst().stream()
                .map(record -> new RequestLogDto(
                        record.ts(),
                        record.service(),
                        record.type(),
                        record.method(),
                        record.path(),
                        record.statusCode(),
                        record.responseTimeMs(),
                        record.message(),
                        record.meta()))
                .toList());
    }
}
