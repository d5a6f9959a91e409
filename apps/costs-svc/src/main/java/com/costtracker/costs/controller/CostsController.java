package com.costtracker.costs.controller;

import com.costtracker.costs.controller.dto.AddCostRequestDto;
import com.costtracker.costs.controller.dto.CostResponseDto;
import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.service.CostService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CostsController {

    private final CostService costService;

    public CostsController(CostService costService) {
        this.costService = costService;
    }

    @PostMapping("/add")
    public ResponseEntity<CostResponseDto> addCost(@RequestBody @Valid AddCostRequestDto request) {
        CostRecord saved = costService.addCost(new CostService.NewCost(
                request.description(),
                request.category(),
                request.userid(),
                request.sum(),
                request.createdAt()));
        return ResponseEntity.ok(new CostResponseDto(
                saved.description(),
                saved.category(),
                saved.userId(),
                saved.amount(),
                saved.createdAt()));
    }
}
