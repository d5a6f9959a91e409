package com.costtracker.costs.controller;

import com.costtracker.costs.config.CostsProperties;
import com.costtracker.costs.controller.dto.AboutMemberDto;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AboutController {

    private final CostsProperties properties;

    public AboutController(CostsProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/about")
    public ResponseEntity<List<AboutMemberDto>> about() {
        return ResponseEntity.ok(properties.about().members().stream()
                .map(member -> new AboutMemberDto(member.firstName(), member.lastName()))
                .toList());
    }
}
