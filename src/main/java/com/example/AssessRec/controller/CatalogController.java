package com.example.AssessRec.controller;

import com.example.AssessRec.model.CatalogStatus;
import com.example.AssessRec.service.CatalogIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogIndexService catalogIndexService;

    @PostMapping("/build")
    public CatalogStatus build(@RequestParam(value = "reset", defaultValue = "true") boolean reset) {
        return catalogIndexService.build(reset);
    }

    @GetMapping("/status")
    public CatalogStatus status() {
        return catalogIndexService.status();
    }
}
