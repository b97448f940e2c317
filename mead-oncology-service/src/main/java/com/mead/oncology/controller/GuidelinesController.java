package com.mead.oncology.controller;

import com.mead.oncology.dto.GuidelineDtos.CancerTypeSummary;
import com.mead.oncology.dto.GuidelineDtos.GuidelineDetail;
import com.mead.oncology.service.ConsultationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class GuidelinesController {

    private final ConsultationService service;

    public GuidelinesController(ConsultationService service) {
        this.service = service;
    }

    @GetMapping("/guidelines")
    public List<CancerTypeSummary> list() {
        return service.listCancerTypes();
    }

    @GetMapping("/guidelines/{cancerType}/{stage}")
    public GuidelineDetail get(@PathVariable("cancerType") String cancerType, @PathVariable("stage") String stage) {
        return service.getGuideline(cancerType, stage);
    }
}
