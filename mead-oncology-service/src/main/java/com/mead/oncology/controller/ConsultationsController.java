package com.mead.oncology.controller;

import com.mead.oncology.dto.GuidelineDtos.ConsultationRequestBody;
import com.mead.oncology.model.ConsultationResult;
import com.mead.oncology.service.ConsultationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/v1")
public class ConsultationsController {

    private final ConsultationService service;

    public ConsultationsController(ConsultationService service) {
        this.service = service;
    }

    @PostMapping("/consultations")
    public ConsultationResult consult(@RequestBody ConsultationRequestBody body) {
        List<String> symptoms = body.symptoms() == null
                ? List.of()
                : body.symptoms().stream()
                        .filter(Objects::nonNull)
                        .map(String::strip)
                        .filter(symptom -> !symptom.isEmpty())
                        .toList();
        return service.runConsultation(body.cancerType(), body.stage(), body.proposedTreatment(), symptoms);
    }
}
