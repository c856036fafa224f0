package com.coursemapper.api;

import com.coursemapper.domain.DomainModels.CourseMappingRow;
import com.coursemapper.repository.MappingOutputJdbcRepository;
import com.coursemapper.service.MappingRunService;
import com.coursemapper.service.RunSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/mapper")
public class MappingRunController {
    private final MappingRunService runService;
    private final MappingOutputJdbcRepository outputRepository;

    public MappingRunController(MappingRunService runService, MappingOutputJdbcRepository outputRepository) {
        this.runService = runService;
        this.outputRepository = outputRepository;
    }

    @PostMapping("/run")
    public ResponseEntity<RunSummary> run(@RequestBody(required = false) RunRequest request) {
        return ResponseEntity.ok(runService.run(request == null ? List.of() : request.institutions()));
    }

    @GetMapping("/requirements/{requirementKey}/courses")
    public ResponseEntity<List<CourseMappingRow>> courses(@PathVariable int requirementKey) {
        return ResponseEntity.ok(outputRepository.findCourseMappings(requirementKey));
    }

    public record RunRequest(List<String> institutions) {}
}
