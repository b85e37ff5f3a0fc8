package quest.gekko.dcr.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.dcr.service.scheduling.AggregationJob;
import quest.gekko.dcr.service.scheduling.AggregationJobService;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/admin/aggregations")
@RequiredArgsConstructor
public class AggregationController {
    private final AggregationJobService jobService;

    // Returns at once; poll the job for the summary
    @PostMapping
    public ResponseEntity<AggregationJob> submit(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(jobService.submit(date));
    }

    @GetMapping("/{jobId}")
    public AggregationJob status(@PathVariable String jobId) {
        return jobService.find(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown aggregation job: " + jobId));
    }
}
