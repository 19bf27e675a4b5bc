package uk.gegc.checkpointsync.features.benchmark.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.checkpointsync.features.benchmark.api.dto.ResolveDuplicatesRequest;
import uk.gegc.checkpointsync.features.benchmark.application.BenchmarkService;
import uk.gegc.checkpointsync.features.benchmark.domain.model.BenchmarkInfo;
import uk.gegc.checkpointsync.features.benchmark.domain.model.ResolveDuplicatesResult;
import uk.gegc.checkpointsync.features.benchmark.domain.model.SaveBenchmarkResult;
import uk.gegc.checkpointsync.features.checkpoint.domain.model.Checkpoint;

import java.util.List;

@Tag(name = "Benchmarks", description = "Stored benchmarks and duplicate resolution")
@RestController
@RequestMapping("/api/v1/benchmarks")
@RequiredArgsConstructor
@Validated
public class BenchmarkController {

    private final BenchmarkService benchmarkService;

    @Operation(summary = "List stored benchmarks")
    @GetMapping
    public ResponseEntity<List<BenchmarkInfo>> listBenchmarks() {
        return ResponseEntity.ok(benchmarkService.listBenchmarks());
    }

    @Operation(summary = "Load a benchmark as a checkpoint")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Benchmark found"),
            @ApiResponse(responseCode = "404", description = "Benchmark not found")
    })
    @GetMapping("/{name}")
    public ResponseEntity<Checkpoint> loadBenchmark(@PathVariable String name) {
        return ResponseEntity.ok(benchmarkService.loadBenchmark(name));
    }

    @Operation(
            summary = "Save a checkpoint as a benchmark",
            description = "Creates the benchmark or merges the checkpoint into it. With detectDuplicates=true, "
                    + "questions already stored under the same ID are returned instead of being overwritten."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Benchmark created"),
            @ApiResponse(responseCode = "200", description = "Benchmark updated, or duplicates returned for resolution"),
            @ApiResponse(responseCode = "400", description = "Invalid payload")
    })
    @PutMapping("/{name}")
    public ResponseEntity<SaveBenchmarkResult> saveBenchmark(
            @PathVariable String name,
            @RequestBody Checkpoint checkpoint,
            @Parameter(description = "Return duplicates instead of overwriting them")
            @RequestParam(defaultValue = "false") boolean detectDuplicates) {
        SaveBenchmarkResult result = benchmarkService.saveBenchmark(name, checkpoint, detectDuplicates);
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @Operation(
            summary = "Merge a checkpoint using duplicate resolutions",
            description = "Each duplicate keeps the stored version (keep_old) or the candidate version (keep_new, the default). "
                    + "Stored questions missing from the candidate are kept."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Merge persisted"),
            @ApiResponse(responseCode = "404", description = "Benchmark not found"),
            @ApiResponse(responseCode = "409", description = "Inconsistent duplicate data")
    })
    @PostMapping("/{name}/resolve-duplicates")
    public ResponseEntity<ResolveDuplicatesResult> resolveDuplicates(
            @PathVariable String name,
            @RequestBody @Valid ResolveDuplicatesRequest request) {
        return ResponseEntity.ok(benchmarkService.resolveDuplicates(name, request.checkpoint(), request.resolutions()));
    }

    @Operation(summary = "Delete a benchmark")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Benchmark deleted"),
            @ApiResponse(responseCode = "404", description = "Benchmark not found")
    })
    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteBenchmark(@PathVariable String name) {
        benchmarkService.deleteBenchmark(name);
        return ResponseEntity.noContent().build();
    }
}
