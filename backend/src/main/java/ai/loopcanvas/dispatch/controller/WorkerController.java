package ai.loopcanvas.dispatch.controller;

import ai.loopcanvas.dispatch.service.WorkerRegistryService;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Workers seen by this API process
 */
@RestController
@RequestMapping("/api/v2/workers")
public class WorkerController {

    private final WorkerRegistryService workerRegistry;

    public WorkerController(WorkerRegistryService workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    @GetMapping
    public ResponseEntity<List<WorkerRegistryService.WorkerInfo>> listWorkers() {
        return ResponseEntity.ok(workerRegistry.getWorkers());
    }

    @GetMapping("/{workerId}")
    public ResponseEntity<WorkerRegistryService.WorkerInfo> getWorker(@PathVariable String workerId) {
        return workerRegistry.getWorker(workerId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
