package io.pollrunr.cron;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for inspecting scheduled tasks and running them outside their schedule.
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final CronScheduler scheduler;

    public TaskController(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Lists all registered tasks.
     */
    @GetMapping
    public ResponseEntity<List<TaskView>> listTasks() {
        return ResponseEntity.ok(scheduler.listTasks());
    }

    /**
     * Returns one task.
     */
    @GetMapping("/{name}")
    public ResponseEntity<TaskView> getTask(@PathVariable String name) {
        TaskView task = scheduler.getTask(name);
        return task != null ? ResponseEntity.ok(task) : ResponseEntity.notFound().build();
    }

    /**
     * Triggers a task immediately.
     */
    @PostMapping("/{name}/run")
    public ResponseEntity<Map<String, String>> triggerTask(@PathVariable String name) {
        try {
            scheduler.triggerNow(name);
            return ResponseEntity.ok(Map.of("status", "triggered", "name", name));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(409).body(Map.of("status", "stopped", "name", name));
        }
    }
}
