package com.example.realm.admin;

import com.example.realm.error.GameException;
import com.example.realm.error.OccupancyConflictException;
import com.example.realm.logic.WorldExecutor;
import com.example.realm.protocol.EntityView;
import com.example.realm.protocol.dto.ErrorPayload;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final long WORLD_TIMEOUT_MS = 5000;

    private final AdminService admin;
    private final WorldExecutor worldExecutor;

    public AdminController(AdminService admin, WorldExecutor worldExecutor) {
        this.admin = admin;
        this.worldExecutor = worldExecutor;
    }

    public record TeleportRequest(long userId, int mapId, int x, int y) {}

    public record SpawnRequest(int templateId, int mapId, int x, int y) {}

    @GetMapping("/status")
    public AdminService.Status status() {
        return onWorld(admin::status);
    }

    @PostMapping("/teleport")
    public EntityView teleport(@RequestBody TeleportRequest req) {
        return onWorld(() -> admin.teleport(req.userId(), req.mapId(), req.x(), req.y()));
    }

    @PostMapping("/npcs")
    @ResponseStatus(HttpStatus.CREATED)
    public EntityView spawnNpc(@RequestBody SpawnRequest req) {
        return onWorld(() -> admin.spawnNpc(req.templateId(), req.mapId(), req.x(), req.y()));
    }

    @DeleteMapping("/entities/{id}")
    public ResponseEntity<Void> despawn(@PathVariable("id") long id) {
        onWorld(() -> {
            admin.despawn(id);
            return null;
        });
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(GameException.class)
    public ResponseEntity<ErrorPayload> rejected(GameException e) {
        HttpStatus status = e instanceof OccupancyConflictException ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(new ErrorPayload(e.reason()));
    }

    private <T> T onWorld(Supplier<T> action) {
        CompletableFuture<T> f = worldExecutor.submit(action);
        try {
            return f.get(WORLD_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GameException g) throw g;
            if (e.getCause() instanceof RuntimeException r) throw r;
            throw new IllegalStateException(e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("world thread did not answer in time", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }
}
