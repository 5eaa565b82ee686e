package com.sandcastle.core.persistence;

import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.core.model.SandboxUpdate;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local repository used when no database is configured.
 * Records are lost on restart.
 */
public class InMemorySandboxRepository implements SandboxRepository {

    private static final Comparator<Sandbox> NEWEST_FIRST =
            Comparator.comparing(Sandbox::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<String, Sandbox> sandboxes = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySandboxRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySandboxRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized boolean insert(Sandbox sandbox) {
        if (sandboxes.containsKey(sandbox.id()) || slugExists(sandbox.userId(), sandbox.slug())) {
            return false;
        }
        Instant now = clock.instant();
        var stored = sandbox.toBuilder()
                .createdAt(sandbox.createdAt() != null ? sandbox.createdAt() : now)
                .updatedAt(sandbox.updatedAt() != null ? sandbox.updatedAt() : now)
                .build();
        sandboxes.put(stored.id(), stored);
        return true;
    }

    @Override
    public Optional<Sandbox> getById(String id) {
        return Optional.ofNullable(id).map(sandboxes::get);
    }

    @Override
    public List<Sandbox> listByUser(String userId) {
        return listAll(SandboxFilter.forUser(userId));
    }

    @Override
    public List<Sandbox> listAll(SandboxFilter filter) {
        return sandboxes.values().stream()
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public boolean updateFields(String id, SandboxUpdate update) {
        return sandboxes.computeIfPresent(id, (key, current) -> current.apply(update, clock.instant())) != null;
    }

    @Override
    public boolean updateStatus(String id, SandboxStatus status, String errorMessage) {
        return sandboxes.computeIfPresent(id, (key, current) -> current.toBuilder()
                .status(status)
                .errorMessage(errorMessage)
                .updatedAt(clock.instant())
                .build()) != null;
    }

    @Override
    public boolean touch(String id) {
        return sandboxes.computeIfPresent(id, (key, current) -> current.toBuilder()
                .lastAccessedAt(clock.instant())
                .build()) != null;
    }

    @Override
    public synchronized boolean delete(String id) {
        return sandboxes.remove(id) != null;
    }

    @Override
    public boolean slugExists(String userId, String slug) {
        return sandboxes.values().stream()
                .anyMatch(s -> s.userId().equals(userId) && s.slug() != null && s.slug().equals(slug));
    }

    @Override
    public Map<SandboxStatus, Long> countByStatus(String userId) {
        var counts = new EnumMap<SandboxStatus, Long>(SandboxStatus.class);
        for (SandboxStatus status : SandboxStatus.values()) {
            counts.put(status, 0L);
        }
        sandboxes.values().stream()
                .filter(s -> userId == null || userId.equals(s.userId()))
                .forEach(s -> counts.merge(s.status(), 1L, Long::sum));
        return counts;
    }
}
