package com.sandcastle.core.persistence;

import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.core.model.SandboxUpdate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for {@link Sandbox} records.
 *
 * <p>Reads never throw for a missing row. Writes touch a single row and report
 * whether it was written; {@link #insert(Sandbox)} returns {@code false} when
 * the id or the {@code (userId, slug)} pair is already taken. Lists are ordered
 * by {@code createdAt}, newest first.
 */
public interface SandboxRepository {

    boolean insert(Sandbox sandbox);

    Optional<Sandbox> getById(String id);

    List<Sandbox> listByUser(String userId);

    List<Sandbox> listAll(SandboxFilter filter);

    /**
     * Applies the non-null fields of {@code update} and bumps {@code updatedAt}.
     *
     * @return {@code false} when no sandbox has this id
     */
    boolean updateFields(String id, SandboxUpdate update);

    /**
     * Sets the status and replaces the error message ({@code null} clears it).
     */
    boolean updateStatus(String id, SandboxStatus status, String errorMessage);

    /** Sets {@code lastAccessedAt} to now. */
    boolean touch(String id);

    boolean delete(String id);

    boolean slugExists(String userId, String slug);

    /**
     * Number of sandboxes per status; every status is present, zero when none.
     *
     * @param userId owner to count for, or {@code null} for all owners
     */
    Map<SandboxStatus, Long> countByStatus(String userId);
}
