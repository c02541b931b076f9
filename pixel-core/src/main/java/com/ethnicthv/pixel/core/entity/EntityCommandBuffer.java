package com.ethnicthv.pixel.core.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * EntityCommandBuffer - staging area for structural changes.
 * <p>
 * Phase 1 (stage): {@code create}/{@code destroy} and signature changes on live entities are
 * recorded here during the frame and have no effect on system membership.
 * <p>
 * Phase 2 (commit): the coordinator drains each queue once per frame in {@code update()}.
 * Queues are ordered by entity id, so playback is deterministic.
 */
public final class EntityCommandBuffer {
    private final TreeSet<Entity> toCreate = new TreeSet<>();
    private final TreeSet<Entity> toDestroy = new TreeSet<>();
    private final TreeSet<Entity> dirty = new TreeSet<>();

    public void stageCreate(Entity entity) {
        toCreate.add(entity);
    }

    public void stageDestroy(Entity entity) {
        toDestroy.add(entity);
    }

    /** Record that a live entity's signature changed and its system membership must be re-evaluated. */
    public void markDirty(Entity entity) {
        dirty.add(entity);
    }

    public boolean isPendingCreation(Entity entity) {
        return toCreate.contains(entity);
    }

    public boolean isPendingDestruction(Entity entity) {
        return toDestroy.contains(entity);
    }

    public List<Entity> drainCreated() {
        return drain(toCreate);
    }

    public List<Entity> drainDestroyed() {
        return drain(toDestroy);
    }

    public List<Entity> drainDirty() {
        return drain(dirty);
    }

    public int pendingCreations() {
        return toCreate.size();
    }

    public int pendingDestructions() {
        return toDestroy.size();
    }

    public boolean isEmpty() {
        return toCreate.isEmpty() && toDestroy.isEmpty() && dirty.isEmpty();
    }

    public void clear() {
        toCreate.clear();
        toDestroy.clear();
        dirty.clear();
    }

    private static List<Entity> drain(TreeSet<Entity> queue) {
        if (queue.isEmpty()) {
            return Collections.emptyList();
        }
        List<Entity> out = new ArrayList<>(queue);
        queue.clear();
        return out;
    }
}
