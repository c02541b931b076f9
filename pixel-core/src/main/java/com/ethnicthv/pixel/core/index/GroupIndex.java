package com.ethnicthv.pixel.core.index;

import com.ethnicthv.pixel.core.entity.Entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Many-to-many membership between named groups and entities.
 * <p>
 * Empty entries are removed on both sides, so a group with no members does not exist and an
 * entity without groups has no entry.
 */
public final class GroupIndex {
    private final Map<String, TreeSet<Entity>> entitiesPerGroup = new HashMap<>();
    private final Map<Entity, TreeSet<String>> groupsPerEntity = new HashMap<>();

    /** Add the entity to the group. Idempotent. */
    public void group(Entity entity, String group) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(group, "group");
        entitiesPerGroup.computeIfAbsent(group, g -> new TreeSet<>()).add(entity);
        groupsPerEntity.computeIfAbsent(entity, e -> new TreeSet<>()).add(group);
    }

    public boolean belongsTo(Entity entity, String group) {
        Set<Entity> members = entitiesPerGroup.get(group);
        return members != null && members.contains(entity);
    }

    public boolean hasGroup(String group) {
        return entitiesPerGroup.containsKey(group);
    }

    /** Members of the group in id order; empty if the group does not exist. */
    public List<Entity> getEntities(String group) {
        Set<Entity> members = entitiesPerGroup.get(group);
        return members == null ? List.of() : new ArrayList<>(members);
    }

    /** Groups the entity belongs to, sorted by name. */
    public Set<String> getGroups(Entity entity) {
        TreeSet<String> groups = groupsPerEntity.get(entity);
        return groups == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(groups));
    }

    public void removeEntityGroup(Entity entity, String group) {
        TreeSet<Entity> members = entitiesPerGroup.get(group);
        if (members != null) {
            members.remove(entity);
            if (members.isEmpty()) {
                entitiesPerGroup.remove(group);
            }
        }
        TreeSet<String> groups = groupsPerEntity.get(entity);
        if (groups != null) {
            groups.remove(group);
            if (groups.isEmpty()) {
                groupsPerEntity.remove(entity);
            }
        }
    }

    public void removeEntityGroups(Entity entity) {
        TreeSet<String> groups = groupsPerEntity.remove(entity);
        if (groups == null) {
            return;
        }
        for (String group : groups) {
            TreeSet<Entity> members = entitiesPerGroup.get(group);
            if (members == null) continue;
            members.remove(entity);
            if (members.isEmpty()) {
                entitiesPerGroup.remove(group);
            }
        }
    }

    public void removeGroup(String group) {
        TreeSet<Entity> members = entitiesPerGroup.remove(group);
        if (members == null) {
            return;
        }
        for (Entity entity : members) {
            TreeSet<String> groups = groupsPerEntity.get(entity);
            if (groups == null) continue;
            groups.remove(group);
            if (groups.isEmpty()) {
                groupsPerEntity.remove(entity);
            }
        }
    }

    public int groupCount() {
        return entitiesPerGroup.size();
    }

    public void clear() {
        entitiesPerGroup.clear();
        groupsPerEntity.clear();
    }
}
