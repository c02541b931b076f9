package com.ethnicthv.pixel.core.index;

import com.ethnicthv.pixel.core.entity.Entity;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bijective mapping between tag strings and entities: a tag names at most one entity and an
 * entity carries at most one tag. Both directions are always updated together.
 */
public final class TagIndex {
    private final Map<String, Entity> entityPerTag = new HashMap<>();
    private final Map<Entity, String> tagPerEntity = new HashMap<>();

    /**
     * Bind {@code tag} to {@code entity}. First assignment wins: if the tag is already taken this
     * is a no-op. If the entity held another tag, that tag is released.
     *
     * @return true if the binding was made
     */
    public boolean tag(Entity entity, String tag) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(tag, "tag");
        if (entityPerTag.containsKey(tag)) {
            return false;
        }
        String previous = tagPerEntity.put(entity, tag);
        if (previous != null) {
            entityPerTag.remove(previous);
        }
        entityPerTag.put(tag, entity);
        return true;
    }

    public boolean hasTag(Entity entity, String tag) {
        return tag != null && tag.equals(tagPerEntity.get(entity));
    }

    public Optional<Entity> findEntity(String tag) {
        return Optional.ofNullable(entityPerTag.get(tag));
    }

    public Optional<String> getTag(Entity entity) {
        return Optional.ofNullable(tagPerEntity.get(entity));
    }

    public void removeEntityTag(Entity entity) {
        String tag = tagPerEntity.remove(entity);
        if (tag != null) {
            entityPerTag.remove(tag);
        }
    }

    public void removeTag(String tag) {
        Entity entity = entityPerTag.remove(tag);
        if (entity != null) {
            tagPerEntity.remove(entity);
        }
    }

    public int size() {
        return entityPerTag.size();
    }

    public void clear() {
        entityPerTag.clear();
        tagPerEntity.clear();
    }
}
