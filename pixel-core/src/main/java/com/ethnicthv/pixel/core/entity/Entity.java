package com.ethnicthv.pixel.core.entity;

/**
 * An entity is just an id that represents one simulated object.
 * <p>
 * Identity is value equality over the raw id; ordering follows the id as well, so entities
 * can live in sorted sets. Ids are recycled by the coordinator, which means a handle must not
 * be kept past the {@code update()} call that reclaims it.
 */
public record Entity(int id) implements Comparable<Entity> {

    public Entity {
        if (id < 0) {
            throw new IllegalArgumentException("Entity id must be >= 0, got " + id);
        }
    }

    @Override
    public int compareTo(Entity other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public String toString() {
        return "Entity#" + id;
    }
}
