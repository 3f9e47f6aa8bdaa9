package dev.newsroom.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. Entities with pre-assigned Snowflake IDs
 * implement this so {@link dev.newsroom.config.PersistableEntityCallback}
 * can flip the flag after loading without reflection.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
