package dev.mediasync.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. Entities keyed by a natural identifier
 * (source id, external id, generated filename) implement
 * {@link org.springframework.data.domain.Persistable} and this interface so
 * {@link dev.mediasync.config.PersistableEntityCallback} can flip the flag
 * once a row has been read back.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
