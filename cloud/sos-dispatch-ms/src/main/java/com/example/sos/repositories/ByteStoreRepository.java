package com.example.sos.repositories;

import com.example.sos.capabilities.ByteStore;
import com.example.sos.model.StoredValue;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

@ApplicationScoped
public class ByteStoreRepository
    implements PanacheRepositoryBase<StoredValue, String>, ByteStore {

    @Override
    @Transactional
    public byte[] get(String key) {
        return findByIdOptional(key).map(v -> v.payload).orElse(null);
    }

    @Override
    @Transactional
    public void set(String key, byte[] value) {
        StoredValue existing = findById(key);
        if (existing != null) {
            existing.payload = value;
            return;
        }
        StoredValue v = new StoredValue();
        v.key = key;
        v.payload = value;
        persist(v);
    }

    @Override
    @Transactional
    public void delete(String key) {
        deleteById(key);
    }
}
