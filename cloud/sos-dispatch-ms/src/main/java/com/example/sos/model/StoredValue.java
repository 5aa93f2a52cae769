package com.example.sos.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

@Entity
@Table(name = "kv_store")
public class StoredValue extends PanacheEntityBase {

    @Id
    @Column(name = "store_key", length = 128)
    public String key;

    @Lob
    @Column(name = "payload")
    public byte[] payload;
}
