package com.example.sos.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

@Entity
@Table(name = "contacts")
public class Contact extends PanacheEntity {

    @Column(name = "name")
    public String name;

    @Column(name = "phone_number")
    public String phoneNumber;

    @Column(name = "relationship")
    public String relationship;

    @Enumerated(EnumType.STRING)
    @Column(name = "role")
    public ContactRole role;

    @Column(name = "verified")
    public boolean verified;

    @Column(name = "favorite")
    public boolean favorite;

    @Column(name = "email")
    public String email;

    @Column(name = "notes")
    public String notes;
}
