package com.example.roadcare.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Table("image")
public class ImageRow {
    @Id
    private UUID id;

    @Column("axe")
    private String axe;

    @Column("session_id")
    private String sessionId;

    @Column("cumuld")
    private Double cumuld;

    @Column("cumuld_session")
    private Double cumuldSession;

    @Column("sens")
    private String sens;

    @Column("index")
    private Integer index;

    @Column("captureDate")
    private LocalDateTime captureDate;

    @Column("note_globale")
    private Double noteGlobale;

    @Column("obsolette")
    private Boolean obsolette;
}
