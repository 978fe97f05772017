package com.brados.backend.plan.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "exercises")
@Getter @Setter @NoArgsConstructor
public class Exercise {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    /** lbs added on progression, removed on deload / regression */
    @Column(name = "weight_increment", nullable = false)
    private Double weightIncrement = 5.0;

    @Column(name = "is_custom", nullable = false)
    private boolean custom = false;
}
