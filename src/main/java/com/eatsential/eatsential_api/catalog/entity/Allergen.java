package com.eatsential.eatsential_api.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "allergens")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Allergen {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "allergens_seq_gen")
    @SequenceGenerator(name = "allergens_seq_gen", sequenceName = "allergens_seq", allocationSize = 1)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(name = "is_major_allergen", nullable = false)
    private boolean majorAllergen;

    @Column(length = 500)
    private String description;
}
