package com.gastronomico.directory.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "restaurants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"city"})
@ToString(exclude = {"city", "logo"})
public class Restaurant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "official_name", nullable = false, columnDefinition = "VARCHAR")
    private String officialName;

    @Column(name = "display_name", nullable = false, columnDefinition = "VARCHAR")
    private String displayName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "VARCHAR")
    private String representative;

    @Column(name = "table_count")
    private Integer tableCount;

    // Deleting the city keeps the restaurant and clears the reference
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "city_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private City city;

    @Column(columnDefinition = "VARCHAR")
    private String email;

    @Column(columnDefinition = "VARCHAR")
    private String phone;

    @Column(columnDefinition = "VARCHAR")
    private String instagram;

    @Column(columnDefinition = "TEXT")
    private String logo;

    @Column(name = "short_location", columnDefinition = "TEXT")
    private String shortLocation;

    @Column(columnDefinition = "TEXT")
    private String schedule;

    /**
     * Branch locations as submitted by the client. Entries are free-form
     * (usually objects with address/schedule keys) and are kept verbatim.
     */
    @Column(name = "branches", nullable = false, columnDefinition = "TEXT")
    @Convert(converter = JsonListConverter.class)
    @Builder.Default
    private List<Object> branches = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String proposals;

    @Column(columnDefinition = "TEXT")
    private String editions;

    @Column(columnDefinition = "TEXT")
    private String awards;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
