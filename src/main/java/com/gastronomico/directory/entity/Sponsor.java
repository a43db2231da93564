package com.gastronomico.directory.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "sponsors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"cityLinks"})
@ToString(exclude = {"cityLinks"})
public class Sponsor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String name;

    @Column(nullable = false, unique = true, columnDefinition = "VARCHAR")
    private String email;

    @Column(columnDefinition = "VARCHAR")
    private String phone;

    @Column(columnDefinition = "VARCHAR")
    private String representative;

    /** Logo meant for light backgrounds, usually a URL or a data URI. */
    @Column(name = "logo_light", columnDefinition = "TEXT")
    private String logoLight;

    @Column(name = "logo_dark", columnDefinition = "TEXT")
    private String logoDark;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Only navigated by the join queries; rows are written through SponsorCityRepository
    @OneToMany(mappedBy = "sponsor", fetch = FetchType.LAZY)
    @Builder.Default
    private Set<SponsorCity> cityLinks = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
