package com.gastronomico.directory.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * One row of the sponsor/city association: "sponsor is active in city".
 * Both foreign keys cascade at the database level, so deleting either
 * parent removes the row without loading it.
 */
@Entity
@Table(name = "sponsor_cities",
       uniqueConstraints = @UniqueConstraint(columnNames = {"sponsor_id", "city_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"sponsor", "city"})
@ToString(exclude = {"sponsor", "city"})
public class SponsorCity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sponsor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Sponsor sponsor;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "city_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private City city;
}
