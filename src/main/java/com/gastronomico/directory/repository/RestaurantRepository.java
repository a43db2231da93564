package com.gastronomico.directory.repository;

import com.gastronomico.directory.entity.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RestaurantRepository extends JpaRepository<Restaurant, Long> {

    @Query("""
        SELECT r FROM Restaurant r
        LEFT JOIN FETCH r.city
        ORDER BY r.createdAt DESC, r.id DESC
    """)
    List<Restaurant> findAllWithCity();

    @Query("""
        SELECT r FROM Restaurant r
        LEFT JOIN FETCH r.city
        WHERE r.id = :id
    """)
    Optional<Restaurant> findWithCityById(@Param("id") Long id);

    @Query("""
        SELECT r FROM Restaurant r
        LEFT JOIN FETCH r.city
        WHERE LOWER(r.officialName) LIKE LOWER(CONCAT('%', :fragment, '%'))
           OR LOWER(r.displayName) LIKE LOWER(CONCAT('%', :fragment, '%'))
           OR LOWER(r.representative) LIKE LOWER(CONCAT('%', :fragment, '%'))
           OR LOWER(r.email) LIKE LOWER(CONCAT('%', :fragment, '%'))
        ORDER BY r.officialName ASC, r.id ASC
    """)
    List<Restaurant> searchWithCity(@Param("fragment") String fragment);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Restaurant r WHERE r.id = :id")
    int deleteRestaurantById(@Param("id") Long id);
}
