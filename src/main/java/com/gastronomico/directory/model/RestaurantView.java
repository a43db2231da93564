package com.gastronomico.directory.model;

import com.gastronomico.directory.entity.City;
import com.gastronomico.directory.entity.Restaurant;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantView {

    private Long id;
    private String officialName;
    private String displayName;
    private String description;
    private String representative;
    private Integer tableCount;
    private Long cityId;
    private String cityName;                         // denormalized from the joined city
    private String email;
    private String phone;
    private String instagram;
    private String logo;
    private String shortLocation;
    private String schedule;

    @Builder.Default
    private List<Object> branches = new ArrayList<>();

    private String proposals;
    private String editions;
    private String awards;
    private LocalDateTime createdAt;

    /** Must be called while the city association can still be loaded. */
    public static RestaurantView from(Restaurant restaurant) {
        City city = restaurant.getCity();
        return RestaurantView.builder()
                .id(restaurant.getId())
                .officialName(restaurant.getOfficialName())
                .displayName(restaurant.getDisplayName())
                .description(restaurant.getDescription())
                .representative(restaurant.getRepresentative())
                .tableCount(restaurant.getTableCount())
                .cityId(city != null ? city.getId() : null)
                .cityName(city != null ? city.getName() : null)
                .email(restaurant.getEmail())
                .phone(restaurant.getPhone())
                .instagram(restaurant.getInstagram())
                .logo(restaurant.getLogo())
                .shortLocation(restaurant.getShortLocation())
                .schedule(restaurant.getSchedule())
                .branches(restaurant.getBranches() != null
                        ? new ArrayList<>(restaurant.getBranches())
                        : new ArrayList<>())
                .proposals(restaurant.getProposals())
                .editions(restaurant.getEditions())
                .awards(restaurant.getAwards())
                .createdAt(restaurant.getCreatedAt())
                .build();
    }
}
