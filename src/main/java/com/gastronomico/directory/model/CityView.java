package com.gastronomico.directory.model;

import com.gastronomico.directory.entity.City;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CityView {

    private Long id;
    private String name;
    private LocalDateTime createdAt;

    public static CityView from(City city) {
        return CityView.builder()
                .id(city.getId())
                .name(city.getName())
                .createdAt(city.getCreatedAt())
                .build();
    }
}
