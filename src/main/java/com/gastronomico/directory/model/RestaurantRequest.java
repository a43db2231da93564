package com.gastronomico.directory.model;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantRequest {

    private String officialName;
    private String displayName;
    private String description;
    private String representative;
    private Integer tableCount;
    private Long cityId;
    private String email;
    private String phone;
    private String instagram;
    private String logo;
    private String shortLocation;
    private String schedule;
    private List<Object> branches;
    private String proposals;
    private String editions;
    private String awards;
}
