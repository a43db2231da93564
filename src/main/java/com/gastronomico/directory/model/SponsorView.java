package com.gastronomico.directory.model;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A sponsor together with its associated cities. {@code cityNames} and
 * {@code cityIds} are parallel: the n-th name belongs to the n-th id.
 * Both are empty, never null, for a sponsor without cities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SponsorView {

    private Long id;
    private String name;
    private String email;
    private String phone;
    private String representative;
    private String logoLight;
    private String logoDark;
    private LocalDateTime createdAt;

    @Builder.Default
    private List<String> cityNames = new ArrayList<>();

    @Builder.Default
    private List<Long> cityIds = new ArrayList<>();
}
