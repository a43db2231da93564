package com.gastronomico.directory.model;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SponsorRequest {

    private String name;
    private String email;
    private String phone;
    private String representative;
    private String logoLight;
    private String logoDark;

    /** Desired full set of associated cities; null is treated like an empty list. */
    private List<Long> cityIds;
}
