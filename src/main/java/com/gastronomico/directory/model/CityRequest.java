package com.gastronomico.directory.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CityRequest {

    private String name;
}
