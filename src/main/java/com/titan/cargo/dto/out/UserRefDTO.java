package com.titan.cargo.dto.out;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserRefDTO(
        String id,
        String name,
        String email
) {}
