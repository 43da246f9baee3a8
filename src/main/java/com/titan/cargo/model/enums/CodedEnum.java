package com.titan.cargo.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.titan.cargo.exception.BadRequestException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Enum whose JSON form is a lower-case code such as {@code in-transit}.
 */
public interface CodedEnum {

    @JsonValue
    String getValue();

    /**
     * Resolves a wire value to its constant.
     *
     * @throws BadRequestException when the value is missing or not part of the set
     */
    static <E extends Enum<E> & CodedEnum> E parse(Class<E> type, String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new BadRequestException(field + " is required");
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equals(raw)) {
                return constant;
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(CodedEnum::getValue)
                .collect(Collectors.joining(", "));
        throw new BadRequestException("Invalid " + field + " '" + raw + "', expected one of: " + allowed);
    }
}
