package io.github.jakubt4.panchang.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param latitude  decimal degrees, north positive
 * @param longitude decimal degrees, east positive
 * @param utcOffset offset all civil times in the record are expressed in, e.g. {@code +05:30}
 * @param city      caller-supplied place name, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Location(double latitude, double longitude, String utcOffset, String city) {
}
