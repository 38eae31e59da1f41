package org.carball.cinebot.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk layout of the profile: {@code name} plus {@code preferences} keyed by category.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
class ProfileDocument {
    private String name;
    private Map<String, List<String>> preferences = new LinkedHashMap<>();
}
