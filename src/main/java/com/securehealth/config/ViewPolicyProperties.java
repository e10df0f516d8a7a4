package com.securehealth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role allow-lists bound from {@code securehealth.views.<kind>}. Kinds not configured keep
 * their built-in view policy.
 */
@Data
@ConfigurationProperties(prefix = "securehealth")
public class ViewPolicyProperties {

    private Map<String, EntityView> views = new LinkedHashMap<>();

    @Data
    public static class EntityView {
        private List<String> baseFields = new ArrayList<>();
        private Map<String, List<String>> roles = new LinkedHashMap<>();
    }
}
