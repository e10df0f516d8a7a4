package com.securehealth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field policy table bound from {@code securehealth.field-policy.entities.<kind>.<field>}.
 * An empty table selects the built-in policy.
 */
@Data
@ConfigurationProperties(prefix = "securehealth.field-policy")
public class FieldPolicyProperties {

    private Map<String, Map<String, String>> entities = new LinkedHashMap<>();
}
