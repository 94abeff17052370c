package com.example.mediareconcile.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.match")
public class AppMatchProperties {

    /**
     * A fuzzy candidate must score strictly above this value.
     */
    private double fuzzyThreshold = 0.8D;
}
