package com.invoice.chargemap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "chargemap")
public class ChargeMappingProperties {

    private Batch batch = new Batch();
    private Report report = new Report();

    @Data
    public static class Batch {
        private boolean parallelEnabled = true;
        private int parallelThreshold = 64;
    }

    @Data
    public static class Report {
        private int unclassifiedSampleLimit = 10;
    }
}
