package com.example.datadestruction.config;

import com.example.datadestruction.models.TargetTable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the scheduled destruction job.
 * These values are bound from application.yml (destruction.batch.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 * To enable the job, set destruction.batch.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "destruction.batch")
@Validated
@Data
public class BatchDestructionProperties {

    private boolean enabled = false;
    private String schedule = "0 30 7 * * *";  // Daily at 07:30
    private String zone = "UTC";
    @NotBlank
    private String registryDataset = "FlatConnect";
    @NotBlank
    private String registryTable = "participants_JP";
    @Valid
    private List<Target> targets = new ArrayList<>(List.of(
            new Target("ForTestingOnly", "roi_physical_activity", "Connect_ID")));

    /**
     * A derived table cleaned by the job. Adding a table is a configuration change.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Target {
        @NotBlank
        private String dataset;
        @NotBlank
        private String table;
        @NotBlank
        private String keyColumn = "Connect_ID";

        public TargetTable in(String project) {
            return new TargetTable(project, dataset, table, keyColumn);
        }
    }
}
