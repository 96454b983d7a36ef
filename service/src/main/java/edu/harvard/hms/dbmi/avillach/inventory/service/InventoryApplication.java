package edu.harvard.hms.dbmi.avillach.inventory.service;

import edu.harvard.hms.dbmi.avillach.inventory.ingest.config.IngestConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan("edu.harvard.hms.dbmi.avillach.inventory")
@EnableConfigurationProperties(IngestConfig.class)
public class InventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryApplication.class, args);
    }

}
