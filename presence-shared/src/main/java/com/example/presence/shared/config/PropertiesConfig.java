package com.example.presence.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Binds {@code presence.*}. The pod name is also the origin stamped on every bus envelope, so it
 * must differ between replicas; Kubernetes supplies it through {@code POD_NAME}.
 */
@Configuration
@Slf4j
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:presence-live-0}}")
    private String podName;

    @Value("${cluster.name:${CLUSTER_NAME:local}}")
    private String clusterName;

    @Bean
    @Validated
    @ConfigurationProperties(prefix = "presence")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.setPodName(podName);
        properties.setClusterName(clusterName);
        log.info("Presence node {} in cluster {}", podName, clusterName);
        return properties;
    }
}
