package io.crosspost.publisher;

import io.crosspost.publisher.config.PublisherConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PublisherConfig.class)
@ConfigurationPropertiesScan
public class ContentPublisherApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ContentPublisherApplication.class, args)));
    }
}
