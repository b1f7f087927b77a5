package org.caureq.homesentry;

import org.caureq.homesentry.config.HomeSentryProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(HomeSentryProps.class)
public class HomeSentryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HomeSentryApplication.class, args);
    }

}
