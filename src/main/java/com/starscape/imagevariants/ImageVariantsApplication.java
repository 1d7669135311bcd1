package com.starscape.imagevariants;

import com.starscape.imagevariants.common.config.ImageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ImageProperties.class)
public class ImageVariantsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageVariantsApplication.class, args);
    }
}
