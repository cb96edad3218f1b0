package edu.UOI.wyreframe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import edu.UOI.wyreframe.config.WyreframeProperties;

@SpringBootApplication
@EnableConfigurationProperties(WyreframeProperties.class)
public class WyreframeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WyreframeApplication.class, args);
    }
}
