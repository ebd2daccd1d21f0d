package com.phillippitts.presetgraph;

import com.phillippitts.presetgraph.config.properties.ExecutionProperties;
import com.phillippitts.presetgraph.config.properties.ProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ExecutionProperties.class,
        ProviderProperties.class
})
public class PresetGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(PresetGraphApplication.class, args);
    }

}
