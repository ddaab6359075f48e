package com.phillippitts.cvtailor;

import com.phillippitts.cvtailor.config.properties.BackendProperties;
import com.phillippitts.cvtailor.config.properties.CompilerProperties;
import com.phillippitts.cvtailor.config.properties.GenerationProperties;
import com.phillippitts.cvtailor.config.properties.LinkProperties;
import com.phillippitts.cvtailor.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GenerationProperties.class,
        BackendProperties.class,
        CompilerProperties.class,
        StorageProperties.class,
        LinkProperties.class
})
public class CvTailorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvTailorApplication.class, args);
    }

}
