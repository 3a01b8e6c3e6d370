package com.phillippitts.visqol;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.config.engine.VisqolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        VisqolProperties.class,
        NativeVisqolConfig.class
})
public class VisqolApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VisqolApplication.class, args)));
    }

}
