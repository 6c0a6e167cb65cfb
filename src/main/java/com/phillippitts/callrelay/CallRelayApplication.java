package com.phillippitts.callrelay;

import com.phillippitts.callrelay.config.properties.CallProperties;
import com.phillippitts.callrelay.config.properties.ConnectionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CallProperties.class,
        ConnectionProperties.class
})
@EnableScheduling
public class CallRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallRelayApplication.class, args);
    }

}
