package com.phillippitts.messagebridge;

import com.phillippitts.messagebridge.config.properties.ApiProperties;
import com.phillippitts.messagebridge.config.properties.AutoReplyProperties;
import com.phillippitts.messagebridge.config.properties.AutomationProperties;
import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WatcherProperties.class,
        AutomationProperties.class,
        AutoReplyProperties.class,
        ApiProperties.class
})
public class MessageBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MessageBridgeApplication.class, args);
    }

}
