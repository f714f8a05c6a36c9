package com.openforge.alchemy;

import com.openforge.alchemy.store.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StoreProperties.class)
public class AlchemyStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlchemyStoreApplication.class, args);
    }
}
