package com.example.librarysync;

import com.example.librarysync.common.config.AppCatalogProperties;
import com.example.librarysync.common.config.AppSecurityProperties;
import com.example.librarysync.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.librarysync.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSecurityProperties.class,
        AppCatalogProperties.class,
        AppSyncProperties.class
})
public class LibrarySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibrarySyncApplication.class, args);
    }
}
