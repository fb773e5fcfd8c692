package com.lunchmate.backend.common.store;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class StoreConfig {

    @Bean
    public KeyedWriteTemplate keyedWriteTemplate(PlatformTransactionManager transactionManager,
                                                 @Value("${app.store.write-retries:2}") int retries) {
        return new KeyedWriteTemplate(transactionManager, retries);
    }
}
