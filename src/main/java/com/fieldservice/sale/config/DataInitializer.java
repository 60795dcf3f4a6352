package com.fieldservice.sale.config;

import com.fieldservice.sale.model.AppSetting;
import com.fieldservice.sale.repository.AppSettingRepository;
import com.fieldservice.sale.service.SettingsService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DataInitializer {

    @Bean
    CommandLineRunner init(AppSettingRepository settingRepo) {
        return args -> {
            // Default document prefixes
            if (!settingRepo.existsBySettingKey(SettingsService.KEY_SERVICE_ORDER_PREFIX)) {
                settingRepo.save(new AppSetting(SettingsService.KEY_SERVICE_ORDER_PREFIX,
                        SettingsService.DEFAULT_SERVICE_ORDER_PREFIX));
            }
            if (!settingRepo.existsBySettingKey(SettingsService.KEY_SALE_ORDER_PREFIX)) {
                settingRepo.save(new AppSetting(SettingsService.KEY_SALE_ORDER_PREFIX,
                        SettingsService.DEFAULT_SALE_ORDER_PREFIX));
            }
        };
    }
}
