package com.fieldservice.sale.service;

import com.fieldservice.sale.model.AppSetting;
import com.fieldservice.sale.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SettingsService {

    private final AppSettingRepository appSettingRepository;

    public static final String KEY_SERVICE_ORDER_PREFIX = "service_order_prefix";
    public static final String KEY_SALE_ORDER_PREFIX = "sale_order_prefix";

    public static final String DEFAULT_SERVICE_ORDER_PREFIX = "FSO";
    public static final String DEFAULT_SALE_ORDER_PREFIX = "SO";

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    /**
     * Reads the service order prefix and locks its setting until the current transaction
     * ends, so that concurrent transactions cannot hand out the same number.
     */
    @Transactional
    public String lockServiceOrderPrefix() {
        return lockOrDefault(KEY_SERVICE_ORDER_PREFIX, DEFAULT_SERVICE_ORDER_PREFIX);
    }

    @Transactional
    public String lockSaleOrderPrefix() {
        return lockOrDefault(KEY_SALE_ORDER_PREFIX, DEFAULT_SALE_ORDER_PREFIX);
    }

    private String lockOrDefault(String key, String defaultValue) {
        return appSettingRepository.findBySettingKeyForUpdate(key)
                .map(AppSetting::getSettingValue)
                .filter(s -> !s.isBlank())
                .orElse(defaultValue);
    }
}
