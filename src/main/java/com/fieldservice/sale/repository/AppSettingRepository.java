package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.AppSetting;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.Optional;

public interface AppSettingRepository extends JpaRepository<AppSetting, Long> {
    boolean existsBySettingKey(String settingKey);

    // Held until commit; serializes document numbering per prefix
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from AppSetting s where s.settingKey = :key")
    Optional<AppSetting> findBySettingKeyForUpdate(@Param("key") String settingKey);
}
