package com.fieldservice.sale.repository;

import com.fieldservice.sale.model.ActivityMessage;
import com.fieldservice.sale.model.RecordType;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface ActivityMessageRepository extends JpaRepository<ActivityMessage, Long> {
    List<ActivityMessage> findByRecordTypeAndRecordIdOrderByIdAsc(RecordType recordType, Long recordId);
}
