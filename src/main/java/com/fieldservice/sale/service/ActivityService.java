package com.fieldservice.sale.service;

import com.fieldservice.sale.model.ActivityMessage;
import com.fieldservice.sale.model.RecordType;
import com.fieldservice.sale.repository.ActivityMessageRepository;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ActivityService {

    private final ActivityMessageRepository messageRepository;

    public ActivityService(ActivityMessageRepository messageRepository) {
        this.messageRepository = messageRepository;
    }

    /**
     * Appends a note to the activity history of a record.
     */
    public ActivityMessage postMessage(RecordType recordType, Long recordId, String body) {
        ActivityMessage message = new ActivityMessage();
        message.setRecordType(recordType);
        message.setRecordId(recordId);
        message.setBody(body);

        var auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null) {
            message.setAuthor(auth.getName());
        } else {
            message.setAuthor("SYSTEM");
        }

        return messageRepository.save(message);
    }

    public List<ActivityMessage> history(RecordType recordType, Long recordId) {
        return messageRepository.findByRecordTypeAndRecordIdOrderByIdAsc(recordType, recordId);
    }
}
