package com.helpline.crm.domain;

import com.helpline.crm.domain.Entities.CallEventEntity;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CallEventRepository extends MongoRepository<CallEventEntity, String> {
}
