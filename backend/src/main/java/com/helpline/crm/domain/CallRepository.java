package com.helpline.crm.domain;

import com.helpline.crm.domain.Entities.CallEntity;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

public interface CallRepository extends MongoRepository<CallEntity, String> {
  long countByTimestampGreaterThanEqual(Instant since);
}
