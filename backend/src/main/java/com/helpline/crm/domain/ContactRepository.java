package com.helpline.crm.domain;

import com.helpline.crm.domain.Entities.ContactEntity;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ContactRepository extends MongoRepository<ContactEntity, String> {
  Optional<ContactEntity> findFirstByPhoneNumber(String phoneNumber);
  boolean existsByPhoneNumber(String phoneNumber);
}
