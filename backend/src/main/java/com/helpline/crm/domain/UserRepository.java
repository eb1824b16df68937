package com.helpline.crm.domain;

import com.helpline.crm.domain.Entities.Role;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.Entities.UserStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface UserRepository extends MongoRepository<UserEntity, String> {
  Optional<UserEntity> findByEmail(String email);
  Optional<UserEntity> findFirstByExtension(String extension);
  boolean existsByEmail(String email);
  long countByRole(Role role);
  long countByStatusNot(UserStatus status);
}
