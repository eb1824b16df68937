package com.helpline.crm.contact;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.domain.ContactRepository;
import com.helpline.crm.domain.Entities.ContactEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class ContactService {
  private static final Logger log = LoggerFactory.getLogger(ContactService.class);
  static final int LIST_LIMIT = 1000;

  private final ContactRepository contacts;
  private final MongoOperations mongo;
  private final Clock clock;

  public ContactService(ContactRepository contacts, MongoOperations mongo, Clock clock) {
    this.contacts = contacts;
    this.mongo = mongo;
    this.clock = clock;
  }

  public List<ContactEntity> list(String search, String tag) {
    return mongo.find(listQuery(search, tag), ContactEntity.class);
  }

  static Query listQuery(String search, String tag) {
    List<Criteria> filters = new ArrayList<>();
    if (StringUtils.hasText(search)) {
      filters.add(containsAny(search, "name", "phoneNumber", "email", "company"));
    }
    if (StringUtils.hasText(tag)) {
      filters.add(Criteria.where("tags").is(tag));
    }
    Query query = filters.isEmpty() ? new Query() : new Query(new Criteria().andOperator(filters));
    return query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(LIST_LIMIT);
  }

  /** Case-insensitive substring match of {@code text} against any of {@code fields}. */
  public static Criteria containsAny(String text, String... fields) {
    String pattern = Pattern.quote(text.trim());
    Criteria[] alternatives = new Criteria[fields.length];
    for (int i = 0; i < fields.length; i++) {
      alternatives[i] = Criteria.where(fields[i]).regex(pattern, "i");
    }
    return new Criteria().orOperator(alternatives);
  }

  public ContactEntity create(ContactPatch fields) {
    if (!StringUtils.hasText(fields.phoneNumber())) throw ApiException.badRequest("phone_number is required");
    if (contacts.existsByPhoneNumber(fields.phoneNumber())) {
      throw ApiException.conflict("Contact with this phone number already exists");
    }
    Instant now = clock.instant();
    ContactEntity c = new ContactEntity();
    c.id = UUID.randomUUID().toString();
    c.phoneNumber = fields.phoneNumber();
    c.name = fields.name();
    c.email = fields.email();
    c.address = fields.address();
    c.company = fields.company();
    c.tags = fields.tags() == null ? new ArrayList<>() : new ArrayList<>(fields.tags());
    c.createdAt = now;
    c.updatedAt = now;
    contacts.insert(c);
    return c;
  }

  /** Contact created on the fly for a caller nobody has filed yet. */
  public ContactEntity createBare(String phoneNumber) {
    Instant now = clock.instant();
    ContactEntity c = new ContactEntity();
    c.id = UUID.randomUUID().toString();
    c.phoneNumber = phoneNumber;
    c.createdAt = now;
    c.updatedAt = now;
    contacts.insert(c);
    log.info("Auto-created contact {} for phone {}", c.id, phoneNumber);
    return c;
  }

  public ContactEntity get(String id) {
    return contacts.findById(id).orElseThrow(() -> ApiException.notFound("Contact not found"));
  }

  public Optional<ContactEntity> findById(String id) {
    return StringUtils.hasText(id) ? contacts.findById(id) : Optional.empty();
  }

  public Optional<ContactEntity> findByPhone(String phoneNumber) {
    return StringUtils.hasText(phoneNumber) ? contacts.findFirstByPhoneNumber(phoneNumber) : Optional.empty();
  }

  public ContactEntity update(String id, ContactPatch patch) {
    ContactEntity current = get(id);
    if (patch.phoneNumber() != null && !patch.phoneNumber().equals(current.phoneNumber)
        && contacts.existsByPhoneNumber(patch.phoneNumber())) {
      throw ApiException.conflict("Contact with this phone number already exists");
    }
    var update = patch.toUpdate().set("updatedAt", clock.instant());
    ContactEntity updated = mongo.findAndModify(
        Query.query(Criteria.where("id").is(id)),
        update,
        FindAndModifyOptions.options().returnNew(true),
        ContactEntity.class);
    if (updated == null) throw ApiException.notFound("Contact not found");
    return updated;
  }

  public void delete(String id) {
    if (!contacts.existsById(id)) throw ApiException.notFound("Contact not found");
    contacts.deleteById(id);
  }
}
