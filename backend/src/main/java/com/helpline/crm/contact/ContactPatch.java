package com.helpline.crm.contact;

import org.springframework.data.mongodb.core.query.Update;

import java.util.List;

/** Partial contact change; only non-null fields are written. */
public record ContactPatch(String phoneNumber, String name, String email, String address, String company, List<String> tags) {
  Update toUpdate() {
    Update update = new Update();
    if (phoneNumber != null) update.set("phoneNumber", phoneNumber);
    if (name != null) update.set("name", name);
    if (email != null) update.set("email", email);
    if (address != null) update.set("address", address);
    if (company != null) update.set("company", company);
    if (tags != null) update.set("tags", List.copyOf(tags));
    return update;
  }
}
