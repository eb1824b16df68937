package com.helpline.crm.contact;

import com.helpline.crm.domain.Entities.ContactEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController @RequestMapping("/api/contacts")
public class ContactController {
  private final ContactService contacts;
  public ContactController(ContactService contacts){this.contacts=contacts;}

  public record ContactCreateReq(@NotBlank String phoneNumber, String name, String email, String address, String company, List<String> tags){
    ContactPatch toPatch(){ return new ContactPatch(phoneNumber, name, email, address, company, tags == null ? List.of() : tags); }
  }
  public record ContactUpdateReq(String phoneNumber, String name, String email, String address, String company, List<String> tags){
    ContactPatch toPatch(){ return new ContactPatch(phoneNumber, name, email, address, company, tags); }
  }

  @GetMapping
  List<ContactEntity> list(@RequestParam(required = false) String search, @RequestParam(required = false) String tag){
    return contacts.list(search, tag);
  }

  @PostMapping
  ContactEntity create(@Valid @RequestBody ContactCreateReq req){
    return contacts.create(req.toPatch());
  }

  @GetMapping("/by-phone/{phoneNumber}")
  Map<String, Object> byPhone(@PathVariable String phoneNumber){
    var found = contacts.findByPhone(phoneNumber);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("found", found.isPresent());
    body.put("contact", found.orElse(null));
    return body;
  }

  @GetMapping("/{id}")
  ContactEntity get(@PathVariable String id){
    return contacts.get(id);
  }

  @PutMapping("/{id}")
  ContactEntity update(@PathVariable String id, @RequestBody ContactUpdateReq req){
    return contacts.update(id, req.toPatch());
  }

  @DeleteMapping("/{id}")
  Map<String, Object> delete(@PathVariable String id){
    contacts.delete(id);
    return Map.of("message", "Contact deleted successfully");
  }
}
