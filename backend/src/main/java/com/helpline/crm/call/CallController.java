package com.helpline.crm.call;

import com.helpline.crm.domain.Entities.CallEntity;
import com.helpline.crm.domain.Entities.UserEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@RestController @RequestMapping("/api/calls")
public class CallController {
  private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final CallService calls;
  private final Clock clock;
  public CallController(CallService calls, Clock clock){this.calls=calls;this.clock=clock;}

  public record CallCreateReq(@NotBlank String callerNumber, @PositiveOrZero Integer duration, String notes, String callType,
                              String priority, String status, String resolutionNotes, String contactId){
    CallDraft toDraft(){
      return new CallDraft(callerNumber, duration == null ? 0 : duration, notes, callType,
          priority == null ? null : CallFilter.parsePriority(priority),
          status == null ? null : CallFilter.parseStatus(status),
          resolutionNotes, contactId);
    }
  }

  public record CallUpdateReq(@PositiveOrZero Integer duration, String notes, String callType, String priority, String status, String resolutionNotes){
    CallPatch toPatch(){
      return new CallPatch(duration, notes, callType,
          priority == null ? null : CallFilter.parsePriority(priority),
          status == null ? null : CallFilter.parseStatus(status),
          resolutionNotes);
    }
  }

  @GetMapping
  List<CallEntity> list(
      @RequestParam(required = false) String search,
      @RequestParam(name = "call_type", required = false) String callType,
      @RequestParam(required = false) String priority,
      @RequestParam(required = false) String status,
      @RequestParam(name = "date_from", required = false) String dateFrom,
      @RequestParam(name = "date_to", required = false) String dateTo
  ){
    return calls.list(new CallFilter(search, callType, priority, status, dateFrom, dateTo));
  }

  @PostMapping
  CallEntity create(@Valid @RequestBody CallCreateReq req,
                    @RequestParam(name = "call_event_id", required = false) String callEventId,
                    @AuthenticationPrincipal UserEntity user){
    return calls.create(user, req.toDraft(), callEventId);
  }

  @GetMapping("/stats")
  CallStats stats(){
    return calls.stats();
  }

  @GetMapping("/export/csv")
  ResponseEntity<String> exportCsv(
      @RequestParam(required = false) String search,
      @RequestParam(name = "call_type", required = false) String callType,
      @RequestParam(required = false) String priority,
      @RequestParam(required = false) String status,
      @RequestParam(name = "date_from", required = false) String dateFrom,
      @RequestParam(name = "date_to", required = false) String dateTo
  ){
    String body = calls.exportCsv(new CallFilter(search, callType, priority, status, dateFrom, dateTo));
    String filename = "calls_export_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv";
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
        .contentType(new MediaType("text", "csv"))
        .body(body);
  }

  @GetMapping("/{id}")
  CallEntity get(@PathVariable String id){
    return calls.get(id);
  }

  @PutMapping("/{id}")
  CallEntity update(@PathVariable String id, @Valid @RequestBody CallUpdateReq req){
    return calls.update(id, req.toPatch());
  }
}
