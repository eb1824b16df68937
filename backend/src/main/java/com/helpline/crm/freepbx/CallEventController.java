package com.helpline.crm.freepbx;

import com.helpline.crm.domain.Entities.CallEventEntity;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.freepbx.CallEventService.CallEventPayload;
import com.helpline.crm.freepbx.CallEventService.CallEventResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController @RequestMapping("/api/freepbx")
public class CallEventController {
  private final CallEventService callEvents;
  public CallEventController(CallEventService callEvents){this.callEvents=callEvents;}

  public record CallEventReq(@NotBlank String eventType, @NotBlank String callerId, String extension, String agentUsername,
                             String callId, String timestamp, String direction){
    CallEventPayload toPayload(){ return new CallEventPayload(eventType, callerId, extension, agentUsername, callId, timestamp, direction); }
  }

  /** PBX webhook; authenticated by the {@code secret} query parameter rather than a bearer token. */
  @PostMapping("/call-event")
  CallEventResult callEvent(@Valid @RequestBody CallEventReq req, @RequestParam(name = "secret", required = false) String secret){
    return callEvents.receive(req.toPayload(), secret);
  }

  @GetMapping("/call-events")
  List<CallEventEntity> list(@RequestParam(name = "agent_id", required = false) String agentId,
                             @RequestParam(required = false) Boolean processed,
                             @RequestParam(defaultValue = "50") int limit,
                             @AuthenticationPrincipal UserEntity user){
    return callEvents.list(user, agentId, processed, limit);
  }

  @GetMapping("/call-events/{id}")
  CallEventEntity get(@PathVariable String id){
    return callEvents.get(id);
  }

  @PutMapping("/call-events/{id}/mark-processed")
  Map<String, Object> markProcessed(@PathVariable String id){
    callEvents.markProcessed(id);
    return Map.of("message", "Call event marked as processed");
  }

  @GetMapping("/pending-calls")
  List<CallEventEntity> pending(@AuthenticationPrincipal UserEntity user){
    return callEvents.pending(user);
  }
}
