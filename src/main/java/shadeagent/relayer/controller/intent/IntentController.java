package shadeagent.relayer.controller.intent;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.dto.intent.IntentAckResponse;
import shadeagent.relayer.dto.intent.IntentMessage;
import shadeagent.relayer.dto.intent.IntentStatusResponse;
import shadeagent.relayer.service.intent.IntentService;
import shadeagent.relayer.util.LogSanitizer;

@RestController
@RequestMapping("${endpoint.intents:/api/intents}")
@RequiredArgsConstructor
@Slf4j
public class IntentController {

    private final IntentService intentService;

    @PostMapping
    public ResponseEntity<IntentAckResponse> submitIntent(@Valid @RequestBody IntentMessage intent) {
        IntentAckResponse ack = intentService.submit(intent);
        log.info("Intent {} ACK state={}", LogSanitizer.sanitize(ack.getIntentId()), ack.getState());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<IntentStatusResponse> getIntentStatus(@PathVariable String intentId) {
        return ResponseEntity.ok(intentService.queryStatus(intentId));
    }
}
