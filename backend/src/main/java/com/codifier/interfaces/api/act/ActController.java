package com.codifier.interfaces.api.act;

import com.codifier.application.act.ActAppService;
import com.codifier.application.apply.ApplyAppService;
import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.IngestedLine;
import com.codifier.interfaces.api.dto.ActResponse;
import com.codifier.interfaces.api.dto.IngestActRequest;
import com.codifier.interfaces.api.dto.OutlineEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/acts")
@RequiredArgsConstructor
public class ActController {

    private final ActAppService actAppService;
    private final ApplyAppService applyAppService;

    @PostMapping
    public ResponseEntity<ActResponse> ingest(@Valid @RequestBody IngestActRequest request) {
        String documentId = request.documentId() == null || request.documentId().isBlank()
                ? UUID.randomUUID().toString()
                : request.documentId();
        Act act;
        if (request.lines() != null && !request.lines().isEmpty()) {
            List<IngestedLine> lines = request.lines().stream()
                    .map(l -> new IngestedLine(l.text(), l.page(), l.sectionPathHint()))
                    .toList();
            act = actAppService.ingest(documentId, request.title(), lines);
        } else if (request.text() != null && !request.text().isBlank()) {
            act = actAppService.ingestText(documentId, request.title(), request.text());
        } else {
            throw new IllegalArgumentException("Either lines or text is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ActResponse.from(act, false));
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<ActResponse> getHead(@PathVariable String documentId,
                                               @RequestParam(defaultValue = "true") boolean lines) {
        return ResponseEntity.ok(ActResponse.from(actAppService.getHead(documentId), lines));
    }

    @GetMapping("/{documentId}/versions/{version}")
    public ResponseEntity<ActResponse> getVersion(@PathVariable String documentId, @PathVariable int version) {
        return ResponseEntity.ok(ActResponse.from(actAppService.getVersion(documentId, version), true));
    }

    @GetMapping("/{documentId}/history")
    public ResponseEntity<List<ActResponse>> history(@PathVariable String documentId) {
        List<ActResponse> versions = actAppService.getHistory(documentId).stream()
                .map(act -> ActResponse.from(act, false))
                .toList();
        return ResponseEntity.ok(versions);
    }

    @GetMapping("/{documentId}/outline")
    public ResponseEntity<List<OutlineEntryResponse>> outline(@PathVariable String documentId) {
        return ResponseEntity.ok(actAppService.getOutline(documentId).stream()
                .map(OutlineEntryResponse::from)
                .toList());
    }

    @PostMapping("/{documentId}/revert")
    public ResponseEntity<ActResponse> revert(@PathVariable String documentId) {
        return ResponseEntity.ok(ActResponse.from(applyAppService.revert(documentId), false));
    }
}
