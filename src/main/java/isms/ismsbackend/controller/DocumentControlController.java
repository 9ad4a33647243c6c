package isms.ismsbackend.controller;

import isms.ismsbackend.dto.request.ControlLinkRequestDto;
import isms.ismsbackend.dto.response.ControlSummaryDto;
import isms.ismsbackend.service.document.DocumentControlService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents/{id}/controls")
@RequiredArgsConstructor
public class DocumentControlController {

    private final DocumentControlService documentControlService;

    @GetMapping
    public ResponseEntity<List<ControlSummaryDto>> listControls(@PathVariable String id) {
        return ResponseEntity.ok(documentControlService.listControls(id));
    }

    @PostMapping
    public ResponseEntity<ControlSummaryDto> linkControl(
            @PathVariable String id,
            @Valid @RequestBody ControlLinkRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(documentControlService.linkControl(id, request.getControlId()));
    }

    @DeleteMapping("/{controlId}")
    public ResponseEntity<Void> unlinkControl(@PathVariable String id, @PathVariable String controlId) {
        documentControlService.unlinkControl(id, controlId);
        return ResponseEntity.noContent().build();
    }
}
