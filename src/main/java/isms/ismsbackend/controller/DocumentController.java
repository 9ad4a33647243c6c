package isms.ismsbackend.controller;

import isms.ismsbackend.dto.request.BulkImportRequestDto;
import isms.ismsbackend.dto.request.DocumentCreateRequestDto;
import isms.ismsbackend.dto.request.DocumentListFilter;
import isms.ismsbackend.dto.request.DocumentUpdateRequestDto;
import isms.ismsbackend.dto.response.BulkImportResultDto;
import isms.ismsbackend.dto.response.DocumentListResponseDto;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.service.document.DocumentCascadeDeleteService;
import isms.ismsbackend.service.document.DocumentImportService;
import isms.ismsbackend.service.document.DocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    static final String GRAPH_TOKEN_HEADER = "X-Graph-Token";

    private final DocumentService documentService;
    private final DocumentCascadeDeleteService cascadeDeleteService;
    private final DocumentImportService importService;

    /**
     * 문서 목록 (type, status, ownerId, nextReviewFrom, nextReviewTo, page, limit)
     */
    @GetMapping
    public ResponseEntity<DocumentListResponseDto> list(
            @Valid @ModelAttribute DocumentListFilter filter,
            @RequestHeader(value = GRAPH_TOKEN_HEADER, required = false) String graphToken) {
        return ResponseEntity.ok(documentService.list(filter, graphToken));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponseDto> get(@PathVariable String id) {
        return ResponseEntity.ok(documentService.get(id));
    }

    @PostMapping
    public ResponseEntity<DocumentResponseDto> create(
            @Valid @RequestBody DocumentCreateRequestDto request,
            @RequestHeader(value = GRAPH_TOKEN_HEADER, required = false) String graphToken,
            Authentication authentication) {
        DocumentResponseDto created = documentService.create(request, ActorResolver.from(authentication), graphToken);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<DocumentResponseDto> update(
            @PathVariable String id,
            @RequestBody DocumentUpdateRequestDto patch,
            @RequestHeader(value = GRAPH_TOKEN_HEADER, required = false) String graphToken,
            Authentication authentication) {
        return ResponseEntity.ok(documentService.update(id, patch, ActorResolver.from(authentication), graphToken));
    }

    /**
     * 기본은 소프트 삭제(SUPERSEDED), hard=true 이면 종속 레코드까지 영구 삭제
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<DocumentResponseDto> delete(
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean hard,
            Authentication authentication) {
        if (hard) {
            log.info("하드 삭제 요청: id={}, actor={}", id, authentication.getName());
            return ResponseEntity.ok(cascadeDeleteService.hardDelete(id));
        }
        return ResponseEntity.ok(documentService.softDelete(id));
    }

    @PostMapping("/bulk-import")
    public ResponseEntity<BulkImportResultDto> bulkImport(
            @Valid @RequestBody BulkImportRequestDto request,
            @RequestHeader(value = GRAPH_TOKEN_HEADER, required = false) String graphToken,
            Authentication authentication) {
        return ResponseEntity.ok(importService.bulkImport(request, graphToken, ActorResolver.from(authentication)));
    }
}
