package isms.ismsbackend.controller;

import isms.ismsbackend.dto.request.VersionUpdateRequestDto;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.dto.response.VersionHistoryResponseDto;
import isms.ismsbackend.dto.response.VersionNotesResponseDto;
import isms.ismsbackend.service.document.DocumentVersionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents/{id}")
@RequiredArgsConstructor
public class DocumentVersionController {

    private final DocumentVersionService versionService;

    /**
     * 버전 올리기. currentVersion이 다르면 409와 함께 실제 버전을 돌려준다.
     */
    @PostMapping("/version-updates")
    public ResponseEntity<DocumentResponseDto> advanceVersion(
            @PathVariable String id,
            @Valid @RequestBody VersionUpdateRequestDto request,
            Authentication authentication) {
        return ResponseEntity.ok(versionService.advanceVersion(id, request, ActorResolver.from(authentication)));
    }

    /**
     * @param version 생략 또는 "current" 이면 현재 버전
     */
    @GetMapping("/version-notes")
    public ResponseEntity<VersionNotesResponseDto> getVersionNotes(
            @PathVariable String id,
            @RequestParam(required = false) String version) {
        return ResponseEntity.ok(versionService.getVersionNotes(id, version));
    }

    @GetMapping("/version-history")
    public ResponseEntity<List<VersionHistoryResponseDto>> listVersionHistory(@PathVariable String id) {
        return ResponseEntity.ok(versionService.listVersionHistory(id));
    }
}
