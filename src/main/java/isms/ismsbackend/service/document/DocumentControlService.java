package isms.ismsbackend.service.document;

import isms.ismsbackend.dto.response.ControlSummaryDto;
import isms.ismsbackend.entity.control.Control;
import isms.ismsbackend.entity.document.DocumentControl;
import isms.ismsbackend.entity.document.DocumentControlId;
import isms.ismsbackend.exception.ControlAlreadyLinkedException;
import isms.ismsbackend.exception.ControlLinkNotFoundException;
import isms.ismsbackend.exception.ControlNotFoundException;
import isms.ismsbackend.exception.DocumentNotFoundException;
import isms.ismsbackend.repository.control.ControlRepository;
import isms.ismsbackend.repository.document.DocumentControlRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 문서 - 통제항목 연결 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentControlService {

    private final DocumentRepository documentRepository;
    private final ControlRepository controlRepository;
    private final DocumentControlRepository documentControlRepository;

    @Transactional(readOnly = true)
    public List<ControlSummaryDto> listControls(String documentId) {
        requireDocument(documentId);
        return documentControlRepository.findByDocumentIdWithControl(documentId).stream()
                .map(link -> ControlSummaryDto.from(link.getControl()))
                .toList();
    }

    @Transactional
    public ControlSummaryDto linkControl(String documentId, String controlId) {
        requireDocument(documentId);
        Control control = controlRepository.findById(controlId)
                .orElseThrow(() -> new ControlNotFoundException(controlId));

        if (documentControlRepository.existsById(new DocumentControlId(documentId, controlId))) {
            throw new ControlAlreadyLinkedException(documentId, controlId);
        }

        try {
            documentControlRepository.saveAndFlush(new DocumentControl(documentId, controlId));
        } catch (DataIntegrityViolationException e) {
            // 동시 요청으로 이미 연결된 경우
            throw new ControlAlreadyLinkedException(documentId, controlId, e);
        }

        log.info("통제항목 연결: documentId={}, controlId={}", documentId, controlId);
        return ControlSummaryDto.from(control);
    }

    @Transactional
    public void unlinkControl(String documentId, String controlId) {
        requireDocument(documentId);
        if (!controlRepository.existsById(controlId)) {
            throw new ControlNotFoundException(controlId);
        }

        DocumentControlId linkId = new DocumentControlId(documentId, controlId);
        if (!documentControlRepository.existsById(linkId)) {
            throw new ControlLinkNotFoundException(documentId, controlId);
        }

        documentControlRepository.deleteById(linkId);
        log.info("통제항목 연결 해제: documentId={}, controlId={}", documentId, controlId);
    }

    private void requireDocument(String documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
    }
}
