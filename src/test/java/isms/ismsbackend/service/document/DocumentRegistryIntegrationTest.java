package isms.ismsbackend.service.document;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.dto.request.DocumentCreateRequestDto;
import isms.ismsbackend.dto.request.DocumentUpdateRequestDto;
import isms.ismsbackend.dto.request.VersionUpdateRequestDto;
import isms.ismsbackend.dto.response.DocumentResponseDto;
import isms.ismsbackend.dto.response.VersionHistoryResponseDto;
import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.entity.control.Control;
import isms.ismsbackend.entity.document.Acknowledgment;
import isms.ismsbackend.entity.document.DocumentRisk;
import isms.ismsbackend.entity.document.DocumentVersionHistory;
import isms.ismsbackend.entity.document.ReviewTask;
import isms.ismsbackend.enums.DocumentStatus;
import isms.ismsbackend.enums.DocumentType;
import isms.ismsbackend.enums.Role;
import isms.ismsbackend.enums.StorageLocation;
import isms.ismsbackend.exception.VersionAlreadyExistsException;
import isms.ismsbackend.exception.VersionMismatchException;
import isms.ismsbackend.repository.UserRepository;
import isms.ismsbackend.repository.control.ControlRepository;
import isms.ismsbackend.repository.document.AcknowledgmentRepository;
import isms.ismsbackend.repository.document.DocumentControlRepository;
import isms.ismsbackend.repository.document.DocumentRepository;
import isms.ismsbackend.repository.document.DocumentRiskRepository;
import isms.ismsbackend.repository.document.DocumentVersionHistoryRepository;
import isms.ismsbackend.repository.document.ReviewTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;

/**
 * H2(MySQL 모드) 위에서 실제 트랜잭션/커밋 후 이벤트까지 포함한 문서 수명주기 검증
 */
@SpringBootTest
class DocumentRegistryIntegrationTest {

    @Autowired
    private DocumentService documentService;

    @Autowired
    private DocumentVersionService versionService;

    @Autowired
    private DocumentControlService documentControlService;

    @Autowired
    private DocumentCascadeDeleteService cascadeDeleteService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ControlRepository controlRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @SpyBean
    private DocumentVersionHistoryRepository historyRepository;

    @Autowired
    private ReviewTaskRepository reviewTaskRepository;

    @Autowired
    private AcknowledgmentRepository acknowledgmentRepository;

    @Autowired
    private DocumentControlRepository documentControlRepository;

    @Autowired
    private DocumentRiskRepository documentRiskRepository;

    private final AuthenticatedActor actor = new AuthenticatedActor("it-user", "it-user@example.com");

    @BeforeEach
    void setUp() {
        UserEntity user = new UserEntity();
        user.setId("it-user");
        user.setDisplayName("Integration Owner");
        user.setEmail("it-user@example.com");
        user.setRole(Role.EDITOR);
        userRepository.save(user);

        Control control = new Control();
        control.setId("ctl-it");
        control.setCode("A.5.1");
        control.setTitle("Policies for information security");
        controlRepository.save(control);
    }

    @AfterEach
    void tearDown() {
        reviewTaskRepository.deleteAll();
        acknowledgmentRepository.deleteAll();
        documentControlRepository.deleteAll();
        documentRiskRepository.deleteAll();
        historyRepository.deleteAll();
        documentRepository.deleteAll();
        controlRepository.deleteAll();
        userRepository.deleteAll();
    }

    private DocumentResponseDto createConfluencePolicy(String versionNotes) {
        DocumentCreateRequestDto request = new DocumentCreateRequestDto();
        request.setTitle("Information Security Policy");
        request.setType(DocumentType.POLICY);
        request.setStatus(DocumentStatus.APPROVED);
        request.setVersion("1.0");
        request.setOwnerUserId("it-user");
        request.setStorageLocation(StorageLocation.CONFLUENCE);
        request.setConfluenceSpaceKey("ISMS");
        request.setConfluencePageId("1001");
        request.setVersionNotes(versionNotes);
        return documentService.create(request, actor, null);
    }

    @Test
    @DisplayName("등록 시 버전 노트는 커밋 후 최초 이력으로 기록된다")
    void create_recordsInitialHistoryAfterCommit() {
        DocumentResponseDto created = createConfluencePolicy("initial release");

        assertThat(created.getRequiresAcknowledgement()).isTrue();
        assertThat(created.getDocumentUrl()).isEqualTo("https://wiki.example.com/pages/viewpage.action?pageId=1001");

        Optional<DocumentVersionHistory> entry = historyRepository.findByDocumentIdAndVersion(created.getId(), "1.0");
        assertThat(entry).isPresent();
        assertThat(entry.get().getNotes()).isEqualTo("initial release");
        assertThat(entry.get().getCreatedBy()).isEqualTo("it-user");
        assertThat(entry.get().getConfluencePageId()).isEqualTo("1001");
    }

    @Test
    @DisplayName("같은 버전에 대한 노트 기록을 반복해도 이력은 한 행")
    void versionNotes_upsertIsIdempotent() {
        DocumentResponseDto created = createConfluencePolicy(null);

        DocumentUpdateRequestDto first = new DocumentUpdateRequestDto();
        first.setVersionNotes("first");
        documentService.update(created.getId(), first, actor, null);

        DocumentUpdateRequestDto second = new DocumentUpdateRequestDto();
        second.setVersionNotes("second");
        documentService.update(created.getId(), second, actor, null);

        assertThat(historyRepository.countByDocumentId(created.getId())).isEqualTo(1);
        assertThat(versionService.getVersionNotes(created.getId(), "current").getNotes()).isEqualTo("second");
    }

    @Test
    @DisplayName("버전 올리기 후 이력 조회, 잘못된 기대 버전은 거절")
    void advanceVersion_endToEnd() {
        DocumentResponseDto created = createConfluencePolicy("initial release");

        VersionUpdateRequestDto request = new VersionUpdateRequestDto();
        request.setCurrentVersion("1.0");
        request.setNewVersion("1.1");
        request.setNotes("annual review");
        request.setNextReviewDate(Optional.of("2026-01-15"));

        DocumentResponseDto advanced = versionService.advanceVersion(created.getId(), request, actor);

        assertThat(advanced.getVersion()).isEqualTo("1.1");
        assertThat(advanced.getLastChangedDate()).isNotNull();
        assertThat(advanced.getNextReviewDate()).isEqualTo(LocalDateTime.of(2026, 1, 15, 0, 0));

        List<VersionHistoryResponseDto> history = versionService.listVersionHistory(created.getId());
        assertThat(history).extracting(VersionHistoryResponseDto::getVersion).containsExactlyInAnyOrder("1.0", "1.1");

        VersionUpdateRequestDto stale = new VersionUpdateRequestDto();
        stale.setCurrentVersion("1.0");
        stale.setNewVersion("1.2");
        stale.setNotes("stale");
        assertThatThrownBy(() -> versionService.advanceVersion(created.getId(), stale, actor))
                .isInstanceOfSatisfying(VersionMismatchException.class,
                        e -> assertThat(e.getCurrentVersion()).isEqualTo("1.1"));
    }

    @Test
    @DisplayName("동시 요청이 같은 버전 이력을 먼저 넣으면 유니크 제약 위반이 버전 중복으로 바뀌고 문서는 그대로")
    void advanceVersion_uniqueCollisionBecomesVersionAlreadyExists() {
        DocumentResponseDto created = createConfluencePolicy("initial release");
        String documentId = created.getId();

        // 다른 요청이 먼저 커밋한 1.1 이력
        DocumentVersionHistory concurrent = new DocumentVersionHistory();
        concurrent.setId(UUID.randomUUID().toString());
        concurrent.setDocumentId(documentId);
        concurrent.setVersion("1.1");
        concurrent.setNotes("concurrent writer");
        concurrent.setCreatedBy("it-user");
        concurrent.setUpdatedBy("it-user");
        historyRepository.saveAndFlush(concurrent);

        // 조회 시점에는 아직 보이지 않았던 상황
        doReturn(Optional.empty()).when(historyRepository).findByDocumentIdAndVersion(documentId, "1.1");

        VersionUpdateRequestDto request = new VersionUpdateRequestDto();
        request.setCurrentVersion("1.0");
        request.setNewVersion("1.1");
        request.setNotes("annual review");

        assertThatThrownBy(() -> versionService.advanceVersion(documentId, request, actor))
                .isInstanceOfSatisfying(VersionAlreadyExistsException.class, e -> {
                    assertThat(e.getVersion()).isEqualTo("1.1");
                    assertThat(e.getCause()).isInstanceOf(DataIntegrityViolationException.class);
                });

        assertThat(documentRepository.findById(documentId))
                .hasValueSatisfying(document -> assertThat(document.getVersion()).isEqualTo("1.0"));
        assertThat(historyRepository.countByDocumentId(documentId)).isEqualTo(2);
        assertThat(historyRepository.findAll())
                .filteredOn(entry -> "1.1".equals(entry.getVersion()))
                .extracting(DocumentVersionHistory::getNotes)
                .containsExactly("concurrent writer");
    }

    @Test
    @DisplayName("하드 삭제는 종속 레코드와 문서를 모두 지운다")
    void hardDelete_removesEverything() {
        DocumentResponseDto created = createConfluencePolicy("initial release");
        String documentId = created.getId();
        documentControlService.linkControl(documentId, "ctl-it");
        seedDependents(documentId);

        DocumentResponseDto deleted = cascadeDeleteService.hardDelete(documentId);

        assertThat(deleted.getId()).isEqualTo(documentId);
        assertThat(documentRepository.existsById(documentId)).isFalse();
        assertThat(reviewTaskRepository.count()).isZero();
        assertThat(acknowledgmentRepository.count()).isZero();
        assertThat(documentControlRepository.count()).isZero();
        assertThat(documentRiskRepository.count()).isZero();
        assertThat(historyRepository.countByDocumentId(documentId)).isZero();
        assertThat(controlRepository.existsById("ctl-it")).isTrue();
    }

    private void seedDependents(String documentId) {
        ReviewTask task = new ReviewTask();
        task.setId(UUID.randomUUID().toString());
        task.setDocumentId(documentId);
        task.setReviewerUserId("it-user");
        task.setDueDate(LocalDateTime.now().plusDays(7));
        reviewTaskRepository.save(task);

        Acknowledgment acknowledgment = new Acknowledgment();
        acknowledgment.setId(UUID.randomUUID().toString());
        acknowledgment.setDocumentId(documentId);
        acknowledgment.setUserId("it-user");
        acknowledgment.setDocumentVersion("1.0");
        acknowledgmentRepository.save(acknowledgment);

        documentRiskRepository.save(new DocumentRisk(documentId, "risk-1"));
    }
}
