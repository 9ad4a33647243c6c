package isms.ismsbackend.enums;

/**
 * 문서 원본이 저장된 외부 시스템. 문서당 하나만 사용한다.
 */
public enum StorageLocation {
    SHAREPOINT,
    CONFLUENCE
}
