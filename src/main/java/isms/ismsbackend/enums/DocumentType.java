package isms.ismsbackend.enums;

public enum DocumentType {
    POLICY,
    PROCEDURE,
    MANUAL,
    RECORD,
    TEMPLATE,
    CERTIFICATE,
    OTHER
}
