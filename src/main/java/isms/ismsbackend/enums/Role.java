package isms.ismsbackend.enums;

public enum Role {
    ADMIN,
    EDITOR,
    CONTRIBUTOR,
    STAFF
}
