package isms.ismsbackend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 일괄 가져오기 결과 구분
 */
public enum ImportAction {
    CREATED("created"),
    UPDATED("updated");

    private final String value;

    ImportAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
