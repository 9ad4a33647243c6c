package isms.ismsbackend.dto.response;

import isms.ismsbackend.entity.control.Control;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ControlSummaryDto {
    private String id;
    private String code;
    private String title;
    private String category;
    private Boolean isStandardControl;

    public static ControlSummaryDto from(Control control) {
        return new ControlSummaryDto(control.getId(), control.getCode(), control.getTitle(),
                control.getCategory(), control.isStandardControl());
    }
}
